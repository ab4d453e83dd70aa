package com.quantpulsar.llm.analysis.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for FalsePositiveFilters.
 */
class FalsePositiveFiltersTest {

    @Test
    void bankAccount_shouldRejectShortZeroAndSequentialNumbers() {
        assertThat(FalsePositiveFilters.isBankAccount("9876543210")).isTrue();
        assertThat(FalsePositiveFilters.isBankAccount("12345678")).isFalse();
        assertThat(FalsePositiveFilters.isBankAccount("0000000000")).isFalse();
        assertThat(FalsePositiveFilters.isBankAccount("1234567890")).isFalse();
    }

    @Test
    void driversLicense_shouldRejectProtocolAbbreviations() {
        assertThat(FalsePositiveFilters.isDriversLicense("D1234567")).isTrue();
        assertThat(FalsePositiveFilters.isDriversLicense("API12345")).isFalse();
    }

    @Test
    void passport_shouldRejectCommonPrefixesUnlessCountryShaped() {
        assertThat(FalsePositiveFilters.isPassport("US123456")).isTrue();
        assertThat(FalsePositiveFilters.isPassport("AB123456")).isFalse();
        assertThat(FalsePositiveFilters.isPassport("X1234567")).isTrue();
    }

    @Test
    void awsSecret_shouldRequireMixedCaseAndDigits() {
        assertThat(FalsePositiveFilters.isAwsSecretKey("wJalrXUtnFEMI/K7MDENG/bPxRfiCYEXAMPLEKEY")).isTrue();
        assertThat(FalsePositiveFilters.isAwsSecretKey("e83c5163316f89bfbde7d9ab23ca2e25604af290")).isFalse();
        assertThat(FalsePositiveFilters.isAwsSecretKey("tooShort1A")).isFalse();
    }

    @Test
    void genericSecret_shouldRejectPlaceholderValues() {
        assertThat(FalsePositiveFilters.isGenericSecret("api_key=abc123def456")).isTrue();
        assertThat(FalsePositiveFilters.isGenericSecret("secret: 'none'")).isFalse();
        assertThat(FalsePositiveFilters.isGenericSecret("auth=undefined")).isFalse();
    }

    @Test
    void redactionTokens_shouldNeverSurvive() {
        assertThat(FalsePositiveFilters.REDACTION_TOKEN.matcher("[EMAIL_REDACTED]").find()).isTrue();
        assertThat(FalsePositiveFilters.REDACTION_TOKEN.matcher("[email]").find()).isFalse();
    }
}
