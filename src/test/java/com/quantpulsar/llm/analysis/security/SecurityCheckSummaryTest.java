package com.quantpulsar.llm.analysis.security;

import com.quantpulsar.llm.analysis.model.SecurityCheck;
import com.quantpulsar.llm.analysis.model.SecurityCheckType;
import com.quantpulsar.llm.analysis.model.SecuritySeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for SecurityCheckSummary.
 */
class SecurityCheckSummaryTest {

    private static SecurityCheck check(SecurityCheckType type, boolean detected, SecuritySeverity severity,
                                       String details) {
        return new SecurityCheck(type, type.value(), detected, severity, details, null, null);
    }

    private final List<SecurityCheck> checks = List.of(
            check(SecurityCheckType.PROMPT_INJECTION, true, SecuritySeverity.HIGH, "Detected patterns: act_as"),
            check(SecurityCheckType.JAILBREAK_ATTEMPT, false, SecuritySeverity.LOW, null),
            check(SecurityCheckType.PII_DETECTED, true, SecuritySeverity.CRITICAL, "Found: ssn (1), email (2)"),
            check(SecurityCheckType.SENSITIVE_DATA, false, SecuritySeverity.LOW, null));

    @Test
    void summary_shouldCountAndRank() {
        SecurityCheckSummary summary = SecurityCheckSummary.of(checks);

        assertThat(summary.totalChecks()).isEqualTo(4);
        assertThat(summary.detected()).isEqualTo(2);
        assertThat(summary.notDetected()).isEqualTo(2);
        assertThat(summary.overallRisk()).isEqualTo(SecuritySeverity.CRITICAL);
        assertThat(summary.bySeverity())
                .containsEntry(SecuritySeverity.CRITICAL, 1)
                .containsEntry(SecuritySeverity.HIGH, 1)
                .containsEntry(SecuritySeverity.LOW, 0);
        assertThat(summary.criticalIssues()).hasSize(1);
        assertThat(summary.highIssues()).hasSize(1);
        assertThat(summary.byType().get(SecurityCheckType.PII_DETECTED))
                .isEqualTo(new SecurityCheckSummary.TypeStatus(true, SecuritySeverity.CRITICAL));
        assertThat(summary.byType().get(SecurityCheckType.JAILBREAK_ATTEMPT).detected()).isFalse();
    }

    @Test
    void noDetections_shouldBeLowRisk() {
        SecurityCheckSummary summary = SecurityCheckSummary.of(List.of(
                check(SecurityCheckType.PII_DETECTED, false, SecuritySeverity.LOW, null)));

        assertThat(summary.overallRisk()).isEqualTo(SecuritySeverity.LOW);
        assertThat(summary.criticalIssues()).isEmpty();
    }

    @Test
    void helpers_shouldInspectDetectedChecks() {
        assertThat(SecurityCheckSummary.hasPiiType(checks, "email")).isTrue();
        assertThat(SecurityCheckSummary.hasPiiType(checks, "iban")).isFalse();
        assertThat(SecurityCheckSummary.hasCriticalSecurityIssue(checks)).isTrue();
        assertThat(SecurityCheckSummary.hasSecurityIssue(checks)).isTrue();
        assertThat(SecurityCheckSummary.hasSecurityIssue(List.of())).isFalse();
    }
}
