package com.quantpulsar.llm.analysis.security;

import com.quantpulsar.llm.analysis.model.SecuritySeverity;
import com.quantpulsar.llm.analysis.pattern.MatchFilter;
import com.quantpulsar.llm.analysis.pattern.PatternRule;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Per-rule false positive filters for the PII and sensitive data catalogs.
 * Rules without a dedicated filter keep every match, except matches that
 * already contain a redaction token.
 */
final class FalsePositiveFilters {

    static final Pattern REDACTION_TOKEN = Pattern.compile("\\[[A-Z0-9_]+_REDACTED]");

    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern ALL_ZEROS = Pattern.compile("^0+$");
    private static final Pattern SEQUENTIAL = Pattern.compile("^1234567890?$");

    private static final List<String> PROTOCOL_ABBREVIATIONS = List.of("HTTP", "HTTPS", "HTML", "JSON", "XML", "API", "URL");

    private static final Pattern PASSPORT_SHAPE = Pattern.compile("^[A-Z]{2}\\d{6}$");
    private static final Pattern PASSPORT_COUNTRY = Pattern.compile("^(US|UK|CA|AU|EU)");
    private static final Set<String> NON_PASSPORT_PREFIXES = Set.of("AB", "CD", "ID", "NO", "OK", "US");

    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");

    private static final Pattern PLACEHOLDER_VALUE = Pattern.compile(
            "^[\"']?(true|false|null|undefined|none|empty)[\"']?$", Pattern.CASE_INSENSITIVE);

    static final MatchFilter<SecuritySeverity> PII = (rule, matches) -> keep(matches, piiPredicate(rule));

    static final MatchFilter<SecuritySeverity> SENSITIVE_DATA = (rule, matches) -> keep(matches, sensitivePredicate(rule));

    private FalsePositiveFilters() {
    }

    private static List<String> keep(List<String> matches, Predicate<String> valid) {
        return matches.stream()
                .filter(m -> !REDACTION_TOKEN.matcher(m).find())
                .filter(valid)
                .toList();
    }

    private static Predicate<String> piiPredicate(PatternRule<SecuritySeverity> rule) {
        return switch (rule.name()) {
            case "bank_account" -> FalsePositiveFilters::isBankAccount;
            case "drivers_license" -> FalsePositiveFilters::isDriversLicense;
            case "passport" -> FalsePositiveFilters::isPassport;
            default -> m -> true;
        };
    }

    private static Predicate<String> sensitivePredicate(PatternRule<SecuritySeverity> rule) {
        return switch (rule.name()) {
            case "aws_secret_key_candidate" -> FalsePositiveFilters::isAwsSecretKey;
            case "generic_secret" -> FalsePositiveFilters::isGenericSecret;
            default -> m -> true;
        };
    }

    static boolean isBankAccount(String match) {
        if (NON_DIGIT.matcher(match).replaceAll("").length() < 10) {
            return false;
        }
        return !ALL_ZEROS.matcher(match).matches() && !SEQUENTIAL.matcher(match).matches();
    }

    static boolean isDriversLicense(String match) {
        String upper = match.toUpperCase(Locale.ROOT);
        return PROTOCOL_ABBREVIATIONS.stream().noneMatch(upper::startsWith);
    }

    static boolean isPassport(String match) {
        if (PASSPORT_SHAPE.matcher(match).matches() && PASSPORT_COUNTRY.matcher(match).find()) {
            return true;
        }
        return match.length() < 2 || !NON_PASSPORT_PREFIXES.contains(match.substring(0, 2));
    }

    static boolean isAwsSecretKey(String match) {
        return match.length() == 40
                && LOWER.matcher(match).find()
                && UPPER.matcher(match).find()
                && DIGIT.matcher(match).find();
    }

    static boolean isGenericSecret(String match) {
        String[] parts = match.split("[:=]");
        String value = parts.length > 1 ? parts[1].trim() : "";
        return !PLACEHOLDER_VALUE.matcher(value).matches();
    }
}
