package com.quantpulsar.llm.analysis.security;

import com.quantpulsar.llm.analysis.model.SecurityCheck;
import com.quantpulsar.llm.analysis.model.SecurityCheckType;
import com.quantpulsar.llm.analysis.model.SecuritySeverity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Roll-up of a list of security checks.
 *
 * @param totalChecks    number of checks
 * @param detected       checks that detected something
 * @param notDetected    checks that found nothing
 * @param bySeverity     detected checks per severity, every severity present
 * @param byType         status per check type, every type present
 * @param criticalIssues detected checks with critical severity
 * @param highIssues     detected checks with high severity
 * @param overallRisk    highest severity among detected checks, low when none
 * @author Quantpulsar 2025-2026
 */
public record SecurityCheckSummary(
        int totalChecks,
        int detected,
        int notDetected,
        Map<SecuritySeverity, Integer> bySeverity,
        Map<SecurityCheckType, TypeStatus> byType,
        List<SecurityCheck> criticalIssues,
        List<SecurityCheck> highIssues,
        SecuritySeverity overallRisk) {

    /** Detection state of one check type. */
    public record TypeStatus(boolean detected, SecuritySeverity severity) {

        static final TypeStatus CLEAR = new TypeStatus(false, SecuritySeverity.LOW);
    }

    public static SecurityCheckSummary of(List<SecurityCheck> checks) {
        Map<SecuritySeverity, Integer> bySeverity = new EnumMap<>(SecuritySeverity.class);
        for (SecuritySeverity severity : SecuritySeverity.values()) {
            bySeverity.put(severity, 0);
        }
        Map<SecurityCheckType, TypeStatus> byType = new EnumMap<>(SecurityCheckType.class);
        for (SecurityCheckType type : SecurityCheckType.values()) {
            byType.put(type, TypeStatus.CLEAR);
        }
        List<SecurityCheck> critical = new ArrayList<>();
        List<SecurityCheck> high = new ArrayList<>();
        int detected = 0;
        SecuritySeverity overall = SecuritySeverity.LOW;

        for (SecurityCheck check : checks) {
            if (!check.detected()) {
                continue;
            }
            detected++;
            bySeverity.merge(check.severity(), 1, Integer::sum);
            byType.put(check.type(), new TypeStatus(true, check.severity()));
            overall = SecuritySeverity.max(overall, check.severity());
            if (check.severity() == SecuritySeverity.CRITICAL) {
                critical.add(check);
            } else if (check.severity() == SecuritySeverity.HIGH) {
                high.add(check);
            }
        }
        return new SecurityCheckSummary(checks.size(), detected, checks.size() - detected,
                Collections.unmodifiableMap(bySeverity), Collections.unmodifiableMap(byType),
                List.copyOf(critical), List.copyOf(high), overall);
    }

    /** True when a detected PII check mentions the given PII rule name, e.g. {@code "email"}. */
    public static boolean hasPiiType(List<SecurityCheck> checks, String piiType) {
        String needle = piiType.toLowerCase(Locale.ROOT);
        return checks.stream()
                .filter(c -> c.type() == SecurityCheckType.PII_DETECTED && c.detected() && c.details() != null)
                .anyMatch(c -> c.details().toLowerCase(Locale.ROOT).contains(needle));
    }

    public static boolean hasCriticalSecurityIssue(List<SecurityCheck> checks) {
        return checks.stream().anyMatch(c -> c.detected() && c.severity() == SecuritySeverity.CRITICAL);
    }

    public static boolean hasSecurityIssue(List<SecurityCheck> checks) {
        return checks.stream().anyMatch(SecurityCheck::detected);
    }
}
