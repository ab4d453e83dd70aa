package com.quantpulsar.llm.analysis.extraction;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualityCheckType;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import com.quantpulsar.llm.analysis.model.SecurityCheck;
import com.quantpulsar.llm.analysis.model.SecurityCheckType;
import com.quantpulsar.llm.analysis.model.SecuritySeverity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads quality and security findings that an instrumentation already recorded
 * on a span, e.g. {@code llm.quality.relevance.score=0.4} or
 * {@code llm.security.pii.detected=true}. Values are merged into one finding per check name.
 *
 * @author Quantpulsar 2025-2026
 */
public class EmbeddedCheckExtractor {

    enum Part { SCORE, SEVERITY, VALUE, DETECTED }

    /** A tag-key shape; {@code fixedName} replaces the captured name when set. */
    record KeyPattern(Pattern pattern, Part part, String fixedName) {

        String checkName(Matcher matcher) {
            return fixedName != null ? fixedName : matcher.group(1);
        }
    }

    static final List<KeyPattern> QUALITY_KEYS = List.of(
            new KeyPattern(Pattern.compile("^llm\\.quality\\.(\\w+)\\.score$"), Part.SCORE, null),
            new KeyPattern(Pattern.compile("^llm\\.quality\\.(\\w+)\\.severity$"), Part.SEVERITY, null),
            new KeyPattern(Pattern.compile("^llm\\.quality\\.(\\w+)$"), Part.VALUE, null),
            new KeyPattern(Pattern.compile("^quality_check\\.(\\w+)$"), Part.VALUE, null));

    static final List<KeyPattern> SECURITY_KEYS = List.of(
            new KeyPattern(Pattern.compile("^llm\\.security\\.(\\w+)\\.detected$"), Part.DETECTED, null),
            new KeyPattern(Pattern.compile("^llm\\.security\\.(\\w+)\\.severity$"), Part.SEVERITY, null),
            new KeyPattern(Pattern.compile("^llm\\.security\\.(\\w+)$"), Part.VALUE, null),
            new KeyPattern(Pattern.compile("^security_check\\.(\\w+)$"), Part.VALUE, null),
            new KeyPattern(Pattern.compile("^prompt_injection\\.detected$"), Part.DETECTED, "prompt_injection"),
            new KeyPattern(Pattern.compile("^pii\\.detected$"), Part.DETECTED, "pii_detected"));

    private static final class QualityParts {
        Double score;
        QualitySeverity severity;
    }

    private static final class SecurityParts {
        Boolean detected;
        SecuritySeverity severity;
    }

    public List<QualityCheck> extractQualityChecks(Map<String, String> tags) {
        Map<String, QualityParts> found = new LinkedHashMap<>();
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            for (KeyPattern keyPattern : QUALITY_KEYS) {
                Matcher matcher = keyPattern.pattern().matcher(tag.getKey());
                if (!matcher.matches()) {
                    continue;
                }
                QualityParts parts = found.computeIfAbsent(keyPattern.checkName(matcher), k -> new QualityParts());
                switch (keyPattern.part()) {
                    case SEVERITY -> parts.severity = QualitySeverity.parse(tag.getValue());
                    case SCORE -> parts.score = TolerantNumbers.parseDouble(tag.getValue());
                    default -> {
                        Double numeric = TolerantNumbers.parseDouble(tag.getValue());
                        if (numeric != null) {
                            parts.score = numeric;
                        }
                    }
                }
            }
        }

        List<QualityCheck> checks = new ArrayList<>(found.size());
        found.forEach((name, parts) -> checks.add(new QualityCheck(
                QualityCheckType.fromName(name),
                name,
                parts.score,
                parts.severity != null ? parts.severity : severityFromScore(parts.score),
                null,
                null)));
        return checks;
    }

    public List<SecurityCheck> extractSecurityChecks(Map<String, String> tags) {
        Map<String, SecurityParts> found = new LinkedHashMap<>();
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            for (KeyPattern keyPattern : SECURITY_KEYS) {
                Matcher matcher = keyPattern.pattern().matcher(tag.getKey());
                if (!matcher.matches()) {
                    continue;
                }
                SecurityParts parts = found.computeIfAbsent(keyPattern.checkName(matcher), k -> new SecurityParts());
                if (keyPattern.part() == Part.SEVERITY) {
                    parts.severity = SecuritySeverity.parse(tag.getValue());
                } else {
                    parts.detected = isTruthy(tag.getValue());
                }
            }
        }

        List<SecurityCheck> checks = new ArrayList<>(found.size());
        found.forEach((name, parts) -> {
            boolean detected = Boolean.TRUE.equals(parts.detected);
            SecuritySeverity severity = parts.severity != null
                    ? parts.severity
                    : (detected ? SecuritySeverity.HIGH : SecuritySeverity.LOW);
            checks.add(new SecurityCheck(SecurityCheckType.fromName(name), name, detected, severity, null, null, null));
        });
        return checks;
    }

    // score > 0.7 pass, > 0.3 warning, otherwise fail; unscored checks pass
    static QualitySeverity severityFromScore(Double score) {
        if (score == null) {
            return QualitySeverity.PASS;
        }
        if (score > 0.7) {
            return QualitySeverity.PASS;
        }
        return score > 0.3 ? QualitySeverity.WARNING : QualitySeverity.FAIL;
    }

    private static boolean isTruthy(String value) {
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }
}
