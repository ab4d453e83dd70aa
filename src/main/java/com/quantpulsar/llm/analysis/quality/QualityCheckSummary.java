package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualitySeverity;

import java.util.List;
import java.util.Objects;

/**
 * Roll-up of a list of quality checks. The overall status is the worst severity present.
 *
 * @param passed        checks that passed
 * @param warnings      checks with a warning
 * @param failures      checks that failed
 * @param averageScore  mean over scored checks, 0 when none is scored
 * @param overallStatus fail if any failed, else warning if any warned, else pass
 */
public record QualityCheckSummary(
        int passed,
        int warnings,
        int failures,
        double averageScore,
        QualitySeverity overallStatus) {

    public static QualityCheckSummary of(List<QualityCheck> checks) {
        int passed = count(checks, QualitySeverity.PASS);
        int warnings = count(checks, QualitySeverity.WARNING);
        int failures = count(checks, QualitySeverity.FAIL);
        double averageScore = checks.stream()
                .map(QualityCheck::score)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0);
        QualitySeverity overall = failures > 0 ? QualitySeverity.FAIL
                : warnings > 0 ? QualitySeverity.WARNING
                : QualitySeverity.PASS;
        return new QualityCheckSummary(passed, warnings, failures, averageScore, overall);
    }

    private static int count(List<QualityCheck> checks, QualitySeverity severity) {
        return (int) checks.stream().filter(c -> c.severity() == severity).count();
    }
}
