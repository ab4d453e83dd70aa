package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualityCheckType;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for QualityCheckSummary.
 */
class QualityCheckSummaryTest {

    private static QualityCheck check(Double score, QualitySeverity severity) {
        return new QualityCheck(QualityCheckType.CUSTOM, "c", score, severity, null, null);
    }

    @Test
    void emptyList_shouldPass() {
        QualityCheckSummary summary = QualityCheckSummary.of(List.of());

        assertThat(summary.overallStatus()).isEqualTo(QualitySeverity.PASS);
        assertThat(summary.averageScore()).isEqualTo(0.0);
    }

    @Test
    void worstSeverity_shouldWin() {
        QualityCheckSummary summary = QualityCheckSummary.of(List.of(
                check(0.9, QualitySeverity.PASS),
                check(0.5, QualitySeverity.WARNING),
                check(0.1, QualitySeverity.FAIL)));

        assertThat(summary.passed()).isEqualTo(1);
        assertThat(summary.warnings()).isEqualTo(1);
        assertThat(summary.failures()).isEqualTo(1);
        assertThat(summary.overallStatus()).isEqualTo(QualitySeverity.FAIL);
        assertThat(summary.averageScore()).isCloseTo(0.5, within(1e-9));
    }

    // Unscored checks do not drag the average down
    @Test
    void unscoredChecks_shouldBeExcludedFromAverage() {
        QualityCheckSummary summary = QualityCheckSummary.of(List.of(
                check(0.8, QualitySeverity.PASS),
                check(null, QualitySeverity.WARNING)));

        assertThat(summary.averageScore()).isCloseTo(0.8, within(1e-9));
        assertThat(summary.overallStatus()).isEqualTo(QualitySeverity.WARNING);
    }
}
