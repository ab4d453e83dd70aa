package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualitySeverity;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ScoreDirection threshold semantics.
 */
class ScoreDirectionTest {

    @ParameterizedTest
    @CsvSource({
            "0.0, PASS",
            "0.29, PASS",
            "0.3, WARNING",
            "0.59, WARNING",
            "0.6, FAIL",
            "1.0, FAIL"
    })
    void risk_shouldFailAtOrAboveCutoffs(double score, QualitySeverity expected) {
        assertThat(ScoreDirection.RISK.classify(score, 0.3, 0.6)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, PASS",
            "0.61, PASS",
            "0.6, WARNING",
            "0.31, WARNING",
            "0.3, FAIL",
            "0.0, FAIL"
    })
    void quality_shouldFailAtOrBelowCutoffs(double score, QualitySeverity expected) {
        assertThat(ScoreDirection.QUALITY.classify(score, 0.6, 0.3)).isEqualTo(expected);
    }
}
