package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for CoherenceEvaluator.
 */
class CoherenceEvaluatorTest {

    private final CoherenceEvaluator evaluator = new CoherenceEvaluator(QualityThresholds.DEFAULTS, Clock.systemUTC());

    @Test
    void blankOutput_shouldFail() {
        QualityCheck check = evaluator.evaluate(QualityCheckContext.of(null, "   "));

        assertThat(check.score()).isEqualTo(0.0);
        assertThat(check.severity()).isEqualTo(QualitySeverity.FAIL);
        assertThat(check.details()).isEqualTo("No coherent sentences detected");
    }

    @Test
    void wellFormedOutput_shouldPass() {
        QualityCheck check = evaluator.evaluate(QualityCheckContext.of(null, "The capital of France is Paris."));

        assertThat(check.score()).isEqualTo(1.0);
        assertThat(check.severity()).isEqualTo(QualitySeverity.PASS);
        assertThat(check.details()).startsWith("Good coherence (1 sentences");
    }

    // Only the short-sentence penalty applies
    @Test
    void shortSentences_shouldBePenalized() {
        QualityCheck check = evaluator.evaluate(QualityCheckContext.of(null, "Ok. Ok. Ok."));

        assertThat(check.score()).isCloseTo(0.8, within(1e-9));
        assertThat(check.severity()).isEqualTo(QualitySeverity.PASS);
        assertThat(check.details()).isEqualTo("Many very short sentences");
    }

    @Test
    void raisedWarningThreshold_shouldTurnShortSentencesIntoWarning() {
        CoherenceEvaluator strict = new CoherenceEvaluator(
                QualityThresholds.DEFAULTS.withCoherence(0.85, 0.3), Clock.systemUTC());

        QualityCheck check = strict.evaluate(QualityCheckContext.of(null, "Ok. Ok. Ok."));

        assertThat(check.severity()).isEqualTo(QualitySeverity.WARNING);
    }

    @Test
    void repetitionWithoutTransitions_shouldBePenalized() {
        QualityCheck check = evaluator.evaluate(QualityCheckContext.of(null,
                "The cat sat down. The cat sat down. The cat sat down. The cat sat down."));

        assertThat(check.details())
                .contains("Repetitive sentences detected")
                .contains("Limited use of transition words");
        assertThat(check.score()).isCloseTo(0.7, within(1e-9));
    }
}
