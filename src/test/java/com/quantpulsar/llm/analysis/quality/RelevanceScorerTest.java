package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for RelevanceScorer.
 */
class RelevanceScorerTest {

    private final RelevanceScorer scorer = new RelevanceScorer(QualityThresholds.DEFAULTS, Clock.systemUTC());

    @Test
    void missingInput_shouldPassWithFullScore() {
        QualityCheck check = scorer.evaluate(QualityCheckContext.of(null, "Anything at all."));

        assertThat(check.score()).isEqualTo(1.0);
        assertThat(check.severity()).isEqualTo(QualitySeverity.PASS);
        assertThat(check.details()).isEqualTo("No user input provided for relevance comparison");
    }

    // keywords 0.4 + no topics 0.15 + "what" answered 0.2 + 2/5 bigrams 0.04
    @Test
    void directAnswer_shouldScoreHigh() {
        QualityCheck check = scorer.evaluate(
                QualityCheckContext.of("What is the capital of France?", "The capital of France is Paris."));

        assertThat(check.score()).isCloseTo(0.79, within(1e-9));
        assertThat(check.severity()).isEqualTo(QualitySeverity.PASS);
        assertThat(check.details()).isEqualTo("Good relevance (79% match)");
    }

    @Test
    void refusal_shouldFail() {
        QualityCheck check = scorer.evaluate(
                QualityCheckContext.of("How do I bake bread?", "I can't help with that."));

        assertThat(check.score()).isEqualTo(0.0);
        assertThat(check.severity()).isEqualTo(QualitySeverity.FAIL);
        assertThat(check.details())
                .contains("Response may not directly address the question type")
                .contains("Response indicates off-topic or refusal");
    }

    @Test
    void missingExpectedTopics_shouldBeReported() {
        QualityCheckContext context = QualityCheckContext.builder()
                .userInput("Tell me about Java")
                .llmOutput("Java is a language.")
                .expectedTopics(List.of("Java", "JVM", "garbage collection"))
                .build();

        QualityCheck check = scorer.evaluate(context);

        assertThat(check.details()).contains("Only 1/3 expected topics addressed");
    }

    @Test
    void questionType_shouldBeDetectedInOrder() {
        assertThat(RelevanceScorer.QuestionType.detect("Why is the sky blue?"))
                .isEqualTo(RelevanceScorer.QuestionType.WHY);
        assertThat(RelevanceScorer.QuestionType.detect("Can you help?"))
                .isEqualTo(RelevanceScorer.QuestionType.CAN_COULD);
        assertThat(RelevanceScorer.QuestionType.detect("Hello there")).isNull();
    }
}
