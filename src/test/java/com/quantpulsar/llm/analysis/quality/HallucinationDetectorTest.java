package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualityCheckType;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for HallucinationDetector.
 */
class HallucinationDetectorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final HallucinationDetector detector = new HallucinationDetector(QualityThresholds.DEFAULTS, CLOCK);

    @Test
    void groundedAnswer_shouldPass() {
        QualityCheckContext context = QualityCheckContext.builder()
                .userInput("What is the capital of France?")
                .llmOutput("Paris is the capital of France.")
                .providedContext(List.of("Paris is the capital of France."))
                .build();

        QualityCheck check = detector.evaluate(context);

        assertThat(check.type()).isEqualTo(QualityCheckType.HALLUCINATION);
        assertThat(check.name()).isEqualTo(HallucinationDetector.NAME);
        assertThat(check.score()).isEqualTo(0.0);
        assertThat(check.severity()).isEqualTo(QualitySeverity.PASS);
        assertThat(check.details()).isEqualTo("No significant hallucination indicators detected");
        assertThat(check.timestamp()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    }

    // Two claims, neither backed by context
    @Test
    void unsupportedClaims_shouldRaiseScore() {
        QualityCheck check = detector.evaluate(
                QualityCheckContext.of(null, "The company was founded in 1998. It is the largest retailer."));

        assertThat(check.score()).isCloseTo(0.3, within(1e-9));
        assertThat(check.severity()).isEqualTo(QualitySeverity.WARNING);
        assertThat(check.details()).contains("2/2 factual claims not found in context");
    }

    @Test
    void claimsFoundInContext_shouldNotCount() {
        QualityCheckContext context = QualityCheckContext.builder()
                .llmOutput("The company was founded in 1998.")
                .providedContext(List.of("Acme was founded in 1998 by two engineers."))
                .build();

        QualityCheck check = detector.evaluate(context);

        assertThat(check.details()).doesNotContain("factual claims");
    }

    @Test
    void negatedUserStatement_shouldBeFlagged() {
        QualityCheck check = detector.evaluate(QualityCheckContext.of("The sky is blue", "The sky is not green."));

        assertThat(check.score()).isCloseTo(0.15, within(1e-9));
        assertThat(check.details()).contains("Potential contradiction with user statement");
    }

    @Test
    void confidentLanguageWithoutContext_shouldBeFlagged() {
        QualityCheck check = detector.evaluate(QualityCheckContext.of(null,
                "Absolutely, this definitely works. It is certainly the answer. Clearly right."));

        assertThat(check.score()).isCloseTo(0.2, within(1e-9));
        assertThat(check.severity()).isEqualTo(QualitySeverity.PASS);
        assertThat(check.details()).contains("High-confidence language without supporting context");
    }

    @Test
    void customThresholds_shouldChangeSeverity() {
        HallucinationDetector strict = new HallucinationDetector(
                QualityThresholds.DEFAULTS.withHallucination(0.1, 0.15), CLOCK);

        QualityCheck check = strict.evaluate(QualityCheckContext.of(null,
                "Absolutely, this definitely works. It is certainly the answer. Clearly right."));

        assertThat(check.severity()).isEqualTo(QualitySeverity.FAIL);
    }

    @Test
    void outputMuchLongerThanShortContext_shouldBeFlagged() {
        QualityCheckContext context = QualityCheckContext.builder()
                .llmOutput("x".repeat(400))
                .providedContext(List.of("short context"))
                .build();

        QualityCheck check = detector.evaluate(context);

        assertThat(check.details()).contains("Response significantly longer than provided context");
    }

    @Test
    void scoreShouldStayWithinUnitRange() {
        QualityCheck check = detector.evaluate(QualityCheckContext.of(null,
                "I think it may be so. Perhaps it could be. I'm not sure, it might work."));

        assertThat(check.score()).isBetween(0.0, 1.0);
    }
}
