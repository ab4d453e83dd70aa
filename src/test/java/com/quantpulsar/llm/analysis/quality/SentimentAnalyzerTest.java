package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for SentimentAnalyzer.
 */
class SentimentAnalyzerTest {

    private final SentimentAnalyzer analyzer = new SentimentAnalyzer(Clock.systemUTC());

    @Test
    void positiveWords_shouldYieldPositiveSentiment() {
        QualityCheck check = analyzer.evaluate(
                QualityCheckContext.of(null, "This is a great and helpful answer, thank you!"));

        assertThat(check.score()).isEqualTo(1.0);
        assertThat(check.details()).isEqualTo("Positive sentiment (3 positive, 0 negative words)");
    }

    @Test
    void negativeWords_shouldYieldNegativeSentiment() {
        QualityCheck check = analyzer.evaluate(QualityCheckContext.of(null, "A terrible error, totally broken."));

        assertThat(check.score()).isEqualTo(0.0);
        assertThat(check.details()).startsWith("Negative sentiment");
    }

    @Test
    void noSentimentWords_shouldBeNeutral() {
        QualityCheck check = analyzer.evaluate(QualityCheckContext.of(null, "The meeting is at noon."));

        assertThat(check.score()).isEqualTo(0.5);
        assertThat(check.details()).isEqualTo("Neutral sentiment (0 positive, 0 negative words)");
    }

    @Test
    void negations_shouldBeCountedInDetails() {
        QualityCheck check = analyzer.evaluate(QualityCheckContext.of(null, "This is bad. It is not good."));

        assertThat(check.score()).isEqualTo(0.5);
        assertThat(check.details()).isEqualTo("Neutral sentiment (1 positive, 1 negative words, 1 negations)");
    }

    // Sentiment is informational only
    @Test
    void severity_shouldAlwaysBePass() {
        QualityCheck check = analyzer.evaluate(QualityCheckContext.of(null, "awful awful awful"));

        assertThat(check.severity()).isEqualTo(QualitySeverity.PASS);
    }
}
