package com.quantpulsar.llm.analysis.trace;

import com.quantpulsar.llm.analysis.model.Span;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for TemporalAdjacencyStrategy.
 */
class TemporalAdjacencyStrategyTest {

    private static Span span(long start, long duration) {
        return new Span("s" + start, "op", start, duration, null, Map.of(), false);
    }

    @Test
    void defaultGap_shouldBeOneHundredMillis() {
        TemporalAdjacencyStrategy strategy = new TemporalAdjacencyStrategy();

        assertThat(strategy.getMaxGapMillis()).isEqualTo(100);
        assertThat(strategy.isSequential(span(0, 100), span(199, 10))).isTrue();
        assertThat(strategy.isSequential(span(0, 100), span(200, 10))).isFalse();
    }

    @Test
    void configuredGap_shouldBeHonoured() {
        TemporalAdjacencyStrategy strategy = new TemporalAdjacencyStrategy(Duration.ofMillis(10));

        assertThat(strategy.isSequential(span(0, 100), span(105, 10))).isTrue();
        assertThat(strategy.isSequential(span(0, 100), span(150, 10))).isFalse();
    }
}
