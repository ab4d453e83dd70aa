package com.quantpulsar.llm.analysis.cost;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for TokenEfficiency.
 */
class TokenEfficiencyTest {

    @Test
    void throughputAndRatio_shouldBeComputed() {
        TokenEfficiency efficiency = TokenEfficiency.of(1000, 500, 2000);

        assertThat(efficiency.tokensPerSecond()).isEqualTo(750.0);
        assertThat(efficiency.inputOutputRatio()).isEqualTo(0.5);
        assertThat(efficiency.profile()).isEqualTo(TokenEfficiency.Profile.BALANCED);
    }

    @Test
    void profile_shouldReflectDominantSide() {
        assertThat(TokenEfficiency.of(1000, 2000, 1000).profile()).isEqualTo(TokenEfficiency.Profile.OUTPUT_HEAVY);
        assertThat(TokenEfficiency.of(1000, 100, 1000).profile()).isEqualTo(TokenEfficiency.Profile.INPUT_HEAVY);
        assertThat(TokenEfficiency.Profile.INPUT_HEAVY.label()).isEqualTo("Input Heavy");
    }

    @Test
    void degenerateInputs_shouldNotDivideByZero() {
        TokenEfficiency efficiency = TokenEfficiency.of(0, 0, 0);

        assertThat(efficiency.tokensPerSecond()).isEqualTo(0.0);
        assertThat(efficiency.inputOutputRatio()).isEqualTo(0.0);
        assertThat(efficiency.profile()).isEqualTo(TokenEfficiency.Profile.BALANCED);
    }
}
