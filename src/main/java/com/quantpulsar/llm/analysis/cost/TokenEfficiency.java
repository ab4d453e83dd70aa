package com.quantpulsar.llm.analysis.cost;

/**
 * Throughput and balance of one call's token usage.
 *
 * @param tokensPerSecond  total tokens over duration, 0 for a zero duration
 * @param inputOutputRatio output tokens per input token, 0 without input tokens
 * @param profile          which side dominates
 */
public record TokenEfficiency(double tokensPerSecond, double inputOutputRatio, Profile profile) {

    public enum Profile {
        OUTPUT_HEAVY("Output Heavy"),
        INPUT_HEAVY("Input Heavy"),
        BALANCED("Balanced");

        private final String label;

        Profile(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static TokenEfficiency of(long inputTokens, long outputTokens, long durationMs) {
        double seconds = durationMs / 1000.0;
        long total = inputTokens + outputTokens;
        Profile profile = outputTokens > inputTokens ? Profile.OUTPUT_HEAVY
                : outputTokens < inputTokens * 0.5 ? Profile.INPUT_HEAVY
                : Profile.BALANCED;
        return new TokenEfficiency(
                seconds > 0 ? total / seconds : 0,
                inputTokens > 0 ? (double) outputTokens / inputTokens : 0,
                profile);
    }
}
