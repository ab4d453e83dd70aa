package com.quantpulsar.llm.analysis.quality;

/**
 * Which quality checks run and with which thresholds. Every check is enabled by default.
 *
 * @author Quantpulsar 2025-2026
 */
public final class QualityCheckConfig {

    private static final QualityCheckConfig DEFAULTS = builder().build();

    private final boolean checkHallucination;
    private final boolean checkRelevance;
    private final boolean checkToxicity;
    private final boolean checkSentiment;
    private final boolean checkCoherence;
    private final QualityThresholds thresholds;

    private QualityCheckConfig(Builder builder) {
        this.checkHallucination = builder.checkHallucination;
        this.checkRelevance = builder.checkRelevance;
        this.checkToxicity = builder.checkToxicity;
        this.checkSentiment = builder.checkSentiment;
        this.checkCoherence = builder.checkCoherence;
        this.thresholds = builder.thresholds != null ? builder.thresholds : QualityThresholds.DEFAULTS;
    }

    public static QualityCheckConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isCheckHallucination() {
        return checkHallucination;
    }

    public boolean isCheckRelevance() {
        return checkRelevance;
    }

    public boolean isCheckToxicity() {
        return checkToxicity;
    }

    public boolean isCheckSentiment() {
        return checkSentiment;
    }

    public boolean isCheckCoherence() {
        return checkCoherence;
    }

    public QualityThresholds getThresholds() {
        return thresholds;
    }

    public static final class Builder {
        private boolean checkHallucination = true;
        private boolean checkRelevance = true;
        private boolean checkToxicity = true;
        private boolean checkSentiment = true;
        private boolean checkCoherence = true;
        private QualityThresholds thresholds;

        private Builder() {
        }

        public Builder checkHallucination(boolean enabled) {
            this.checkHallucination = enabled;
            return this;
        }

        public Builder checkRelevance(boolean enabled) {
            this.checkRelevance = enabled;
            return this;
        }

        public Builder checkToxicity(boolean enabled) {
            this.checkToxicity = enabled;
            return this;
        }

        public Builder checkSentiment(boolean enabled) {
            this.checkSentiment = enabled;
            return this;
        }

        public Builder checkCoherence(boolean enabled) {
            this.checkCoherence = enabled;
            return this;
        }

        public Builder thresholds(QualityThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public QualityCheckConfig build() {
            return new QualityCheckConfig(this);
        }
    }
}
