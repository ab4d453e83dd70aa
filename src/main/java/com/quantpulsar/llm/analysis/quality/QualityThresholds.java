package com.quantpulsar.llm.analysis.quality;

/**
 * Severity cutoffs per scored check. Risk checks (hallucination, toxicity) fail at or
 * above their cutoffs; quality checks (relevance, coherence) fail at or below theirs.
 */
public record QualityThresholds(
        double hallucinationWarning,
        double hallucinationFail,
        double relevanceWarning,
        double relevanceFail,
        double toxicityWarning,
        double toxicityFail,
        double coherenceWarning,
        double coherenceFail) {

    public static final QualityThresholds DEFAULTS = new QualityThresholds(
            0.3, 0.6,
            0.6, 0.3,
            0.3, 0.6,
            0.6, 0.3);

    public QualityThresholds withCoherence(double warning, double fail) {
        return new QualityThresholds(hallucinationWarning, hallucinationFail, relevanceWarning, relevanceFail,
                toxicityWarning, toxicityFail, warning, fail);
    }

    public QualityThresholds withHallucination(double warning, double fail) {
        return new QualityThresholds(warning, fail, relevanceWarning, relevanceFail,
                toxicityWarning, toxicityFail, coherenceWarning, coherenceFail);
    }
}
