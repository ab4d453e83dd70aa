package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualityCheckType;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import com.quantpulsar.llm.analysis.pattern.PatternRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Structural coherence of the output. Starts at 1.0 and deducts per defect.
 *
 * @author Quantpulsar 2025-2026
 */
public final class CoherenceEvaluator implements QualityDetector {

    public static final String NAME = "Coherence Evaluation";

    public static final List<String> TRANSITION_WORDS = List.of(
            "however", "therefore", "furthermore", "additionally", "moreover",
            "consequently", "meanwhile", "nevertheless", "otherwise", "thus",
            "first", "second", "third", "finally", "next", "then", "lastly",
            "for example", "for instance", "in conclusion", "in summary");

    private static final Pattern FRAGMENT = Pattern.compile("\\.\\s+[a-z]");
    private static final Pattern PAST_TENSE = Pattern.compile("\\b\\w+ed\\b");
    private static final Pattern PRESENT_TENSE = Pattern.compile("\\b(?:is|are|am|have|has|do|does)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final int LONG_SENTENCE_WORDS = 35;

    private final QualityThresholds thresholds;
    private final Clock clock;

    public CoherenceEvaluator(QualityThresholds thresholds, Clock clock) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public QualityCheck evaluate(QualityCheckContext context) {
        String output = context.getLlmOutput();
        List<String> sentences = TextFeatures.sentences(output);
        if (sentences.isEmpty()) {
            return new QualityCheck(QualityCheckType.COHERENCE, NAME, 0.0, QualitySeverity.FAIL,
                    "No coherent sentences detected", Instant.now(clock));
        }
        int count = sentences.size();
        double score = 1.0;
        List<String> issues = new ArrayList<>();

        long shortSentences = sentences.stream()
                .filter(s -> s.trim().split("\\s+").length < 3)
                .count();
        if (shortSentences > count * 0.5 && count > 2) {
            score -= 0.2;
            issues.add("Many very short sentences");
        }

        Set<String> unique = sentences.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (unique.size() < count * 0.8 && count > 3) {
            score -= 0.2;
            issues.add("Repetitive sentences detected");
        }

        String lower = output.toLowerCase(Locale.ROOT);
        if (count > 3 && TRANSITION_WORDS.stream().noneMatch(lower::contains)) {
            score -= 0.1;
            issues.add("Limited use of transition words");
        }

        if (PatternRunner.countAll(FRAGMENT, output) > 2) {
            score -= 0.15;
            issues.add("Possible sentence fragments");
        }

        int past = PatternRunner.countAll(PAST_TENSE, output);
        int present = PatternRunner.countAll(PRESENT_TENSE, output);
        if (past > 5 && present > 5 && (double) Math.min(past, present) / Math.max(past, present) > 0.7) {
            score -= 0.1;
            issues.add("Inconsistent verb tense");
        }

        double averageWords = sentences.stream()
                .mapToInt(s -> s.split("\\s+").length)
                .average()
                .orElse(0);
        if (averageWords > LONG_SENTENCE_WORDS) {
            score -= 0.1;
            issues.add("Very long sentences may reduce readability");
        }

        score = PatternRunner.clamp(score);
        QualitySeverity severity = ScoreDirection.QUALITY.classify(score,
                thresholds.coherenceWarning(), thresholds.coherenceFail());
        String details = issues.isEmpty()
                ? "Good coherence (" + count + " sentences, avg " + Math.round(averageWords) + " words)"
                : String.join("; ", issues);
        return new QualityCheck(QualityCheckType.COHERENCE, NAME, score, severity, details, Instant.now(clock));
    }
}
