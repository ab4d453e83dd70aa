package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualityCheckType;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import com.quantpulsar.llm.analysis.pattern.PatternRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexicon sentiment of the output. Informational only: always {@link QualitySeverity#PASS}.
 * The score is the positive share of sentiment-bearing words, 0.5 when there are none.
 */
public final class SentimentAnalyzer implements QualityDetector {

    public static final String NAME = "Sentiment Analysis";

    public static final Set<String> POSITIVE_WORDS = Set.of(
            "good", "great", "excellent", "amazing", "wonderful", "fantastic", "awesome",
            "love", "happy", "glad", "pleased", "delighted", "thank", "helpful", "useful",
            "perfect", "best", "enjoy", "beautiful", "success", "brilliant", "outstanding");

    public static final Set<String> NEGATIVE_WORDS = Set.of(
            "bad", "terrible", "awful", "horrible", "poor", "worst", "hate", "angry",
            "sad", "disappointed", "frustrated", "annoyed", "upset", "fail", "wrong",
            "problem", "issue", "error", "broken", "useless", "stupid", "boring");

    private static final Pattern NEGATION = Pattern.compile(
            "\\b(?:not|never|no|don't|doesn't|didn't|won't|wouldn't|can't|couldn't)\\s+\\w+",
            Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public SentimentAnalyzer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public QualityCheck evaluate(QualityCheckContext context) {
        String output = context.getLlmOutput();
        int positive = 0;
        int negative = 0;
        for (String word : TextFeatures.words(output)) {
            if (POSITIVE_WORDS.contains(word)) {
                positive++;
            }
            if (NEGATIVE_WORDS.contains(word)) {
                negative++;
            }
        }

        double score = 0.5;
        String sentiment = "Neutral";
        if (positive + negative > 0) {
            score = (double) positive / (positive + negative);
            if (score > 0.6) {
                sentiment = "Positive";
            } else if (score < 0.4) {
                sentiment = "Negative";
            }
        }
        int negations = PatternRunner.countAll(NEGATION, output);

        StringBuilder details = new StringBuilder()
                .append(sentiment).append(" sentiment (")
                .append(positive).append(" positive, ")
                .append(negative).append(" negative words");
        if (negations > 0) {
            details.append(", ").append(negations).append(" negations");
        }
        details.append(')');
        return new QualityCheck(QualityCheckType.SENTIMENT, NAME, score, QualitySeverity.PASS,
                details.toString(), Instant.now(clock));
    }
}
