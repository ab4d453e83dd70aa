package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualityCheckType;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import com.quantpulsar.llm.analysis.pattern.PatternRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores how well an output answers the user's input: keyword overlap (0.4),
 * expected topic coverage (0.3), question type addressed (0.2) and shared bigrams (0.1),
 * less 0.3 for refusals.
 *
 * @author Quantpulsar 2025-2026
 */
public final class RelevanceScorer implements QualityDetector {

    public static final String NAME = "Relevance Score";

    /** Question shapes in detection order, each with the answer shape that addresses it. */
    public enum QuestionType {
        WHAT("\\bwhat\\b", "(?:is|are|was|were|means|refers to|defined as)"),
        WHO("\\bwho\\b", "(?:\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\b|person|individual|team|group)"),
        WHEN("\\bwhen\\b",
                "(?:\\d{4}|\\d{1,2}/\\d{1,2}|january|february|march|april|may|june|july|august|september|october|november|december)"),
        WHERE("\\bwhere\\b", "(?:in|at|on|near|located|place|location|country|city|region)"),
        WHY("\\bwhy\\b", "(?:because|reason|due to|since|therefore|result|cause)"),
        HOW("\\bhow\\b", "(?:by|through|using|step|method|process|way|approach)"),
        IS_ARE("\\b(?:is|are)\\s+\\w+\\?", "(?:yes|no|true|false|correct|incorrect|is|are|isn't|aren't)"),
        CAN_COULD("\\b(?:can|could)\\s+\\w+", "(?:yes|no|can|cannot|could|possible|impossible|able)");

        private final Pattern question;
        private final Pattern answer;

        QuestionType(String question, String answer) {
            this.question = Pattern.compile(question, Pattern.CASE_INSENSITIVE);
            this.answer = Pattern.compile(answer, Pattern.CASE_INSENSITIVE);
        }

        public boolean isAskedIn(String input) {
            return question.matcher(input).find();
        }

        public boolean isAnsweredIn(String output) {
            return answer.matcher(output).find();
        }

        /** First question type the input asks, or {@code null}. */
        public static QuestionType detect(String input) {
            for (QuestionType type : values()) {
                if (type.isAskedIn(input)) {
                    return type;
                }
            }
            return null;
        }
    }

    public static final List<Pattern> OFF_TOPIC = List.of(
            Pattern.compile("(?:I\\s+can't\\s+help\\s+with\\s+that)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:I'm\\s+not\\s+able\\s+to)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:that's\\s+outside\\s+my)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:let\\s+me\\s+tell\\s+you\\s+about\\s+something\\s+else)", Pattern.CASE_INSENSITIVE));

    private final QualityThresholds thresholds;
    private final Clock clock;

    public RelevanceScorer(QualityThresholds thresholds, Clock clock) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public QualityCheck evaluate(QualityCheckContext context) {
        if (!context.hasUserInput()) {
            return new QualityCheck(QualityCheckType.RELEVANCE, NAME, 1.0, QualitySeverity.PASS,
                    "No user input provided for relevance comparison", Instant.now(clock));
        }
        String input = context.getUserInput();
        String output = context.getLlmOutput();
        double score = 0;
        List<String> issues = new ArrayList<>();

        score += keywordOverlap(input, output) * 0.4;

        List<String> topics = context.getExpectedTopics();
        if (!topics.isEmpty()) {
            String lowerOutput = output.toLowerCase(Locale.ROOT);
            long found = topics.stream()
                    .filter(t -> lowerOutput.contains(t.toLowerCase(Locale.ROOT)))
                    .count();
            double coverage = (double) found / topics.size();
            score += coverage * 0.3;
            if (coverage < 0.5) {
                issues.add("Only " + found + "/" + topics.size() + " expected topics addressed");
            }
        } else {
            score += 0.15;
        }

        QuestionType question = QuestionType.detect(input);
        if (question != null) {
            if (question.isAnsweredIn(output)) {
                score += 0.2;
            } else {
                issues.add("Response may not directly address the question type");
            }
        }

        if (PatternRunner.anyMatches(OFF_TOPIC, output)) {
            score -= 0.3;
            issues.add("Response indicates off-topic or refusal");
        }

        score += sharedBigrams(input, output) * 0.1;

        score = PatternRunner.clamp(score);
        QualitySeverity severity = ScoreDirection.QUALITY.classify(score,
                thresholds.relevanceWarning(), thresholds.relevanceFail());
        String details = issues.isEmpty()
                ? "Good relevance (" + Math.round(score * 100) + "% match)"
                : String.join("; ", issues);
        return new QualityCheck(QualityCheckType.RELEVANCE, NAME, score, severity, details, Instant.now(clock));
    }

    private static double keywordOverlap(String input, String output) {
        List<String> userKeywords = TextFeatures.keywords(input);
        if (userKeywords.isEmpty()) {
            return 0;
        }
        List<String> outputKeywords = TextFeatures.keywords(output);
        long overlap = userKeywords.stream()
                .filter(k -> outputKeywords.stream().anyMatch(o -> o.contains(k) || k.contains(o)))
                .count();
        return (double) overlap / userKeywords.size();
    }

    private static double sharedBigrams(String input, String output) {
        List<String> userBigrams = TextFeatures.ngrams(input.toLowerCase(Locale.ROOT), 2);
        if (userBigrams.isEmpty()) {
            return 0;
        }
        Set<String> outputBigrams = new HashSet<>(TextFeatures.ngrams(output.toLowerCase(Locale.ROOT), 2));
        long shared = userBigrams.stream().filter(outputBigrams::contains).count();
        return (double) shared / userBigrams.size();
    }
}
