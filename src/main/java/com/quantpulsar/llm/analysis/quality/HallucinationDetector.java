package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.QualityCheckType;
import com.quantpulsar.llm.analysis.model.QualitySeverity;
import com.quantpulsar.llm.analysis.pattern.PatternRule;
import com.quantpulsar.llm.analysis.pattern.PatternRunner;
import com.quantpulsar.llm.analysis.pattern.RuleMatch;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Scores the risk that an output states facts it was not given.
 * <p>
 * Unsupported factual claims, contradictions of the user's statement, absolutist
 * language without grounding and outputs that dwarf a short context all raise the
 * score; hedging lowers it.
 *
 * @author Quantpulsar 2025-2026
 */
public final class HallucinationDetector implements QualityDetector {

    public static final String NAME = "Hallucination Detection";

    /** Claim patterns, graded by claim kind. */
    public static final List<PatternRule<String>> FACTUAL_CLAIMS = List.of(
            PatternRule.caseInsensitive("founding_date",
                    "(?:was|is|are|were)\\s+(?:founded|established|created|started)\\s+(?:in|on)\\s+(\\d{4})", "date"),
            PatternRule.caseInsensitive("life_date",
                    "(?:born|died)\\s+(?:in|on)\\s+(?:\\w+\\s+\\d{1,2},?\\s+)?(\\d{4})", "date"),
            PatternRule.caseInsensitive("quantity",
                    "(?:is|are|was|were)\\s+(?:approximately|about|roughly|around)?\\s*(\\d+(?:,\\d{3})*(?:\\.\\d+)?)\\s*(?:million|billion|trillion)?",
                    "statistic"),
            PatternRule.caseInsensitive("cited_source",
                    "(?:according to|based on)\\s+(?:studies|research|data|statistics|reports)", "citation"),
            PatternRule.caseInsensitive("studies_show",
                    "(?:studies\\s+(?:show|indicate|suggest|prove)|research\\s+(?:shows|indicates|suggests|proves))",
                    "citation"),
            PatternRule.caseInsensitive("contrast", "(?:in fact|actually|contrary to|unlike)", "assertion"),
            PatternRule.caseInsensitive("superlative",
                    "(?:the\\s+(?:first|largest|smallest|oldest|newest|most|least))", "superlative"),
            PatternRule.caseInsensitive("percentage",
                    "(?:\\d+(?:\\.\\d+)?%\\s+(?:of|increase|decrease|growth|reduction))", "statistic"));

    public static final List<Pattern> HEDGING = List.of(
            Pattern.compile("(?:I\\s+(?:think|believe|assume)|it\\s+(?:seems|appears|looks\\s+like))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:may|might|could|possibly|potentially|perhaps|probably)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:I'm\\s+not\\s+(?:sure|certain)|I\\s+don't\\s+(?:know|have))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:based\\s+on\\s+(?:my|the\\s+provided)\\s+(?:knowledge|information|context))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:if\\s+I\\s+understand\\s+correctly|correct\\s+me\\s+if\\s+I'm\\s+wrong)", Pattern.CASE_INSENSITIVE));

    public static final List<Pattern> CONFIDENT = List.of(
            Pattern.compile("(?:definitely|certainly|absolutely|undoubtedly|clearly|obviously)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:always|never|every|none|all)\\s+\\w+", Pattern.CASE_INSENSITIVE));

    /** An affirmative form in the user's statement and its negation in the output. */
    record NegationPair(Pattern affirmative, Pattern negated) {

        static NegationPair of(String affirmative, String negated) {
            return new NegationPair(Pattern.compile(affirmative, Pattern.CASE_INSENSITIVE),
                    Pattern.compile(negated, Pattern.CASE_INSENSITIVE));
        }
    }

    static final List<NegationPair> NEGATIONS = List.of(
            NegationPair.of("\\bis\\b", "\\bis\\s+not\\b|\\bisn't\\b"),
            NegationPair.of("\\bcan\\b", "\\bcan\\s*not\\b|\\bcan't\\b"),
            NegationPair.of("\\bwill\\b", "\\bwill\\s+not\\b|\\bwon't\\b"),
            NegationPair.of("\\bdoes\\b", "\\bdoes\\s+not\\b|\\bdoesn't\\b"));

    private static final int SHORT_CONTEXT_LENGTH = 500;

    private final QualityThresholds thresholds;
    private final Clock clock;

    public HallucinationDetector(QualityThresholds thresholds, Clock clock) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public QualityCheck evaluate(QualityCheckContext context) {
        String output = context.getLlmOutput();
        List<String> providedContext = context.getProvidedContext();
        double score = 0;
        List<String> issues = new ArrayList<>();

        int claims = 0;
        int unsupported = 0;
        for (RuleMatch<String> match : PatternRunner.scan(FACTUAL_CLAIMS, output)) {
            for (String claim : match.matches()) {
                claims++;
                if (!isSupported(claim, providedContext)) {
                    unsupported++;
                }
            }
        }
        if (claims > 0 && (double) unsupported / claims > 0.5) {
            score += 0.3;
            issues.add(unsupported + "/" + claims + " factual claims not found in context");
        }

        int hedges = HEDGING.stream().mapToInt(p -> PatternRunner.countAll(p, output)).sum();
        if (hedges > 2) {
            score -= 0.1;
        }

        if (context.hasUserInput()) {
            for (NegationPair pair : NEGATIONS) {
                if (pair.affirmative().matcher(context.getUserInput()).find()
                        && pair.negated().matcher(output).find()) {
                    score += 0.15;
                    issues.add("Potential contradiction with user statement");
                    break;
                }
            }
        }

        if (providedContext.isEmpty()) {
            for (Pattern pattern : CONFIDENT) {
                if (PatternRunner.countAll(pattern, output) > 2) {
                    score += 0.2;
                    issues.add("High-confidence language without supporting context");
                    break;
                }
            }
        } else {
            int contextLength = String.join(" ", providedContext).length();
            if (output.length() > contextLength * 3 && contextLength < SHORT_CONTEXT_LENGTH) {
                score += 0.15;
                issues.add("Response significantly longer than provided context");
            }
        }

        score = PatternRunner.clamp(score);
        QualitySeverity severity = ScoreDirection.RISK.classify(score,
                thresholds.hallucinationWarning(), thresholds.hallucinationFail());
        return new QualityCheck(QualityCheckType.HALLUCINATION, NAME, score, severity,
                issues.isEmpty() ? "No significant hallucination indicators detected" : String.join("; ", issues),
                Instant.now(clock));
    }

    private static boolean isSupported(String claim, List<String> providedContext) {
        String needle = claim.toLowerCase(Locale.ROOT);
        return providedContext.stream().anyMatch(c -> c.toLowerCase(Locale.ROOT).contains(needle));
    }
}
