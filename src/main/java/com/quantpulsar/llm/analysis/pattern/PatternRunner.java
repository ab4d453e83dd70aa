package com.quantpulsar.llm.analysis.pattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog-agnostic interpreter for detector catalogs: match every rule,
 * filter, accumulate, clamp. Quality and security engines both run their
 * tables through here.
 */
public final class PatternRunner {

    /** Match counts above this saturate a weighted rule. */
    public static final int WEIGHT_SATURATION = 3;

    private PatternRunner() {
    }

    public static <G> List<RuleMatch<G>> scan(Collection<PatternRule<G>> rules, String text) {
        return scan(rules, text, MatchFilter.none());
    }

    /** Runs every rule against the text; rules whose matches are all filtered out are omitted. */
    public static <G> List<RuleMatch<G>> scan(Collection<PatternRule<G>> rules, String text, MatchFilter<G> filter) {
        List<RuleMatch<G>> results = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return results;
        }
        for (PatternRule<G> rule : rules) {
            List<String> matches = findAll(rule.pattern(), text);
            if (matches.isEmpty()) {
                continue;
            }
            List<String> surviving = filter.filter(rule, matches);
            if (!surviving.isEmpty()) {
                results.add(new RuleMatch<>(rule, surviving));
            }
        }
        return results;
    }

    /** First rule that matches, in catalog order. */
    public static <G> PatternRule<G> firstMatching(Collection<PatternRule<G>> rules, String text) {
        for (PatternRule<G> rule : rules) {
            if (rule.matchesIn(text)) {
                return rule;
            }
        }
        return null;
    }

    public static List<String> findAll(Pattern pattern, String text) {
        List<String> matches = new ArrayList<>();
        if (text == null) {
            return matches;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return matches;
    }

    public static int countAll(Pattern pattern, String text) {
        return findAll(pattern, text).size();
    }

    public static boolean anyMatches(Collection<Pattern> patterns, String text) {
        if (text == null) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /** Sum of {@code weight * min(count, 3) / 3} over the matched rules. */
    public static double weightedScore(List<RuleMatch<Double>> matches) {
        double score = 0;
        for (RuleMatch<Double> match : matches) {
            score += match.grade() * Math.min(match.count(), WEIGHT_SATURATION) / WEIGHT_SATURATION;
        }
        return score;
    }

    /** Highest grade among the matches, or {@code fallback} when nothing matched. */
    public static <G extends Comparable<G>> G maxGrade(List<RuleMatch<G>> matches, G fallback) {
        return matches.stream()
                .map(RuleMatch::grade)
                .max(Comparator.naturalOrder())
                .orElse(fallback);
    }

    public static double clamp(double score) {
        return Math.max(0, Math.min(1, score));
    }
}
