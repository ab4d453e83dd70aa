package com.quantpulsar.llm.analysis.pattern;

import java.util.List;

/**
 * Drops matches known to be false positives for a given rule.
 *
 * @param <G> grade type
 */
@FunctionalInterface
public interface MatchFilter<G> {

    /** Keeps every match. */
    static <G> MatchFilter<G> none() {
        return (rule, matches) -> matches;
    }

    /** Returns the surviving subset of {@code matches}. */
    List<String> filter(PatternRule<G> rule, List<String> matches);
}
