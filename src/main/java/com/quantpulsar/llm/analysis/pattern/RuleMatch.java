package com.quantpulsar.llm.analysis.pattern;

import java.util.List;

/**
 * The matches a single rule produced against one text.
 *
 * @param rule    the matching rule
 * @param matches matched substrings, never empty
 * @param <G>     grade type
 */
public record RuleMatch<G>(PatternRule<G> rule, List<String> matches) {

    public RuleMatch {
        matches = List.copyOf(matches);
    }

    public int count() {
        return matches.size();
    }

    public String name() {
        return rule.name();
    }

    public G grade() {
        return rule.grade();
    }
}
