package com.quantpulsar.llm.analysis.pattern;

import java.util.regex.Pattern;

/**
 * One entry of a detector catalog: a named regex and the grade it contributes
 * when it matches (a weight for scored detectors, a severity for security detectors).
 *
 * @param name        stable rule name, reported in finding details
 * @param pattern     compiled pattern
 * @param grade       weight or severity
 * @param description human readable description, may be {@code null}
 * @param <G>         grade type
 */
public record PatternRule<G>(String name, Pattern pattern, G grade, String description) {

    public static <G> PatternRule<G> of(String name, String regex, G grade) {
        return new PatternRule<>(name, Pattern.compile(regex), grade, null);
    }

    public static <G> PatternRule<G> of(String name, String regex, G grade, String description) {
        return new PatternRule<>(name, Pattern.compile(regex), grade, description);
    }

    public static <G> PatternRule<G> caseInsensitive(String name, String regex, G grade) {
        return new PatternRule<>(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), grade, null);
    }

    public static <G> PatternRule<G> caseInsensitive(String name, String regex, G grade, String description) {
        return new PatternRule<>(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), grade, description);
    }

    public boolean matchesIn(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
