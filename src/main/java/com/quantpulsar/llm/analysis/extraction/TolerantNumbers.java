package com.quantpulsar.llm.analysis.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient numeric parsing for tag values: reads the longest numeric prefix,
 * so {@code "1000 tokens"} parses as 1000. Unparseable values are {@code null}.
 */
public final class TolerantNumbers {

    private static final Pattern NUMERIC_PREFIX =
            Pattern.compile("^\\s*[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private TolerantNumbers() {
    }

    public static Double parseDouble(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = NUMERIC_PREFIX.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(matcher.group().trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Parses as {@link #parseDouble(String)} and truncates toward zero. */
    public static Long parseLong(String value) {
        Double parsed = parseDouble(value);
        return parsed != null ? (long) parsed.doubleValue() : null;
    }
}
