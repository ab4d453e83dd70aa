package com.quantpulsar.llm.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Outcome of a quality check. */
public enum QualitySeverity {
    PASS("pass"),
    WARNING("warning"),
    FAIL("fail");

    private final String value;

    QualitySeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** True for {@link #WARNING} and {@link #FAIL}. */
    public boolean isIssue() {
        return this != PASS;
    }

    /** Parses a severity tag value, {@code null} when not recognized. */
    public static QualitySeverity parse(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (QualitySeverity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        return null;
    }
}
