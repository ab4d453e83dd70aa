package com.quantpulsar.llm.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Ordinal security severity; declaration order is the ranking. */
public enum SecuritySeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    SecuritySeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isAtLeast(SecuritySeverity other) {
        return compareTo(other) >= 0;
    }

    /** Returns the more severe of the two. */
    public static SecuritySeverity max(SecuritySeverity a, SecuritySeverity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** Parses a severity value case-insensitively, {@code null} when not recognized. */
    public static SecuritySeverity parse(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SecuritySeverity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        return null;
    }
}
