package com.quantpulsar.llm.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where in the exchange a security finding was observed. */
public enum CheckLocation {
    INPUT("input"),
    OUTPUT("output"),
    BOTH("both");

    private final String value;

    CheckLocation(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Combines per-side hits, {@code null} when neither side matched. */
    public static CheckLocation of(boolean inInput, boolean inOutput) {
        if (inInput && inOutput) {
            return BOTH;
        }
        if (inInput) {
            return INPUT;
        }
        return inOutput ? OUTPUT : null;
    }
}
