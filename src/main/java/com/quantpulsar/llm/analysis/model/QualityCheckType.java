package com.quantpulsar.llm.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kind of quality finding. */
public enum QualityCheckType {
    HALLUCINATION("hallucination"),
    TOXICITY("toxicity"),
    SENTIMENT("sentiment"),
    RELEVANCE("relevance"),
    COHERENCE("coherence"),
    CUSTOM("custom");

    private final String value;

    QualityCheckType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Maps a check name to its type; unknown names are {@link #CUSTOM}. */
    public static QualityCheckType fromName(String name) {
        if (name == null) {
            return CUSTOM;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (QualityCheckType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return CUSTOM;
    }
}
