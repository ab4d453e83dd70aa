package com.quantpulsar.llm.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/** Kind of security finding. */
public enum SecurityCheckType {
    PROMPT_INJECTION("prompt_injection"),
    JAILBREAK_ATTEMPT("jailbreak_attempt"),
    PII_DETECTED("pii_detected"),
    SENSITIVE_DATA("sensitive_data"),
    MALICIOUS_CONTENT("malicious_content"),
    CUSTOM("custom");

    // Short tag names used by some instrumentations
    private static final Map<String, SecurityCheckType> ALIASES = Map.of(
            "jailbreak", JAILBREAK_ATTEMPT,
            "pii", PII_DETECTED,
            "malicious", MALICIOUS_CONTENT);

    private final String value;

    SecurityCheckType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Maps a check name to its type; unknown names are {@link #CUSTOM}. */
    public static SecurityCheckType fromName(String name) {
        if (name == null) {
            return CUSTOM;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (SecurityCheckType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return ALIASES.getOrDefault(normalized, CUSTOM);
    }
}
