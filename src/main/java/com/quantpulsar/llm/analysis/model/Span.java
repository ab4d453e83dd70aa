package com.quantpulsar.llm.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One timed operation of a trace, as retrieved from the tracing backend.
 * Tags are a flat string attribute bag; the parent key is a back-reference only.
 *
 * @param spanKey        unique span id
 * @param operationName  operation name
 * @param startTime      start time, epoch milliseconds
 * @param duration       duration in milliseconds
 * @param parentSpanKey  parent span id, or {@code null} for a root span
 * @param tags           span attributes
 * @param isError        whether the span recorded an error
 * @author Quantpulsar 2025-2026
 */
public record Span(
        String spanKey,
        String operationName,
        long startTime,
        long duration,
        String parentSpanKey,
        Map<String, String> tags,
        boolean isError) {

    public Span {
        operationName = operationName != null ? operationName : "";
        tags = tags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tags)) : Map.of();
    }

    /**
     * Creates a span from an attribute map whose values may be of any type.
     * Values are coerced with {@link String#valueOf(Object)}, null values are dropped.
     */
    public static Span of(String spanKey, String operationName, long startTime, long duration,
                          String parentSpanKey, Map<String, ?> attributes, boolean isError) {
        return new Span(spanKey, operationName, startTime, duration, parentSpanKey,
                coerceTags(attributes), isError);
    }

    /** Coerces attribute values to strings, keeping insertion order. */
    public static Map<String, String> coerceTags(Map<String, ?> attributes) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (key != null && value != null) {
                    tags.put(key, String.valueOf(value));
                }
            });
        }
        return tags;
    }

    /** End time, epoch milliseconds. */
    public long endTime() {
        return startTime + duration;
    }

    public boolean hasParent() {
        return parentSpanKey != null && !parentSpanKey.isEmpty();
    }
}
