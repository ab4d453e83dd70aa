package com.quantpulsar.llm.analysis.trace;

import com.quantpulsar.llm.analysis.model.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.data.SpanData;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Adapts exported OpenTelemetry {@link SpanData} to the {@link Span} input model.
 * <p>
 * Span attributes become tags as-is; resource attributes are added under a
 * {@code resource.} prefix without overriding span attributes. Times are converted
 * from epoch nanoseconds to milliseconds.
 *
 * @author Quantpulsar 2025-2026
 */
public final class SpanDataConverter {

    public static final String RESOURCE_PREFIX = "resource.";

    private SpanDataConverter() {
    }

    public static Span toSpan(SpanData data) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        data.getAttributes().forEach((key, value) -> attributes.put(key.getKey(), value));
        data.getResource().getAttributes()
                .forEach((key, value) -> attributes.putIfAbsent(RESOURCE_PREFIX + key.getKey(), value));

        String parentSpanKey = data.getParentSpanContext().isValid() ? data.getParentSpanId() : null;
        long start = TimeUnit.NANOSECONDS.toMillis(data.getStartEpochNanos());
        long duration = TimeUnit.NANOSECONDS.toMillis(Math.max(0, data.getEndEpochNanos() - data.getStartEpochNanos()));
        boolean error = data.getStatus().getStatusCode() == StatusCode.ERROR;

        return Span.of(data.getSpanId(), data.getName(), start, duration, parentSpanKey, attributes, error);
    }

    public static List<Span> toSpans(Collection<SpanData> data) {
        List<Span> spans = new ArrayList<>(data.size());
        for (SpanData item : data) {
            spans.add(toSpan(item));
        }
        return spans;
    }
}
