package com.quantpulsar.llm.analysis.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for Span.
 */
class SpanTest {

    // Typed attribute values become strings, nulls are dropped
    @Test
    void of_shouldCoerceAttributeValues() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("gen_ai.usage.input_tokens", 42L);
        attributes.put("gen_ai.request.temperature", 0.5);
        attributes.put("empty", null);

        Span span = Span.of("s", "chat", 100, 50, null, attributes, false);

        assertThat(span.tags())
                .containsEntry("gen_ai.usage.input_tokens", "42")
                .containsEntry("gen_ai.request.temperature", "0.5")
                .doesNotContainKey("empty");
        assertThat(span.endTime()).isEqualTo(150);
        assertThat(span.hasParent()).isFalse();
    }

    @Test
    void tags_shouldBeImmutable() {
        Span span = new Span("s", null, 0, 0, "", null, false);

        assertThat(span.operationName()).isEmpty();
        assertThat(span.hasParent()).isFalse();
        assertThatThrownBy(() -> span.tags().put("k", "v")).isInstanceOf(UnsupportedOperationException.class);
    }
}
