package com.quantpulsar.llm.analysis.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for LlmMessage.
 */
class LlmMessageTest {

    @Test
    void missingRole_shouldDefaultToUser() {
        LlmMessage message = new LlmMessage(null, "hi", null, null, null);

        assertThat(message.role()).isEqualTo(LlmMessage.ROLE_USER);
        assertThat(message.toolCalls()).isEmpty();
    }

    @Test
    void hasRole_shouldIgnoreCase() {
        assertThat(new LlmMessage("Assistant", "ok", null, null, null).hasRole(LlmMessage.ROLE_ASSISTANT)).isTrue();
        assertThat(LlmMessage.system("rules").hasRole(LlmMessage.ROLE_USER)).isFalse();
    }
}
