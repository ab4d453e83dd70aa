package com.quantpulsar.llm.analysis.extraction;

import com.quantpulsar.llm.analysis.model.LlmMessage;
import com.quantpulsar.llm.analysis.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for MessageParser.
 */
class MessageParserTest {

    private final MessageParser parser = new MessageParser();

    @Test
    void nullOrEmpty_shouldYieldNull() {
        assertThat(parser.parse(null)).isNull();
        assertThat(parser.parse("")).isNull();
    }

    // Non-JSON payloads are kept as a single user message
    @Test
    void invalidJson_shouldBecomeUserMessage() {
        List<LlmMessage> messages = parser.parse("What is the capital of France?");

        assertThat(messages).containsExactly(LlmMessage.user("What is the capital of France?"));
    }

    @Test
    void jsonObject_shouldYieldNull() {
        assertThat(parser.parse("{\"role\":\"user\"}")).isNull();
    }

    @Test
    void missingRole_shouldDefaultToUser() {
        List<LlmMessage> messages = parser.parse("[{\"content\":\"hello\"}]");

        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).role()).isEqualTo(LlmMessage.ROLE_USER);
        assertThat(messages.get(0).content()).isEqualTo("hello");
    }

    @Test
    void structuredContent_shouldBeKeptAsJson() {
        List<LlmMessage> messages = parser.parse(
                "[{\"role\":\"user\",\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}]");

        assertThat(messages.get(0).content()).isEqualTo("[{\"type\":\"text\",\"text\":\"hi\"}]");
    }

    @Test
    void toolCalls_shouldBeDecoded() {
        String json = "[{\"role\":\"assistant\",\"content\":null,\"tool_calls\":["
                + "{\"id\":\"call_1\",\"type\":\"function\",\"function\":{\"name\":\"get_weather\",\"arguments\":\"{\\\"city\\\":\\\"Paris\\\"}\"}},"
                + "{\"id\":\"call_2\",\"name\":\"lookup\",\"arguments\":{\"q\":\"x\"}}"
                + "]}]";

        List<LlmMessage> messages = parser.parse(json);

        LlmMessage message = messages.get(0);
        assertThat(message.hasRole(LlmMessage.ROLE_ASSISTANT)).isTrue();
        assertThat(message.content()).isEmpty();
        assertThat(message.toolCalls()).extracting(ToolCall::name).containsExactly("get_weather", "lookup");
        assertThat(message.toolCalls().get(0).arguments()).isEqualTo("{\"city\":\"Paris\"}");
        assertThat(message.toolCalls().get(1).arguments()).isEqualTo("{\"q\":\"x\"}");
    }

    @Test
    void toolMessage_shouldKeepToolCallId() {
        List<LlmMessage> messages = parser.parse(
                "[{\"role\":\"tool\",\"content\":\"22C\",\"tool_call_id\":\"call_1\"}]");

        assertThat(messages.get(0).toolCallId()).isEqualTo("call_1");
        assertThat(messages.get(0).hasRole("TOOL")).isTrue();
    }
}
