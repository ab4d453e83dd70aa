package com.quantpulsar.llm.analysis.model;

import java.util.List;

/**
 * A chat message decoded from {@code gen_ai.input.messages} / {@code gen_ai.output.messages}.
 *
 * @param role       system, user, assistant, tool or function
 * @param content    message text
 * @param name       optional participant name
 * @param toolCalls  tool calls requested by the message, empty when none
 * @param toolCallId id of the tool call this message answers
 * @author Quantpulsar 2025-2026
 */
public record LlmMessage(String role, String content, String name, List<ToolCall> toolCalls, String toolCallId) {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";
    public static final String ROLE_FUNCTION = "function";

    public LlmMessage {
        role = role != null && !role.isEmpty() ? role : ROLE_USER;
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static LlmMessage user(String content) {
        return new LlmMessage(ROLE_USER, content, null, List.of(), null);
    }

    public static LlmMessage assistant(String content) {
        return new LlmMessage(ROLE_ASSISTANT, content, null, List.of(), null);
    }

    public static LlmMessage system(String content) {
        return new LlmMessage(ROLE_SYSTEM, content, null, List.of(), null);
    }

    public boolean hasRole(String expected) {
        return role.equalsIgnoreCase(expected);
    }
}
