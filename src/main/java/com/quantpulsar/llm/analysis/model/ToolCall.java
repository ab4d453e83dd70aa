package com.quantpulsar.llm.analysis.model;

/**
 * Tool call requested by a model inside a message.
 *
 * @param id        tool call id
 * @param name      function name
 * @param arguments arguments as a JSON string
 * @param result    tool result, when recorded
 */
public record ToolCall(String id, String name, String arguments, String result) {
}
