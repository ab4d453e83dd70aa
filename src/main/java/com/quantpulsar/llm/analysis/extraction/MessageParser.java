package com.quantpulsar.llm.analysis.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantpulsar.llm.analysis.model.LlmMessage;
import com.quantpulsar.llm.analysis.model.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the JSON message arrays carried by {@code gen_ai.input.messages}
 * and {@code gen_ai.output.messages}.
 *
 * <p>Values that are not valid JSON are kept as a single user message; valid JSON
 * that is not an array yields {@code null}.
 *
 * @author Quantpulsar 2025-2026
 */
public class MessageParser {

    private static final Logger log = LoggerFactory.getLogger(MessageParser.class);

    private final ObjectMapper objectMapper;

    public MessageParser() {
        this(new ObjectMapper());
    }

    public MessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<LlmMessage> parse(String json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Message tag is not JSON, keeping raw value as a user message: {}", e.getOriginalMessage());
            return List.of(LlmMessage.user(json));
        }
        if (root == null || !root.isArray()) {
            return null;
        }
        List<LlmMessage> messages = new ArrayList<>();
        for (JsonNode node : root) {
            messages.add(toMessage(node));
        }
        return messages;
    }

    private LlmMessage toMessage(JsonNode node) {
        List<ToolCall> toolCalls = new ArrayList<>();
        JsonNode calls = node.path("tool_calls");
        if (calls.isArray()) {
            for (JsonNode call : calls) {
                toolCalls.add(toToolCall(call));
            }
        }
        return new LlmMessage(
                text(node, "role"),
                contentOf(node.get("content")),
                text(node, "name"),
                toolCalls,
                text(node, "tool_call_id"));
    }

    private ToolCall toToolCall(JsonNode call) {
        JsonNode function = call.path("function");
        String name = text(function, "name");
        if (name == null) {
            name = text(call, "name");
        }
        JsonNode arguments = function.get("arguments");
        String argumentsJson;
        if (arguments != null && arguments.isTextual()) {
            argumentsJson = arguments.asText();
        } else {
            JsonNode raw = arguments != null && !arguments.isNull() ? arguments : call.get("arguments");
            argumentsJson = raw != null && !raw.isNull() ? writeJson(raw) : "{}";
        }
        String id = text(call, "id");
        return new ToolCall(id != null ? id : "", name != null ? name : "", argumentsJson, null);
    }

    // Content may be a plain string or structured parts; structured content is kept as JSON.
    private String contentOf(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        return content.isTextual() ? content.asText() : writeJson(content);
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
