package com.quantpulsar.llm.analysis.extraction;

import java.util.List;
import java.util.Map;

import static com.quantpulsar.llm.analysis.extraction.GenAiAttributes.*;

/**
 * Key resolution table: each logical field lists its canonical key first,
 * then the aliases used by other instrumentation libraries.
 * The first present, non-empty value wins.
 */
public enum LlmTagField {

    OPERATION_TYPE(OPERATION_NAME),
    PROVIDER(PROVIDER_NAME, LEGACY_SYSTEM, "llm.provider", "ai.provider"),
    REQUEST_MODEL_NAME(REQUEST_MODEL, LEGACY_LLM_MODEL, LEGACY_AI_MODEL, "model"),
    RESPONSE_MODEL_NAME(RESPONSE_MODEL),

    INPUT_TOKENS(USAGE_INPUT_TOKENS, "llm.usage.prompt_tokens", "ai.tokens.prompt", "tokens.input"),
    OUTPUT_TOKENS(USAGE_OUTPUT_TOKENS, "llm.usage.completion_tokens", "ai.tokens.completion", "tokens.output"),

    TEMPERATURE(REQUEST_TEMPERATURE, "llm.temperature", "ai.temperature"),
    TOP_P(REQUEST_TOP_P, "llm.top_p", "ai.top_p"),
    TOP_K(REQUEST_TOP_K),
    MAX_TOKENS(REQUEST_MAX_TOKENS, "llm.max_tokens", "ai.max_tokens"),
    FREQUENCY_PENALTY(REQUEST_FREQUENCY_PENALTY),
    PRESENCE_PENALTY(REQUEST_PRESENCE_PENALTY),

    RESPONSE_ID_VALUE(RESPONSE_ID),
    FINISH_REASONS(RESPONSE_FINISH_REASONS),

    INPUT_MESSAGES_JSON(INPUT_MESSAGES),
    OUTPUT_MESSAGES_JSON(OUTPUT_MESSAGES),
    SYSTEM_INSTRUCTIONS_TEXT(SYSTEM_INSTRUCTIONS),

    CONVERSATION(CONVERSATION_ID),
    OUTPUT_TYPE_VALUE(OUTPUT_TYPE),

    TOOL(TOOL_NAME),
    TOOL_KIND(TOOL_TYPE),
    TOOL_CALL(TOOL_CALL_ID),
    TOOL_ARGUMENTS(TOOL_CALL_ARGUMENTS),
    TOOL_RESULT(TOOL_CALL_RESULT),

    AGENT(AGENT_NAME),
    AGENT_IDENTIFIER(AGENT_ID);

    private final List<String> keys;

    LlmTagField(String... keys) {
        this.keys = List.of(keys);
    }

    /** Candidate keys in resolution order. */
    public List<String> keys() {
        return keys;
    }

    /** Resolves this field against the tags, {@code null} when no candidate key has a value. */
    public String resolve(Map<String, String> tags) {
        for (String key : keys) {
            String value = tags.get(key);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }
}
