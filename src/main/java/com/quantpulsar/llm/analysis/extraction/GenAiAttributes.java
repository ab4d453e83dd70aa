package com.quantpulsar.llm.analysis.extraction;

import java.util.List;

/**
 * OpenTelemetry GenAI semantic convention attribute keys, plus the legacy
 * keys older instrumentations still emit.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/gen-ai/gen-ai-spans/">GenAI spans</a>
 */
public final class GenAiAttributes {

    // Operation & provider
    public static final String OPERATION_NAME = "gen_ai.operation.name";
    public static final String PROVIDER_NAME = "gen_ai.provider.name";

    // Request
    public static final String REQUEST_MODEL = "gen_ai.request.model";
    public static final String REQUEST_TEMPERATURE = "gen_ai.request.temperature";
    public static final String REQUEST_TOP_P = "gen_ai.request.top_p";
    public static final String REQUEST_TOP_K = "gen_ai.request.top_k";
    public static final String REQUEST_MAX_TOKENS = "gen_ai.request.max_tokens";
    public static final String REQUEST_FREQUENCY_PENALTY = "gen_ai.request.frequency_penalty";
    public static final String REQUEST_PRESENCE_PENALTY = "gen_ai.request.presence_penalty";

    // Response
    public static final String RESPONSE_MODEL = "gen_ai.response.model";
    public static final String RESPONSE_ID = "gen_ai.response.id";
    public static final String RESPONSE_FINISH_REASONS = "gen_ai.response.finish_reasons";

    // Usage
    public static final String USAGE_INPUT_TOKENS = "gen_ai.usage.input_tokens";
    public static final String USAGE_OUTPUT_TOKENS = "gen_ai.usage.output_tokens";

    // Content (opt-in)
    public static final String INPUT_MESSAGES = "gen_ai.input.messages";
    public static final String OUTPUT_MESSAGES = "gen_ai.output.messages";
    public static final String SYSTEM_INSTRUCTIONS = "gen_ai.system_instructions";

    // Conversation
    public static final String CONVERSATION_ID = "gen_ai.conversation.id";
    public static final String OUTPUT_TYPE = "gen_ai.output.type";

    // Tools
    public static final String TOOL_NAME = "gen_ai.tool.name";
    public static final String TOOL_TYPE = "gen_ai.tool.type";
    public static final String TOOL_CALL_ID = "gen_ai.tool.call.id";
    public static final String TOOL_CALL_ARGUMENTS = "gen_ai.tool.call.arguments";
    public static final String TOOL_CALL_RESULT = "gen_ai.tool.call.result";

    // Agents
    public static final String AGENT_NAME = "gen_ai.agent.name";
    public static final String AGENT_ID = "gen_ai.agent.id";

    // Legacy
    public static final String LEGACY_SYSTEM = "gen_ai.system";
    public static final String LEGACY_LLM_MODEL = "llm.model";
    public static final String LEGACY_AI_MODEL = "ai.model";

    /** Operation type values with workflow meaning. */
    public static final String OPERATION_TOOL = "tool";
    public static final String OPERATION_AGENT_HANDOFF = "agent_handoff";

    /** Presence of any of these keys marks a span as an LLM span. */
    public static final List<String> LLM_INDICATORS = List.of(
            OPERATION_NAME,
            REQUEST_MODEL,
            PROVIDER_NAME,
            USAGE_INPUT_TOKENS,
            LEGACY_LLM_MODEL,
            LEGACY_AI_MODEL,
            LEGACY_SYSTEM);

    private GenAiAttributes() {
    }
}
