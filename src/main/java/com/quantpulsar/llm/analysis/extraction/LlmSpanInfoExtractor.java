package com.quantpulsar.llm.analysis.extraction;

import com.quantpulsar.llm.analysis.model.LlmSpanInfo;
import com.quantpulsar.llm.analysis.model.Span;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the flat tag bag of a span into a typed {@link LlmSpanInfo}.
 * Pure: the same tags always yield the same record, and malformed values
 * degrade to absent fields rather than errors.
 *
 * @author Quantpulsar 2025-2026
 * @see LlmTagField
 */
public class LlmSpanInfoExtractor {

    private final MessageParser messageParser;
    private final EmbeddedCheckExtractor checkExtractor;

    public LlmSpanInfoExtractor() {
        this(new MessageParser(), new EmbeddedCheckExtractor());
    }

    public LlmSpanInfoExtractor(MessageParser messageParser, EmbeddedCheckExtractor checkExtractor) {
        this.messageParser = messageParser;
        this.checkExtractor = checkExtractor;
    }

    /** True iff any LLM indicator key is present, regardless of its value. */
    public boolean isLlmSpan(Map<String, String> tags) {
        if (tags == null) {
            return false;
        }
        for (String indicator : GenAiAttributes.LLM_INDICATORS) {
            if (tags.containsKey(indicator)) {
                return true;
            }
        }
        return false;
    }

    public LlmSpanInfo extractLlmSpanInfo(@NotNull Span span) {
        return extractLlmSpanInfo(span.tags());
    }

    public LlmSpanInfo extractLlmSpanInfo(Map<String, String> tags) {
        if (!isLlmSpan(tags)) {
            return LlmSpanInfo.notLlmSpan();
        }

        return LlmSpanInfo.builder()
                .llmSpan(true)
                .operationType(LlmTagField.OPERATION_TYPE.resolve(tags))
                .provider(LlmTagField.PROVIDER.resolve(tags))
                .requestModel(LlmTagField.REQUEST_MODEL_NAME.resolve(tags))
                .responseModel(LlmTagField.RESPONSE_MODEL_NAME.resolve(tags))
                .inputTokens(TolerantNumbers.parseLong(LlmTagField.INPUT_TOKENS.resolve(tags)))
                .outputTokens(TolerantNumbers.parseLong(LlmTagField.OUTPUT_TOKENS.resolve(tags)))
                .temperature(TolerantNumbers.parseDouble(LlmTagField.TEMPERATURE.resolve(tags)))
                .topP(TolerantNumbers.parseDouble(LlmTagField.TOP_P.resolve(tags)))
                .topK(TolerantNumbers.parseLong(LlmTagField.TOP_K.resolve(tags)))
                .maxTokens(TolerantNumbers.parseLong(LlmTagField.MAX_TOKENS.resolve(tags)))
                .frequencyPenalty(TolerantNumbers.parseDouble(LlmTagField.FREQUENCY_PENALTY.resolve(tags)))
                .presencePenalty(TolerantNumbers.parseDouble(LlmTagField.PRESENCE_PENALTY.resolve(tags)))
                .responseId(LlmTagField.RESPONSE_ID_VALUE.resolve(tags))
                .finishReasons(splitList(LlmTagField.FINISH_REASONS.resolve(tags)))
                .inputMessages(messageParser.parse(LlmTagField.INPUT_MESSAGES_JSON.resolve(tags)))
                .outputMessages(messageParser.parse(LlmTagField.OUTPUT_MESSAGES_JSON.resolve(tags)))
                .systemInstructions(LlmTagField.SYSTEM_INSTRUCTIONS_TEXT.resolve(tags))
                .conversationId(LlmTagField.CONVERSATION.resolve(tags))
                .outputType(LlmTagField.OUTPUT_TYPE_VALUE.resolve(tags))
                .toolName(LlmTagField.TOOL.resolve(tags))
                .toolType(LlmTagField.TOOL_KIND.resolve(tags))
                .toolCallId(LlmTagField.TOOL_CALL.resolve(tags))
                .toolArguments(LlmTagField.TOOL_ARGUMENTS.resolve(tags))
                .toolResult(LlmTagField.TOOL_RESULT.resolve(tags))
                .agentName(LlmTagField.AGENT.resolve(tags))
                .agentId(LlmTagField.AGENT_IDENTIFIER.resolve(tags))
                .qualityChecks(checkExtractor.extractQualityChecks(tags))
                .securityChecks(checkExtractor.extractSecurityChecks(tags))
                .build();
    }

    // Finish reasons arrive comma-joined; a JSON-array rendering is tolerated too
    private static List<String> splitList(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        List<String> items = new ArrayList<>();
        for (String part : trimmed.split(",")) {
            String item = part.trim();
            if (item.length() >= 2 && item.startsWith("\"") && item.endsWith("\"")) {
                item = item.substring(1, item.length() - 1);
            }
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }
}
