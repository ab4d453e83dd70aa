package com.quantpulsar.llm.analysis.model;

import java.util.List;

/**
 * Typed view of the GenAI attributes carried by one span.
 * Every optional field is {@code null} unless its tag (or a recognized alias) was present.
 * For spans without any LLM indicator only {@link #isLlmSpan()} is meaningful.
 *
 * @author Quantpulsar 2025-2026
 */
public final class LlmSpanInfo {

    private static final LlmSpanInfo NOT_LLM = builder().build();

    private final boolean llmSpan;
    private final String operationType;

    private final String provider;
    private final String requestModel;
    private final String responseModel;

    private final Long inputTokens;
    private final Long outputTokens;
    private final Long totalTokens;

    private final Double temperature;
    private final Double topP;
    private final Long topK;
    private final Long maxTokens;
    private final Double frequencyPenalty;
    private final Double presencePenalty;

    private final String responseId;
    private final List<String> finishReasons;

    private final List<LlmMessage> inputMessages;
    private final List<LlmMessage> outputMessages;
    private final String systemInstructions;

    private final String conversationId;
    private final String outputType;

    private final String toolName;
    private final String toolType;
    private final String toolCallId;
    private final String toolArguments;
    private final String toolResult;
    private final String agentName;
    private final String agentId;

    private final List<QualityCheck> qualityChecks;
    private final List<SecurityCheck> securityChecks;

    private LlmSpanInfo(Builder b) {
        this.llmSpan = b.llmSpan;
        this.operationType = b.operationType;
        this.provider = b.provider;
        this.requestModel = b.requestModel;
        this.responseModel = b.responseModel;
        this.inputTokens = b.inputTokens;
        this.outputTokens = b.outputTokens;
        this.totalTokens = b.inputTokens == null && b.outputTokens == null
                ? null
                : orZero(b.inputTokens) + orZero(b.outputTokens);
        this.temperature = b.temperature;
        this.topP = b.topP;
        this.topK = b.topK;
        this.maxTokens = b.maxTokens;
        this.frequencyPenalty = b.frequencyPenalty;
        this.presencePenalty = b.presencePenalty;
        this.responseId = b.responseId;
        this.finishReasons = b.finishReasons != null ? List.copyOf(b.finishReasons) : null;
        this.inputMessages = b.inputMessages != null ? List.copyOf(b.inputMessages) : null;
        this.outputMessages = b.outputMessages != null ? List.copyOf(b.outputMessages) : null;
        this.systemInstructions = b.systemInstructions;
        this.conversationId = b.conversationId;
        this.outputType = b.outputType;
        this.toolName = b.toolName;
        this.toolType = b.toolType;
        this.toolCallId = b.toolCallId;
        this.toolArguments = b.toolArguments;
        this.toolResult = b.toolResult;
        this.agentName = b.agentName;
        this.agentId = b.agentId;
        this.qualityChecks = b.qualityChecks != null ? List.copyOf(b.qualityChecks) : List.of();
        this.securityChecks = b.securityChecks != null ? List.copyOf(b.securityChecks) : List.of();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    /** The record returned for spans that carry no LLM indicator. */
    public static LlmSpanInfo notLlmSpan() {
        return NOT_LLM;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isLlmSpan() {
        return llmSpan;
    }

    public String getOperationType() {
        return operationType;
    }

    public String getProvider() {
        return provider;
    }

    public String getRequestModel() {
        return requestModel;
    }

    public String getResponseModel() {
        return responseModel;
    }

    /** Request model, falling back to the response model. */
    public String getModel() {
        return requestModel != null ? requestModel : responseModel;
    }

    public Long getInputTokens() {
        return inputTokens;
    }

    public Long getOutputTokens() {
        return outputTokens;
    }

    /** Sum of the present token counts, {@code null} when neither is present. */
    public Long getTotalTokens() {
        return totalTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Double getTopP() {
        return topP;
    }

    public Long getTopK() {
        return topK;
    }

    public Long getMaxTokens() {
        return maxTokens;
    }

    public Double getFrequencyPenalty() {
        return frequencyPenalty;
    }

    public Double getPresencePenalty() {
        return presencePenalty;
    }

    public String getResponseId() {
        return responseId;
    }

    public List<String> getFinishReasons() {
        return finishReasons;
    }

    public List<LlmMessage> getInputMessages() {
        return inputMessages;
    }

    public List<LlmMessage> getOutputMessages() {
        return outputMessages;
    }

    public String getSystemInstructions() {
        return systemInstructions;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getOutputType() {
        return outputType;
    }

    public String getToolName() {
        return toolName;
    }

    public String getToolType() {
        return toolType;
    }

    public String getToolCallId() {
        return toolCallId;
    }

    public String getToolArguments() {
        return toolArguments;
    }

    public String getToolResult() {
        return toolResult;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getAgentId() {
        return agentId;
    }

    public List<QualityCheck> getQualityChecks() {
        return qualityChecks;
    }

    public List<SecurityCheck> getSecurityChecks() {
        return securityChecks;
    }

    @Override
    public String toString() {
        if (!llmSpan) {
            return "LlmSpanInfo{isLlmSpan=false}";
        }
        return "LlmSpanInfo{operationType=" + operationType
                + ", provider=" + provider
                + ", requestModel=" + requestModel
                + ", inputTokens=" + inputTokens
                + ", outputTokens=" + outputTokens
                + ", toolName=" + toolName
                + ", agentName=" + agentName
                + ", qualityChecks=" + qualityChecks.size()
                + ", securityChecks=" + securityChecks.size() + "}";
    }

    /** Builder for {@link LlmSpanInfo}; total tokens are always derived. */
    public static final class Builder {
        private boolean llmSpan;
        private String operationType;
        private String provider;
        private String requestModel;
        private String responseModel;
        private Long inputTokens;
        private Long outputTokens;
        private Double temperature;
        private Double topP;
        private Long topK;
        private Long maxTokens;
        private Double frequencyPenalty;
        private Double presencePenalty;
        private String responseId;
        private List<String> finishReasons;
        private List<LlmMessage> inputMessages;
        private List<LlmMessage> outputMessages;
        private String systemInstructions;
        private String conversationId;
        private String outputType;
        private String toolName;
        private String toolType;
        private String toolCallId;
        private String toolArguments;
        private String toolResult;
        private String agentName;
        private String agentId;
        private List<QualityCheck> qualityChecks;
        private List<SecurityCheck> securityChecks;

        private Builder() {
        }

        public Builder llmSpan(boolean llmSpan) {
            this.llmSpan = llmSpan;
            return this;
        }

        public Builder operationType(String operationType) {
            this.operationType = operationType;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder requestModel(String requestModel) {
            this.requestModel = requestModel;
            return this;
        }

        public Builder responseModel(String responseModel) {
            this.responseModel = responseModel;
            return this;
        }

        public Builder inputTokens(Long inputTokens) {
            this.inputTokens = inputTokens;
            return this;
        }

        public Builder outputTokens(Long outputTokens) {
            this.outputTokens = outputTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder topK(Long topK) {
            this.topK = topK;
            return this;
        }

        public Builder maxTokens(Long maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder frequencyPenalty(Double frequencyPenalty) {
            this.frequencyPenalty = frequencyPenalty;
            return this;
        }

        public Builder presencePenalty(Double presencePenalty) {
            this.presencePenalty = presencePenalty;
            return this;
        }

        public Builder responseId(String responseId) {
            this.responseId = responseId;
            return this;
        }

        public Builder finishReasons(List<String> finishReasons) {
            this.finishReasons = finishReasons;
            return this;
        }

        public Builder inputMessages(List<LlmMessage> inputMessages) {
            this.inputMessages = inputMessages;
            return this;
        }

        public Builder outputMessages(List<LlmMessage> outputMessages) {
            this.outputMessages = outputMessages;
            return this;
        }

        public Builder systemInstructions(String systemInstructions) {
            this.systemInstructions = systemInstructions;
            return this;
        }

        public Builder conversationId(String conversationId) {
            this.conversationId = conversationId;
            return this;
        }

        public Builder outputType(String outputType) {
            this.outputType = outputType;
            return this;
        }

        public Builder toolName(String toolName) {
            this.toolName = toolName;
            return this;
        }

        public Builder toolType(String toolType) {
            this.toolType = toolType;
            return this;
        }

        public Builder toolCallId(String toolCallId) {
            this.toolCallId = toolCallId;
            return this;
        }

        public Builder toolArguments(String toolArguments) {
            this.toolArguments = toolArguments;
            return this;
        }

        public Builder toolResult(String toolResult) {
            this.toolResult = toolResult;
            return this;
        }

        public Builder agentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder qualityChecks(List<QualityCheck> qualityChecks) {
            this.qualityChecks = qualityChecks;
            return this;
        }

        public Builder securityChecks(List<SecurityCheck> securityChecks) {
            this.securityChecks = securityChecks;
            return this;
        }

        public LlmSpanInfo build() {
            return new LlmSpanInfo(this);
        }
    }
}
