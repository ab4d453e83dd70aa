package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.LlmMessage;

import java.util.List;

/**
 * One conversational exchange to evaluate. Only the output is required;
 * every other field degrades gracefully when absent.
 *
 * @author Quantpulsar 2025-2026
 */
public final class QualityCheckContext {

    private final String userInput;
    private final String llmOutput;
    private final List<String> providedContext;
    private final String systemInstructions;
    private final List<LlmMessage> messages;
    private final List<String> expectedTopics;

    private QualityCheckContext(Builder builder) {
        this.userInput = builder.userInput;
        this.llmOutput = builder.llmOutput != null ? builder.llmOutput : "";
        this.providedContext = copy(builder.providedContext);
        this.systemInstructions = builder.systemInstructions;
        this.messages = builder.messages != null ? List.copyOf(builder.messages) : List.of();
        this.expectedTopics = copy(builder.expectedTopics);
    }

    private static List<String> copy(List<String> values) {
        return values != null
                ? values.stream().filter(v -> v != null).toList()
                : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for an exchange with input and output only. */
    public static QualityCheckContext of(String userInput, String llmOutput) {
        return builder().userInput(userInput).llmOutput(llmOutput).build();
    }

    public String getUserInput() {
        return userInput;
    }

    public boolean hasUserInput() {
        return userInput != null && !userInput.isEmpty();
    }

    public String getLlmOutput() {
        return llmOutput;
    }

    public List<String> getProvidedContext() {
        return providedContext;
    }

    public String getSystemInstructions() {
        return systemInstructions;
    }

    public List<LlmMessage> getMessages() {
        return messages;
    }

    public List<String> getExpectedTopics() {
        return expectedTopics;
    }

    public static final class Builder {
        private String userInput;
        private String llmOutput;
        private List<String> providedContext;
        private String systemInstructions;
        private List<LlmMessage> messages;
        private List<String> expectedTopics;

        private Builder() {
        }

        public Builder userInput(String userInput) {
            this.userInput = userInput;
            return this;
        }

        public Builder llmOutput(String llmOutput) {
            this.llmOutput = llmOutput;
            return this;
        }

        public Builder providedContext(List<String> providedContext) {
            this.providedContext = providedContext;
            return this;
        }

        public Builder systemInstructions(String systemInstructions) {
            this.systemInstructions = systemInstructions;
            return this;
        }

        public Builder messages(List<LlmMessage> messages) {
            this.messages = messages;
            return this;
        }

        public Builder expectedTopics(List<String> expectedTopics) {
            this.expectedTopics = expectedTopics;
            return this;
        }

        public QualityCheckContext build() {
            return new QualityCheckContext(this);
        }
    }
}
