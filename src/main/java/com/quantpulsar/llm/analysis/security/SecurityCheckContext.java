package com.quantpulsar.llm.analysis.security;

import com.quantpulsar.llm.analysis.model.LlmMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * The exchange to scan. User messages count as input and assistant messages as
 * output, alongside {@code userInput} and {@code llmOutput}.
 *
 * @author Quantpulsar 2025-2026
 */
public final class SecurityCheckContext {

    private final String userInput;
    private final String llmOutput;
    private final List<LlmMessage> messages;
    private final String systemPrompt;

    private SecurityCheckContext(Builder builder) {
        this.userInput = builder.userInput;
        this.llmOutput = builder.llmOutput;
        this.messages = builder.messages != null ? List.copyOf(builder.messages) : List.of();
        this.systemPrompt = builder.systemPrompt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SecurityCheckContext ofInput(String userInput) {
        return builder().userInput(userInput).build();
    }

    public static SecurityCheckContext ofOutput(String llmOutput) {
        return builder().llmOutput(llmOutput).build();
    }

    public static SecurityCheckContext of(String userInput, String llmOutput) {
        return builder().userInput(userInput).llmOutput(llmOutput).build();
    }

    public String getUserInput() {
        return userInput;
    }

    public String getLlmOutput() {
        return llmOutput;
    }

    public List<LlmMessage> getMessages() {
        return messages;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    /** User input followed by user message contents, newline separated. */
    String inputText() {
        return join(userInput, LlmMessage.ROLE_USER);
    }

    /** LLM output followed by assistant message contents, newline separated. */
    String outputText() {
        return join(llmOutput, LlmMessage.ROLE_ASSISTANT);
    }

    String combinedText() {
        List<String> parts = new ArrayList<>(2);
        addIfPresent(parts, inputText());
        addIfPresent(parts, outputText());
        return String.join("\n", parts);
    }

    private String join(String direct, String role) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, direct);
        for (LlmMessage message : messages) {
            if (message.hasRole(role)) {
                addIfPresent(parts, message.content());
            }
        }
        return String.join("\n", parts);
    }

    private static void addIfPresent(List<String> parts, String text) {
        if (text != null && !text.isEmpty()) {
            parts.add(text);
        }
    }

    public static final class Builder {
        private String userInput;
        private String llmOutput;
        private List<LlmMessage> messages;
        private String systemPrompt;

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

        public Builder messages(List<LlmMessage> messages) {
            this.messages = messages;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public SecurityCheckContext build() {
            return new SecurityCheckContext(this);
        }
    }
}
