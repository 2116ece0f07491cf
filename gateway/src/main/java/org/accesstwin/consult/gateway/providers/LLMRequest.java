package org.accesstwin.consult.gateway.providers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request to send to an LLM provider: the new user text, the system-level
 * context, and the prior turns of the conversation.
 */
public final class LLMRequest {

    private final String text;
    private final String systemPrompt;
    private final List<LLMMessage> history;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;

    private LLMRequest(Builder builder) {
        this.text = builder.text != null ? builder.text : "";
        this.systemPrompt = builder.systemPrompt;
        this.history = builder.history != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.history)) : Collections.emptyList();
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
    }

    public String getText() {
        return text;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isEmpty();
    }

    public List<LLMMessage> getHistory() {
        return history;
    }

    /**
     * Override the configured model for this request
     */
    public String getModel() {
        return model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    /**
     * Flattens the request into chat order: system prompt, history, then the new user text.
     * Empty history entries are skipped.
     */
    public List<LLMMessage> toMessages(boolean includeSystem) {
        List<LLMMessage> messages = new ArrayList<>(history.size() + 2);
        if (includeSystem && hasSystemPrompt()) {
            messages.add(LLMMessage.system(systemPrompt));
        }
        for (LLMMessage message : history) {
            if (!message.getContent().isEmpty()) {
                messages.add(message);
            }
        }
        messages.add(LLMMessage.user(text));
        return messages;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String text;
        private String systemPrompt;
        private List<LLMMessage> history;
        private String model;
        private Double temperature;
        private Integer maxTokens;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder history(List<LLMMessage> history) {
            this.history = history;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public LLMRequest build() {
            return new LLMRequest(this);
        }
    }
}
