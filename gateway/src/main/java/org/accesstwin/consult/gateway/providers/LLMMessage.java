package org.accesstwin.consult.gateway.providers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * One turn of a consultation conversation. Turn history is owned by the caller
 * and only read for the duration of a single generation call.
 */
public final class LLMMessage {

    /**
     * Role of the message sender
     */
    public enum MessageRole {
        SYSTEM,
        USER,
        ASSISTANT;

        /**
         * Wire name used by chat-style APIs.
         */
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MessageRole role;
    private final String content;

    @JsonCreator
    public LLMMessage(
            @JsonProperty("role") MessageRole role,
            @JsonProperty("content") String content) {
        this.role = Objects.requireNonNull(role, "role cannot be null");
        this.content = content != null ? content : "";
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    /**
     * Factory for user messages
     */
    public static LLMMessage user(String content) {
        return new LLMMessage(MessageRole.USER, content);
    }

    /**
     * Factory for assistant messages
     */
    public static LLMMessage assistant(String content) {
        return new LLMMessage(MessageRole.ASSISTANT, content);
    }

    /**
     * Factory for system messages
     */
    public static LLMMessage system(String content) {
        return new LLMMessage(MessageRole.SYSTEM, content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LLMMessage that = (LLMMessage) o;
        return role == that.role && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content);
    }

    @Override
    public String toString() {
        return "LLMMessage{role=" + role + ", length=" + content.length() + '}';
    }
}
