package org.accesstwin.consult.gateway.providers.local;

import org.accesstwin.consult.gateway.providers.LLMMessage;
import org.accesstwin.consult.gateway.providers.LLMRequest;

/**
 * Renders a chat request as a single role-prefixed prompt for models that take raw text.
 */
public final class PromptFlattener {

    private PromptFlattener() {
    }

    /**
     * Produces {@code System: ...}, then each history turn, then {@code User: <text>},
     * separated by blank lines and ending with {@code Assistant:}.
     */
    public static String flatten(LLMRequest request) {
        StringBuilder prompt = new StringBuilder();
        for (LLMMessage message : request.toMessages(true)) {
            prompt.append(prefix(message.getRole()))
                    .append(": ")
                    .append(message.getContent())
                    .append("\n\n");
        }
        prompt.append("Assistant:");
        return prompt.toString();
    }

    private static String prefix(LLMMessage.MessageRole role) {
        switch (role) {
            case SYSTEM:
                return "System";
            case ASSISTANT:
                return "Assistant";
            case USER:
            default:
                return "User";
        }
    }
}
