package org.accesstwin.consult.gateway.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON helpers shared by the wire decoders.
 */
final class JsonLines {

    static final String SSE_DATA_PREFIX = "data:";

    private JsonLines() {
    }

    /**
     * Parses a payload that must be a JSON object.
     */
    static JsonNode readObject(ObjectMapper objectMapper, String payload) throws MalformedLineException {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedLineException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedLineException("Expected a JSON object");
        }
        return node;
    }

    /**
     * Returns the payload of an SSE {@code data:} line, or null for any other line.
     */
    static String sseData(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith(SSE_DATA_PREFIX)) {
            return null;
        }
        return trimmed.substring(SSE_DATA_PREFIX.length()).trim();
    }

    /**
     * Extracts a message from an error node that may be a string or an object with a message.
     */
    static String errorMessage(JsonNode error) {
        if (error == null || error.isMissingNode() || error.isNull()) {
            return "Unknown error";
        }
        if (error.isTextual()) {
            return error.asText();
        }
        JsonNode message = error.path("message");
        if (message.isTextual() && !message.asText().isEmpty()) {
            return message.asText();
        }
        return error.toString();
    }
}
