package org.accesstwin.consult.gateway.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decoder for OpenAI-style server-sent chat completion deltas, shared by
 * OpenAI and OpenAI-compatible local servers.
 *
 * <pre>
 * data: {"choices":[{"delta":{"content":"Hel"}}]}
 * data: [DONE]
 * </pre>
 */
public class OpenAiSseDecoder implements LineDecoder {

    static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;

    public OpenAiSseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DecodedLine decode(String line) throws MalformedLineException {
        String data = JsonLines.sseData(line);
        if (data == null || data.isEmpty()) {
            return DecodedLine.skip();
        }
        if (DONE_MARKER.equals(data)) {
            return DecodedLine.end();
        }

        JsonNode event = JsonLines.readObject(objectMapper, data);

        JsonNode error = event.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            return DecodedLine.error(JsonLines.errorMessage(error));
        }

        JsonNode choices = event.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return DecodedLine.skip();
        }

        JsonNode content = choices.get(0).path("delta").path("content");
        return content.isTextual() ? DecodedLine.content(content.asText()) : DecodedLine.skip();
    }
}
