package org.accesstwin.consult.gateway.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decoder for newline-delimited JSON chat streams (Ollama {@code /api/chat}).
 *
 * <pre>
 * {"message":{"role":"assistant","content":"Hel"},"done":false}
 * {"message":{"role":"assistant","content":""},"done":true,"eval_count":42}
 * {"error":"model 'x' not found"}
 * </pre>
 */
public class NdjsonChatDecoder implements LineDecoder {

    private final ObjectMapper objectMapper;

    public NdjsonChatDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DecodedLine decode(String line) throws MalformedLineException {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return DecodedLine.skip();
        }

        JsonNode event = JsonLines.readObject(objectMapper, trimmed);

        JsonNode error = event.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            return DecodedLine.error(JsonLines.errorMessage(error));
        }

        String content = event.path("message").path("content").asText("");
        if (event.path("done").asBoolean(false)) {
            return DecodedLine.endWith(content);
        }
        return DecodedLine.content(content);
    }
}
