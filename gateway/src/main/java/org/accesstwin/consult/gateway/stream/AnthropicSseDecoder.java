package org.accesstwin.consult.gateway.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decoder for Anthropic Messages API server-sent events. Only {@code text_delta}
 * payloads of {@code content_block_delta} events produce output.
 *
 * <pre>
 * event: content_block_delta
 * data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"Hel"}}
 * event: message_stop
 * data: {"type":"message_stop"}
 * </pre>
 */
public class AnthropicSseDecoder implements LineDecoder {

    private final ObjectMapper objectMapper;

    public AnthropicSseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DecodedLine decode(String line) throws MalformedLineException {
        String data = JsonLines.sseData(line);
        if (data == null || data.isEmpty()) {
            return DecodedLine.skip();
        }

        JsonNode event = JsonLines.readObject(objectMapper, data);
        String type = event.path("type").asText("");

        switch (type) {
            case "content_block_delta":
                JsonNode delta = event.path("delta");
                if ("text_delta".equals(delta.path("type").asText())) {
                    return DecodedLine.content(delta.path("text").asText(""));
                }
                return DecodedLine.skip();

            case "message_stop":
                return DecodedLine.end();

            case "error":
                return DecodedLine.error(JsonLines.errorMessage(event.path("error")));

            default:
                // message_start, content_block_start/stop, message_delta, ping
                return DecodedLine.skip();
        }
    }
}
