package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.gateway.providers.LLMMessage;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.StreamFragment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClaudeProvider.
 */
class ClaudeProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private StubServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = StubServer.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private ClaudeProvider provider(String apiKey) {
        return new ClaudeProvider(ProviderConfig.builder()
                .providerId("anthropic")
                .apiKey(apiKey)
                .apiBaseUrl(server.baseUrl())
                .build(), objectMapper);
    }

    @Nested
    @DisplayName("Probe")
    class Probe {

        @Test
        @DisplayName("should accept a well-formed key without a network call")
        void shouldAcceptWellFormedKey() {
            ProbeResult result = provider("sk-ant-xyz").probe();

            assertTrue(result.isOk());
            assertEquals("Anthropic API key format valid", result.getMessage());
            assertTrue(server.getRequests().isEmpty());
        }

        @Test
        @DisplayName("should reject a malformed key without a network call")
        void shouldRejectMalformedKey() {
            ProbeResult result = provider("bad-key").probe();

            assertFalse(result.isOk());
            assertEquals("Invalid API key format", result.getMessage());
            assertTrue(server.getRequests().isEmpty());
        }

        @Test
        @DisplayName("should require a key")
        void shouldRequireKey() {
            ProbeResult result = provider(null).probe();

            assertFalse(result.isOk());
            assertEquals("API key is required for cloud providers", result.getMessage());
            assertTrue(server.getRequests().isEmpty());
        }
    }

    @Nested
    @DisplayName("Streaming")
    class Streaming {

        @Test
        @DisplayName("should reject a malformed key before the network")
        void shouldRejectMalformedKey() {
            List<StreamFragment> fragments = provider("bad-key")
                    .stream(LLMRequest.builder().text("hi").build())
                    .readAll();

            assertEquals(1, fragments.size());
            assertEquals(ProviderException.Kind.CREDENTIAL, fragments.get(0).getErrorKind());
            assertEquals("[Error: Invalid API key format]", fragments.get(0).getText());
            assertTrue(server.getRequests().isEmpty());
        }

        @Test
        @DisplayName("should send the Messages API shape and decode text deltas")
        void shouldSendMessagesShape() throws Exception {
            server.respond("/messages", 200, "text/event-stream",
                    "event: message_start\n" +
                    "data: {\"type\":\"message_start\",\"message\":{\"id\":\"msg_1\"}}\n\n" +
                    "event: content_block_delta\n" +
                    "data: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Start with \"}}\n\n" +
                    "event: content_block_delta\n" +
                    "data: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"strengths.\"}}\n\n" +
                    "event: message_stop\n" +
                    "data: {\"type\":\"message_stop\"}\n\n");

            LLMRequest request = LLMRequest.builder()
                    .systemPrompt("You are a coach.")
                    .history(Arrays.asList(LLMMessage.system("Earlier note"), LLMMessage.assistant("Sure.")))
                    .text("Where do I begin?")
                    .build();

            List<StreamFragment> fragments = provider("sk-ant-test").stream(request).readAll();

            assertEquals(2, fragments.size());
            assertEquals("Start with strengths.", fragments.get(0).getText() + fragments.get(1).getText());

            StubServer.RecordedRequest sent = server.lastRequest();
            assertEquals("sk-ant-test", sent.header("x-api-key"));
            assertEquals("2023-06-01", sent.header("anthropic-version"));

            JsonNode body = objectMapper.readTree(sent.body);
            assertEquals("You are a coach.", body.path("system").asText());
            assertEquals(4096, body.path("max_tokens").asInt());
            assertTrue(body.path("stream").asBoolean());

            JsonNode messages = body.path("messages");
            assertEquals(3, messages.size());
            assertEquals("user", messages.get(0).path("role").asText());
            assertEquals("Earlier note", messages.get(0).path("content").asText());
            assertEquals("assistant", messages.get(1).path("role").asText());
            assertEquals("user", messages.get(2).path("role").asText());
        }

        @Test
        @DisplayName("should surface an overloaded response as a server error")
        void shouldSurfaceOverloaded() {
            server.respondJson("/messages", 529,
                    "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}");

            List<StreamFragment> fragments = provider("sk-ant-test")
                    .stream(LLMRequest.builder().text("hi").build())
                    .readAll();

            assertEquals(1, fragments.size());
            assertEquals(ProviderException.Kind.SERVER, fragments.get(0).getErrorKind());
            assertEquals("Server error: Overloaded", fragments.get(0).getMessage());
        }

        @Test
        @DisplayName("should map 401 to a credential error")
        void shouldMapUnauthorized() {
            server.respondJson("/messages", 401,
                    "{\"type\":\"error\",\"error\":{\"type\":\"authentication_error\",\"message\":\"invalid x-api-key\"}}");

            List<StreamFragment> fragments = provider("sk-ant-revoked")
                    .stream(LLMRequest.builder().text("hi").build())
                    .readAll();

            assertEquals(ProviderException.Kind.CREDENTIAL, fragments.get(0).getErrorKind());
        }
    }
}
