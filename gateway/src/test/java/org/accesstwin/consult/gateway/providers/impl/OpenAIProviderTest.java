package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.StreamFragment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OpenAIProvider.
 */
class OpenAIProviderTest {

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

    private OpenAIProvider provider(String apiKey) {
        return new OpenAIProvider(ProviderConfig.builder()
                .providerId("openai")
                .apiKey(apiKey)
                .apiBaseUrl(server.baseUrl())
                .build(), objectMapper);
    }

    @Test
    void testGetDisplayName() {
        assertEquals("OpenAI (GPT)", provider("sk-test").getDisplayName());
    }

    @Test
    void testProbeWithoutKeyMakesNoRequest() {
        ProbeResult result = provider(null).probe();

        assertFalse(result.isOk());
        assertEquals("API key is required for cloud providers", result.getMessage());
        assertTrue(server.getRequests().isEmpty());
    }

    @Test
    void testStreamWithoutKeyMakesNoRequest() {
        List<StreamFragment> fragments = provider("").stream(LLMRequest.builder().text("hi").build()).readAll();

        assertEquals(1, fragments.size());
        assertEquals(ProviderException.Kind.CREDENTIAL, fragments.get(0).getErrorKind());
        assertTrue(server.getRequests().isEmpty());
    }

    @Test
    void testProbeListsModels() {
        server.respondJson("/models", 200, "{\"data\":[{\"id\":\"gpt-4o\"}]}");

        ProbeResult result = provider("sk-test").probe();

        assertTrue(result.isOk());
        assertEquals("Connected to OpenAI", result.getMessage());
        assertEquals("Bearer sk-test", server.lastRequest().header("Authorization"));
    }

    @Test
    void testProbeRejectedKey() {
        server.respondJson("/models", 401, "{\"error\":{\"message\":\"Incorrect API key provided\"}}");

        ProbeResult result = provider("sk-wrong").probe();

        assertFalse(result.isOk());
        assertEquals("Invalid API key (status 401)", result.getMessage());
    }

    @Test
    void testStreamSendsBearerAndDefaults() throws Exception {
        server.respond("/chat/completions", 200, "text/event-stream",
                "data: {\"choices\":[{\"delta\":{\"content\":\"Hello\"}}]}\n\n" +
                "data: [DONE]\n\n");

        List<StreamFragment> fragments = provider("sk-test").stream(LLMRequest.builder().text("hi").build()).readAll();

        assertEquals(1, fragments.size());
        assertEquals("Hello", fragments.get(0).getText());
        assertEquals("Bearer sk-test", server.lastRequest().header("Authorization"));

        JsonNode body = objectMapper.readTree(server.lastRequest().body);
        assertEquals("gpt-4o", body.path("model").asText());
        assertEquals(1, body.path("messages").size());
    }

    @Test
    void testUnauthorizedStream() {
        server.respondJson("/chat/completions", 401, "{\"error\":{\"message\":\"Incorrect API key provided\"}}");

        List<StreamFragment> fragments = provider("sk-wrong").stream(LLMRequest.builder().text("hi").build()).readAll();

        assertEquals(1, fragments.size());
        assertEquals(ProviderException.Kind.CREDENTIAL, fragments.get(0).getErrorKind());
        assertEquals("Invalid API key: Incorrect API key provided", fragments.get(0).getMessage());
    }

    @Test
    void testRateLimitedStream() {
        server.respondJson("/chat/completions", 429, "{\"error\":{\"message\":\"Slow down\"}}");

        List<StreamFragment> fragments = provider("sk-test").stream(LLMRequest.builder().text("hi").build()).readAll();

        assertEquals(ProviderException.Kind.SERVER, fragments.get(0).getErrorKind());
        assertTrue(fragments.get(0).getMessage().startsWith("Rate limit exceeded"));
    }

    @Test
    void testValidateConfig_missingKey() {
        ValidationResult result = provider(null).validateConfig(ProviderConfig.builder().providerId("openai").build());

        assertFalse(result.isValid());
    }

    @Test
    void testValidateConfig_unusualKeyWarns() {
        ValidationResult result = provider(null).validateConfig(
                ProviderConfig.builder().providerId("openai").apiKey("abc").build());

        assertTrue(result.isValid());
        assertFalse(result.getWarnings().isEmpty());
    }
}
