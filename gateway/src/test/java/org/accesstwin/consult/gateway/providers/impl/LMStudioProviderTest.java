package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.stream.StreamFragment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LMStudioProvider against an in-process HTTP server.
 */
class LMStudioProviderTest {

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

    private LMStudioProvider providerAt(String baseUrl) {
        return new LMStudioProvider(ProviderConfig.builder()
                .providerId("lmstudio")
                .apiBaseUrl(baseUrl)
                .defaultModel("qwen2.5-7b-instruct")
                .build(), objectMapper);
    }

    @Test
    void testStreamUsesChatCompletions() throws Exception {
        server.respond("/v1/chat/completions", 200, "text/event-stream",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Use \"}}]}\n\n" +
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"captions.\"}}]}\n\n" +
                "data: {\"choices\":[{\"index\":0,\"delta\":{},\"finish_reason\":\"stop\"}]}\n\n" +
                "data: [DONE]\n\n");

        List<StreamFragment> fragments = providerAt(server.baseUrl())
                .stream(LLMRequest.builder().systemPrompt("sys").text("Help?").build())
                .readAll();

        assertEquals(2, fragments.size());
        assertEquals("Use captions.", fragments.get(0).getText() + fragments.get(1).getText());

        JsonNode body = objectMapper.readTree(server.lastRequest().body);
        assertEquals("qwen2.5-7b-instruct", body.path("model").asText());
        assertTrue(body.path("stream").asBoolean());
        assertEquals("system", body.path("messages").get(0).path("role").asText());
        assertFalse(body.has("max_tokens"));
        assertNull(server.lastRequest().header("Authorization"));
    }

    @Test
    void testEndpointWithVersionSuffix() {
        server.respond("/v1/chat/completions", 200, "text/event-stream",
                "data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}\n\ndata: [DONE]\n\n");

        List<StreamFragment> fragments = providerAt(server.baseUrl() + "/v1/")
                .stream(LLMRequest.builder().text("x").build())
                .readAll();

        assertEquals("ok", fragments.get(0).getText());
        assertEquals("/v1/chat/completions", server.lastRequest().path);
    }

    @Test
    void testErrorBodyBecomesOneFragment() {
        server.respondJson("/v1/chat/completions", 400, "{\"error\":{\"message\":\"No models loaded\"}}");

        List<StreamFragment> fragments = providerAt(server.baseUrl())
                .stream(LLMRequest.builder().text("x").build())
                .readAll();

        assertEquals(1, fragments.size());
        assertTrue(fragments.get(0).isError());
        assertEquals("[Error: API error (400): No models loaded]", fragments.get(0).getText());
    }

    @Test
    void testErrorStringBody() {
        server.respondJson("/v1/chat/completions", 404, "{\"error\":\"Unexpected endpoint\"}");

        List<StreamFragment> fragments = providerAt(server.baseUrl())
                .stream(LLMRequest.builder().text("x").build())
                .readAll();

        assertEquals(1, fragments.size());
        assertTrue(fragments.get(0).getMessage().contains("Unexpected endpoint"));
    }

    @Test
    void testProbe() {
        server.respondJson("/v1/models", 200, "{\"data\":[{\"id\":\"qwen2.5-7b-instruct\"}]}");

        ProbeResult result = providerAt(server.baseUrl()).probe();

        assertTrue(result.isOk());
        assertEquals("Connected to LM Studio", result.getMessage());
    }

    @Test
    void testProbeFailure() {
        server.respondJson("/v1/models", 500, "{}");

        ProbeResult result = providerAt(server.baseUrl()).probe();

        assertFalse(result.isOk());
        assertEquals("Server returned status 500", result.getMessage());
    }

    @Test
    void testListModels() {
        server.respondJson("/v1/models", 200,
                "{\"object\":\"list\",\"data\":[{\"id\":\"a\"},{\"id\":\"b\"}]}");

        assertEquals(Arrays.asList("a", "b"), providerAt(server.baseUrl()).listModels());
    }
}
