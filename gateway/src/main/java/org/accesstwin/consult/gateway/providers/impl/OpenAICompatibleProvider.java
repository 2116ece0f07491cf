package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.accesstwin.consult.gateway.providers.LLMMessage;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.LineDecoder;
import org.accesstwin.consult.gateway.stream.OpenAiSseDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for backends speaking the OpenAI chat-completions dialect:
 * {@code POST <root>/chat/completions} with {@code stream: true}, answered by SSE.
 */
public abstract class OpenAICompatibleProvider extends AbstractHttpProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenAICompatibleProvider.class);

    protected OpenAICompatibleProvider(ProviderConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);
    }

    /**
     * Root of the API, e.g. {@code https://api.openai.com/v1}. No trailing slash.
     */
    protected abstract String getApiRoot();

    protected abstract String getFallbackModel();

    /**
     * Adds authentication headers, if any, to an outgoing request.
     */
    protected HttpRequest.Builder authorize(HttpRequest.Builder builder) {
        return builder;
    }

    /**
     * Lists model ids reported by {@code GET <root>/models}; empty if unreachable.
     */
    public List<String> listModels() {
        List<String> models = new ArrayList<>();
        try {
            HttpResponse<String> response = sendModelsRequest();
            if (response.statusCode() == 200) {
                JsonNode data = objectMapper.readTree(response.body()).path("data");
                if (data.isArray()) {
                    for (JsonNode model : data) {
                        models.add(model.path("id").asText());
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.warn("Failed to list {} models: {}", getProviderId(), describe(e));
        }
        return models;
    }

    protected HttpResponse<String> sendModelsRequest() throws IOException, InterruptedException {
        HttpRequest request = authorize(HttpRequest.newBuilder()
                .uri(URI.create(getApiRoot() + "/models"))
                .GET()
                .timeout(config.getProbeTimeout()))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Override
    protected HttpRequest.Builder newGenerationRequest() {
        return authorize(HttpRequest.newBuilder()
                .uri(URI.create(getApiRoot() + "/chat/completions")));
    }

    @Override
    protected LineDecoder newDecoder() {
        return new OpenAiSseDecoder(objectMapper);
    }

    @Override
    protected String buildApiRequest(LLMRequest request) throws ProviderException {
        try {
            ObjectNode apiRequest = objectMapper.createObjectNode();
            apiRequest.put("model", resolveModel(request, getFallbackModel()));
            apiRequest.put("stream", true);

            ArrayNode messages = apiRequest.putArray("messages");
            for (LLMMessage message : request.toMessages(true)) {
                ObjectNode msg = messages.addObject();
                msg.put("role", message.getRole().wireName());
                msg.put("content", message.getContent());
            }

            Integer maxTokens = resolveMaxTokens(request);
            if (maxTokens != null) {
                apiRequest.put("max_tokens", maxTokens);
            }

            Double temperature = resolveTemperature(request);
            if (temperature != null) {
                apiRequest.put("temperature", temperature);
            }

            return objectMapper.writeValueAsString(apiRequest);

        } catch (Exception e) {
            throw new ProviderException(ProviderException.Kind.CONFIGURATION,
                    "Failed to build " + getDisplayName() + " API request", e);
        }
    }

    @Override
    protected ProviderException handleErrorResponse(int statusCode, String responseBody) {
        String message;

        try {
            JsonNode errorNode = objectMapper.readTree(responseBody).path("error");
            if (errorNode.isTextual()) {
                message = errorNode.asText();
            } else {
                message = errorNode.path("message").asText(responseBody);
            }
        } catch (Exception e) {
            message = responseBody;
        }

        String providerId = getProviderId();
        if (statusCode == 401) {
            return ProviderException.unauthorized(providerId, "Invalid API key: " + message);
        } else if (statusCode == 429) {
            return ProviderException.rateLimited(providerId, "Rate limit exceeded: " + message);
        } else if (statusCode >= 500) {
            return ProviderException.serverError(providerId, "Server error: " + message);
        } else {
            return new ProviderException(providerId, ProviderException.Kind.SERVER,
                    "API error (" + statusCode + "): " + message, statusCode, false);
        }
    }
}
