package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.accesstwin.consult.common.ConsultConstants;
import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.providers.LLMMessage;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.LineDecoder;
import org.accesstwin.consult.gateway.stream.NdjsonChatDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;

/**
 * Adapter for an Ollama server running on the local machine.
 * Streams newline-delimited JSON chat messages from {@code /api/chat}.
 */
public class OllamaProvider extends AbstractHttpProvider {

    private static final Logger logger = LoggerFactory.getLogger(OllamaProvider.class);

    private static final int PROBE_MODEL_LIMIT = 5;

    public OllamaProvider(ProviderConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);

        logger.info("OllamaProvider initialized (base URL: {}, model: {})",
                getBaseUrl(), config.getDefaultModel() != null ?
                        config.getDefaultModel() : ConsultConstants.OLLAMA_DEFAULT_MODEL);
    }

    @Override
    public String getProviderId() {
        return "ollama";
    }

    @Override
    public String getDisplayName() {
        return "Ollama (Local)";
    }

    @Override
    public ProbeResult probe() {
        try {
            HttpResponse<String> response = sendGet(getBaseUrl() + "/api/tags", config.getProbeTimeout());

            if (response.statusCode() != 200) {
                return ProbeResult.failed("Server returned status " + response.statusCode());
            }

            List<String> models = parseModelNames(response.body());
            List<String> shown = models.subList(0, Math.min(PROBE_MODEL_LIMIT, models.size()));
            return ProbeResult.ok("Connected. Models: " + String.join(", ", shown));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed("Connection failed: interrupted");
        } catch (Exception e) {
            logger.debug("Ollama server not available: {}", describe(e));
            return ProbeResult.failed("Connection failed: " + describe(e));
        }
    }

    /**
     * Lists models installed on the Ollama server; empty if it cannot be reached.
     */
    public List<String> listModels() {
        try {
            HttpResponse<String> response = sendGet(getBaseUrl() + "/api/tags", config.getProbeTimeout());
            if (response.statusCode() == 200) {
                return parseModelNames(response.body());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.warn("Failed to list Ollama models: {}", describe(e));
        }
        return new ArrayList<>();
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();

        String baseUrl = config.getApiBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            result.addInfo("apiBaseUrl", "Using default: " + ConsultConstants.OLLAMA_DEFAULT_URL);
        } else if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            result.addError("apiBaseUrl", "Endpoint must be an http(s) URL");
        }

        return result.build();
    }

    @Override
    protected HttpRequest.Builder newGenerationRequest() {
        return HttpRequest.newBuilder().uri(URI.create(getBaseUrl() + "/api/chat"));
    }

    @Override
    protected LineDecoder newDecoder() {
        return new NdjsonChatDecoder(objectMapper);
    }

    @Override
    protected String buildApiRequest(LLMRequest request) throws ProviderException {
        try {
            ObjectNode apiRequest = objectMapper.createObjectNode();
            apiRequest.put("model", resolveModel(request, ConsultConstants.OLLAMA_DEFAULT_MODEL));
            apiRequest.put("stream", true);

            ArrayNode messages = apiRequest.putArray("messages");
            for (LLMMessage message : request.toMessages(true)) {
                ObjectNode msg = messages.addObject();
                msg.put("role", message.getRole().wireName());
                msg.put("content", message.getContent());
            }

            ObjectNode options = apiRequest.putObject("options");
            Double temperature = resolveTemperature(request);
            if (temperature != null) {
                options.put("temperature", temperature);
            }
            Integer maxTokens = resolveMaxTokens(request);
            if (maxTokens != null) {
                options.put("num_predict", maxTokens);
            }

            return objectMapper.writeValueAsString(apiRequest);

        } catch (Exception e) {
            throw new ProviderException(ProviderException.Kind.CONFIGURATION,
                    "Failed to build Ollama API request", e);
        }
    }

    @Override
    protected ProviderException handleErrorResponse(int statusCode, String responseBody) {
        String message = responseBody;

        try {
            JsonNode error = objectMapper.readTree(responseBody);
            if (error != null && error.has("error")) {
                message = error.path("error").asText();
            }
        } catch (Exception e) {
            logger.debug("Ollama error body is not JSON: {}", e.getMessage());
        }

        if (statusCode == 404) {
            return new ProviderException("ollama", ProviderException.Kind.SERVER,
                    "Model not found or Ollama server not available: " + message, statusCode, false);
        } else if (statusCode >= 500) {
            return ProviderException.serverError("ollama", "Server error: " + message);
        } else {
            return new ProviderException("ollama", ProviderException.Kind.SERVER,
                    "API error (" + statusCode + "): " + message, statusCode, false);
        }
    }

    private List<String> parseModelNames(String body) {
        List<String> models = new ArrayList<>();
        try {
            JsonNode modelsNode = objectMapper.readTree(body).path("models");
            if (modelsNode.isArray()) {
                for (JsonNode model : modelsNode) {
                    models.add(model.path("name").asText());
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to parse Ollama model list: {}", e.getMessage());
        }
        return models;
    }

    private String getBaseUrl() {
        return config.resolveBaseUrl(ConsultConstants.OLLAMA_DEFAULT_URL);
    }
}
