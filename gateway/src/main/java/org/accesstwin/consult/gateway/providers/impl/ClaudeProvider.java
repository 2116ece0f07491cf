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
import org.accesstwin.consult.gateway.stream.AnthropicSseDecoder;
import org.accesstwin.consult.gateway.stream.LineDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;

/**
 * Anthropic Messages API adapter.
 *
 * <p>The system prompt travels in the top-level {@code system} field; any system
 * turns found in the history are sent as user turns since the Messages API has no
 * system role. Probing only checks the key's shape and makes no network call.
 */
public class ClaudeProvider extends AbstractHttpProvider {

    private static final Logger logger = LoggerFactory.getLogger(ClaudeProvider.class);

    static final String MISSING_KEY_MESSAGE = "API key is required for cloud providers";
    static final String INVALID_KEY_MESSAGE = "Invalid API key format";

    public ClaudeProvider(ProviderConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);

        logger.info("ClaudeProvider initialized (API base: {}, key configured: {})",
                getApiBase(), config.hasApiKey());
    }

    @Override
    public String getProviderId() {
        return "anthropic";
    }

    @Override
    public String getDisplayName() {
        return "Anthropic Claude";
    }

    @Override
    public ProbeResult probe() {
        if (!config.hasApiKey()) {
            return ProbeResult.failed(MISSING_KEY_MESSAGE);
        }
        if (!hasValidKeyShape()) {
            return ProbeResult.failed(INVALID_KEY_MESSAGE);
        }
        return ProbeResult.ok("Anthropic API key format valid");
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (!config.hasApiKey()) {
            result.addError("apiKey", "API key is required");
        } else if (!config.getApiKey().startsWith(ConsultConstants.ANTHROPIC_KEY_PREFIX)) {
            result.addError("apiKey", "API key should start with '"
                    + ConsultConstants.ANTHROPIC_KEY_PREFIX + "'");
        }

        return result.build();
    }

    @Override
    protected void checkReady() throws ProviderException {
        if (!config.hasApiKey()) {
            throw ProviderException.credential(getProviderId(), MISSING_KEY_MESSAGE);
        }
        if (!hasValidKeyShape()) {
            throw ProviderException.credential(getProviderId(), INVALID_KEY_MESSAGE);
        }
    }

    @Override
    protected HttpRequest.Builder newGenerationRequest() {
        return HttpRequest.newBuilder()
                .uri(URI.create(getApiBase() + "/messages"))
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ConsultConstants.ANTHROPIC_VERSION);
    }

    @Override
    protected LineDecoder newDecoder() {
        return new AnthropicSseDecoder(objectMapper);
    }

    @Override
    protected String buildApiRequest(LLMRequest request) throws ProviderException {
        try {
            ObjectNode apiRequest = objectMapper.createObjectNode();
            apiRequest.put("model", resolveModel(request, ConsultConstants.ANTHROPIC_DEFAULT_MODEL));

            Integer maxTokens = resolveMaxTokens(request);
            apiRequest.put("max_tokens", maxTokens != null ? maxTokens : ConsultConstants.DEFAULT_MAX_TOKENS);
            apiRequest.put("stream", true);

            if (request.hasSystemPrompt()) {
                apiRequest.put("system", request.getSystemPrompt());
            }

            Double temperature = resolveTemperature(request);
            if (temperature != null) {
                apiRequest.put("temperature", temperature);
            }

            ArrayNode messages = apiRequest.putArray("messages");
            for (LLMMessage message : request.toMessages(false)) {
                ObjectNode msg = messages.addObject();
                String role = message.getRole() == LLMMessage.MessageRole.ASSISTANT ? "assistant" : "user";
                msg.put("role", role);
                msg.put("content", message.getContent());
            }

            return objectMapper.writeValueAsString(apiRequest);

        } catch (Exception e) {
            throw new ProviderException(ProviderException.Kind.CONFIGURATION,
                    "Failed to build Claude API request", e);
        }
    }

    @Override
    protected ProviderException handleErrorResponse(int statusCode, String responseBody) {
        String message;

        try {
            JsonNode errorNode = objectMapper.readTree(responseBody).path("error");
            message = errorNode.path("message").asText(responseBody);
        } catch (Exception e) {
            message = responseBody;
        }

        if (statusCode == 401) {
            return ProviderException.unauthorized("anthropic", "Invalid API key: " + message);
        } else if (statusCode == 429) {
            return ProviderException.rateLimited("anthropic", "Rate limit exceeded: " + message);
        } else if (statusCode >= 500) {
            return ProviderException.serverError("anthropic", "Server error: " + message);
        } else if (statusCode == 400) {
            return new ProviderException("anthropic", ProviderException.Kind.SERVER,
                    "Bad request: " + message, statusCode, false);
        } else {
            return new ProviderException("anthropic", ProviderException.Kind.SERVER,
                    "API error (" + statusCode + "): " + message, statusCode, false);
        }
    }

    private boolean hasValidKeyShape() {
        return config.getApiKey().startsWith(ConsultConstants.ANTHROPIC_KEY_PREFIX);
    }

    private String getApiBase() {
        return config.resolveBaseUrl(ConsultConstants.ANTHROPIC_API_BASE);
    }
}
