package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.common.ConsultConstants;
import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * OpenAI chat-completions adapter. Requires an API key; requests without one
 * are rejected before any network traffic.
 */
public class OpenAIProvider extends OpenAICompatibleProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenAIProvider.class);

    static final String MISSING_KEY_MESSAGE = "API key is required for cloud providers";

    public OpenAIProvider(ProviderConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);

        logger.info("OpenAIProvider initialized (API base: {}, key configured: {})",
                getApiRoot(), config.hasApiKey());
    }

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public String getDisplayName() {
        return "OpenAI (GPT)";
    }

    @Override
    public ProbeResult probe() {
        if (!config.hasApiKey()) {
            return ProbeResult.failed(MISSING_KEY_MESSAGE);
        }

        try {
            HttpResponse<String> response = sendModelsRequest();
            int status = response.statusCode();
            if (status == 200) {
                return ProbeResult.ok("Connected to OpenAI");
            } else if (status == 401) {
                return ProbeResult.failed("Invalid API key (status 401)");
            }
            return ProbeResult.failed("API returned status " + status);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed("Connection failed: interrupted");
        } catch (Exception e) {
            logger.debug("OpenAI API not reachable: {}", describe(e));
            return ProbeResult.failed("Connection failed: " + describe(e));
        }
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (!config.hasApiKey()) {
            result.addError("apiKey", "API key is required");
        } else if (!config.getApiKey().startsWith("sk-")) {
            result.addWarning("apiKey", "API key should start with 'sk-'");
        }

        return result.build();
    }

    @Override
    protected void checkReady() throws ProviderException {
        if (!config.hasApiKey()) {
            throw ProviderException.credential(getProviderId(), MISSING_KEY_MESSAGE);
        }
    }

    @Override
    protected HttpRequest.Builder authorize(HttpRequest.Builder builder) {
        return builder.header("Authorization", "Bearer " + config.getApiKey());
    }

    @Override
    protected String getApiRoot() {
        return config.resolveBaseUrl(ConsultConstants.OPENAI_API_BASE);
    }

    @Override
    protected String getFallbackModel() {
        return ConsultConstants.OPENAI_DEFAULT_MODEL;
    }
}
