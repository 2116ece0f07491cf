package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.common.ConsultConstants;
import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpResponse;

/**
 * Adapter for an LM Studio server on the local machine (OpenAI-compatible API under {@code /v1}).
 */
public class LMStudioProvider extends OpenAICompatibleProvider {

    private static final Logger logger = LoggerFactory.getLogger(LMStudioProvider.class);

    public LMStudioProvider(ProviderConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);

        logger.info("LMStudioProvider initialized (API root: {})", getApiRoot());
    }

    @Override
    public String getProviderId() {
        return "lmstudio";
    }

    @Override
    public String getDisplayName() {
        return "LM Studio (Local)";
    }

    @Override
    public ProbeResult probe() {
        try {
            HttpResponse<String> response = sendModelsRequest();
            if (response.statusCode() == 200) {
                return ProbeResult.ok("Connected to LM Studio");
            }
            return ProbeResult.failed("Server returned status " + response.statusCode());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed("Connection failed: interrupted");
        } catch (Exception e) {
            logger.debug("LM Studio server not available: {}", describe(e));
            return ProbeResult.failed("Connection failed: " + describe(e));
        }
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();

        String baseUrl = config.getApiBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            result.addInfo("apiBaseUrl", "Using default: " + ConsultConstants.LMSTUDIO_DEFAULT_URL);
        } else if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            result.addError("apiBaseUrl", "Endpoint must be an http(s) URL");
        }

        return result.build();
    }

    @Override
    protected String getApiRoot() {
        String base = config.resolveBaseUrl(ConsultConstants.LMSTUDIO_DEFAULT_URL);
        return base.endsWith("/v1") ? base : base + "/v1";
    }

    @Override
    protected String getFallbackModel() {
        return ConsultConstants.LMSTUDIO_DEFAULT_MODEL;
    }
}
