package org.accesstwin.consult.gateway.providers.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.gateway.providers.LLMProvider;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.FragmentStream;
import org.accesstwin.consult.gateway.stream.LineDecoder;
import org.accesstwin.consult.gateway.stream.LineDecodingStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Shared plumbing for adapters that stream over HTTP: one client per adapter,
 * lazy request dispatch, and conversion of transport failures and non-200
 * statuses into {@link ProviderException}s.
 */
public abstract class AbstractHttpProvider implements LLMProvider {

    private static final Logger logger = LoggerFactory.getLogger(AbstractHttpProvider.class);

    protected final ProviderConfig config;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpProvider(ProviderConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .build();
    }

    /**
     * Builds the JSON request body for a streaming generation.
     */
    protected abstract String buildApiRequest(LLMRequest request) throws ProviderException;

    /**
     * Returns a request builder with URI and headers set for a generation call.
     */
    protected abstract HttpRequest.Builder newGenerationRequest();

    /**
     * Decoder for this backend's streaming dialect.
     */
    protected abstract LineDecoder newDecoder();

    /**
     * Maps a non-200 response to an exception carrying the backend's own error message.
     */
    protected abstract ProviderException handleErrorResponse(int statusCode, String responseBody);

    /**
     * Pre-network check run before a generation is dispatched. Cloud adapters reject
     * missing or malformed credentials here.
     */
    protected void checkReady() throws ProviderException {
    }

    @Override
    public FragmentStream stream(LLMRequest request) {
        try {
            checkReady();
        } catch (ProviderException e) {
            logger.warn("{} generation rejected before dispatch: {}", getProviderId(), e.getMessage());
            return FragmentStream.error(e);
        }
        return new LineDecodingStream(getProviderId(), () -> openBody(request),
                newDecoder(), config.getGenerationTimeout());
    }

    private InputStream openBody(LLMRequest request) throws ProviderException {
        String requestBody = buildApiRequest(request);

        logger.debug("Sending streaming request to {}: {} history messages",
                getProviderId(), request.getHistory().size());

        HttpRequest httpRequest = newGenerationRequest()
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .timeout(config.getGenerationTimeout())
                .build();

        try {
            HttpResponse<InputStream> response = httpClient.send(
                    httpRequest, HttpResponse.BodyHandlers.ofInputStream());

            if (response.statusCode() != 200) {
                String errorBody;
                try (InputStream in = response.body()) {
                    errorBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
                throw handleErrorResponse(response.statusCode(), errorBody);
            }
            return response.body();

        } catch (HttpTimeoutException e) {
            throw ProviderException.connectivity(getProviderId(),
                    "Request to " + getDisplayName() + " timed out", e);
        } catch (IOException e) {
            throw ProviderException.connectivity(getProviderId(),
                    "Failed to communicate with " + getDisplayName() + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.connectivity(getProviderId(),
                    "Request to " + getDisplayName() + " was interrupted", e);
        }
    }

    /**
     * Sends a short GET used by probes and model listings.
     */
    protected HttpResponse<String> sendGet(String url, Duration timeout, String... headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .GET()
                .timeout(timeout);
        for (int i = 0; i + 1 < headers.length; i += 2) {
            builder.header(headers[i], headers[i + 1]);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Model for this request: request override, then configured model, then the fallback.
     */
    protected String resolveModel(LLMRequest request, String fallback) {
        if (request.getModel() != null && !request.getModel().isBlank()) {
            return request.getModel();
        }
        if (config.getDefaultModel() != null && !config.getDefaultModel().isBlank()) {
            return config.getDefaultModel();
        }
        return fallback;
    }

    protected Double resolveTemperature(LLMRequest request) {
        return request.getTemperature() != null ? request.getTemperature() : config.getTemperature();
    }

    protected Integer resolveMaxTokens(LLMRequest request) {
        return request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens();
    }

    /**
     * Human-readable cause for an I/O failure; some JDK exceptions carry no message.
     */
    protected static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
