package org.accesstwin.consult.gateway.providers;

import org.accesstwin.consult.common.ConsultConstants;

import java.time.Duration;

/**
 * Adapter-level configuration for one LLM provider.
 * Derived from the gateway configuration when an adapter is built.
 */
public final class ProviderConfig {

    private final String providerId;
    private final String apiKey;
    private final String apiBaseUrl;
    private final String defaultModel;
    private final Integer maxTokens;
    private final Double temperature;
    private final Duration connectTimeout;
    private final Duration probeTimeout;
    private final Duration generationTimeout;

    private ProviderConfig(Builder builder) {
        this.providerId = builder.providerId;
        this.apiKey = builder.apiKey;
        this.apiBaseUrl = builder.apiBaseUrl;
        this.defaultModel = builder.defaultModel;
        this.maxTokens = builder.maxTokens;
        this.temperature = builder.temperature;
        this.connectTimeout = builder.connectTimeout;
        this.probeTimeout = builder.probeTimeout;
        this.generationTimeout = builder.generationTimeout;
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * API key or bearer token; never logged.
     */
    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Base URL for API calls (for local servers or custom cloud endpoints)
     */
    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    /**
     * Returns the configured base URL, or the fallback, without a trailing slash.
     */
    public String resolveBaseUrl(String fallback) {
        String base = apiBaseUrl != null && !apiBaseUrl.isBlank() ? apiBaseUrl.trim() : fallback;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new builder with values from this config.
     */
    public Builder toBuilder() {
        return new Builder()
                .providerId(this.providerId)
                .apiKey(this.apiKey)
                .apiBaseUrl(this.apiBaseUrl)
                .defaultModel(this.defaultModel)
                .maxTokens(this.maxTokens)
                .temperature(this.temperature)
                .connectTimeout(this.connectTimeout)
                .probeTimeout(this.probeTimeout)
                .generationTimeout(this.generationTimeout);
    }

    @Override
    public String toString() {
        return "ProviderConfig{" +
                "providerId='" + providerId + '\'' +
                ", apiBaseUrl='" + apiBaseUrl + '\'' +
                ", defaultModel='" + defaultModel + '\'' +
                ", apiKey=" + (hasApiKey() ? "****" : "none") +
                '}';
    }

    public static class Builder {
        private String providerId;
        private String apiKey;
        private String apiBaseUrl;
        private String defaultModel;
        private Integer maxTokens;
        private Double temperature;
        private Duration connectTimeout = Duration.ofSeconds(ConsultConstants.CONNECT_TIMEOUT_SECONDS);
        private Duration probeTimeout = Duration.ofSeconds(ConsultConstants.LOCAL_PROBE_TIMEOUT_SECONDS);
        private Duration generationTimeout = Duration.ofSeconds(ConsultConstants.GENERATION_TIMEOUT_SECONDS);

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder generationTimeout(Duration generationTimeout) {
            this.generationTimeout = generationTimeout;
            return this;
        }

        public ProviderConfig build() {
            return new ProviderConfig(this);
        }
    }
}
