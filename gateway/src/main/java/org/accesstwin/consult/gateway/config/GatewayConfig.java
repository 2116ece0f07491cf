package org.accesstwin.consult.gateway.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.accesstwin.consult.common.ConsultConstants;
import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * User-facing backend selection: which family, which model, where, with what
 * credential, and whether cloud use has been consented to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GatewayConfig {

    private final ProviderFamily family;
    private final ServerDialect serverDialect;
    private final String modelId;
    private final String endpoint;
    private final String credential;
    private final boolean consentInstitutional;
    private final boolean consentData;
    private final Double temperature;
    private final Integer maxTokens;

    @JsonCreator
    public GatewayConfig(
            @JsonProperty("family") ProviderFamily family,
            @JsonProperty("serverDialect") ServerDialect serverDialect,
            @JsonProperty("modelId") String modelId,
            @JsonProperty("endpoint") String endpoint,
            @JsonProperty("credential") String credential,
            @JsonProperty("consentInstitutional") boolean consentInstitutional,
            @JsonProperty("consentData") boolean consentData,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("maxTokens") Integer maxTokens) {
        this.family = family;
        this.serverDialect = serverDialect != null ? serverDialect : ServerDialect.OLLAMA_CHAT;
        this.modelId = isBlank(modelId) ? defaultModelFor(family, this.serverDialect) : modelId;
        this.endpoint = isBlank(endpoint) ? null : endpoint;
        this.credential = isBlank(credential) ? null : credential;
        this.consentInstitutional = consentInstitutional;
        this.consentData = consentData;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public ProviderFamily getFamily() {
        return family;
    }

    public ServerDialect getServerDialect() {
        return serverDialect;
    }

    public String getModelId() {
        return modelId;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getCredential() {
        return credential;
    }

    public boolean isConsentInstitutional() {
        return consentInstitutional;
    }

    public boolean isConsentData() {
        return consentData;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    /**
     * Both consents granted. Says nothing about whether the family needs them.
     */
    @JsonIgnore
    public boolean isCloudConsentGranted() {
        return consentInstitutional && consentData;
    }

    /**
     * Returns whether generation may run under this config's consent state.
     */
    @JsonIgnore
    public boolean isGenerationPermitted() {
        return family != null && (!family.requiresConsent() || isCloudConsentGranted());
    }

    /**
     * Id of the adapter this config selects.
     */
    @JsonIgnore
    public String getProviderId() {
        if (family == null) {
            return null;
        }
        switch (family) {
            case LOCAL_PROCESS:
                return "local";
            case LOCAL_SERVER:
                return serverDialect.getProviderId();
            case CLOUD_OPENAI:
                return "openai";
            case CLOUD_ANTHROPIC:
                return "anthropic";
            default:
                throw new IllegalStateException("Unhandled family: " + family);
        }
    }

    /**
     * Checks the config without touching the network or the file system.
     */
    public ValidationResult validate() {
        ValidationResult.Builder result = ValidationResult.builder();

        if (family == null) {
            result.addError("family", "Provider family is required");
            return result.build();
        }

        if (isBlank(modelId)) {
            result.addError("modelId", "Model id is required");
        }

        if (endpoint != null && !endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
            result.addError("endpoint", "Endpoint must be an http(s) URL");
        }

        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            result.addError("temperature", "Temperature must be between 0 and 2");
        }

        if (maxTokens != null && maxTokens <= 0) {
            result.addError("maxTokens", "Max tokens must be positive");
        }

        if (family.isCloud()) {
            if (credential == null) {
                result.addWarning("credential", "API key is required for cloud providers");
            } else if (family == ProviderFamily.CLOUD_ANTHROPIC
                    && !credential.startsWith(ConsultConstants.ANTHROPIC_KEY_PREFIX)) {
                result.addWarning("credential", "Invalid API key format");
            }
            if (!isCloudConsentGranted()) {
                result.addInfo("consent", "Cloud generation is blocked until both consents are granted");
            }
        }

        return result.build();
    }

    /**
     * Derives the adapter-level config, including per-family probe timeouts.
     */
    public ProviderConfig toProviderConfig() {
        int probeSeconds = family != null && family.isCloud()
                ? ConsultConstants.CLOUD_PROBE_TIMEOUT_SECONDS
                : ConsultConstants.LOCAL_PROBE_TIMEOUT_SECONDS;

        return ProviderConfig.builder()
                .providerId(getProviderId())
                .apiKey(credential)
                .apiBaseUrl(endpoint)
                .defaultModel(modelId)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .connectTimeout(Duration.ofSeconds(ConsultConstants.CONNECT_TIMEOUT_SECONDS))
                .probeTimeout(Duration.ofSeconds(probeSeconds))
                .generationTimeout(Duration.ofSeconds(ConsultConstants.GENERATION_TIMEOUT_SECONDS))
                .build();
    }

    public GatewayConfig withConsent(boolean institutional, boolean data) {
        return toBuilder().consentInstitutional(institutional).consentData(data).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .family(family)
                .serverDialect(serverDialect)
                .modelId(modelId)
                .endpoint(endpoint)
                .credential(credential)
                .consentInstitutional(consentInstitutional)
                .consentData(consentData)
                .temperature(temperature)
                .maxTokens(maxTokens);
    }

    private static String defaultModelFor(ProviderFamily family, ServerDialect dialect) {
        if (family == null) {
            return null;
        }
        switch (family) {
            case LOCAL_PROCESS:
                return ConsultConstants.LOCAL_PROCESS_DEFAULT_MODEL;
            case LOCAL_SERVER:
                return dialect.getDefaultModel();
            case CLOUD_OPENAI:
                return ConsultConstants.OPENAI_DEFAULT_MODEL;
            case CLOUD_ANTHROPIC:
                return ConsultConstants.ANTHROPIC_DEFAULT_MODEL;
            default:
                return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GatewayConfig that = (GatewayConfig) o;
        return consentInstitutional == that.consentInstitutional &&
                consentData == that.consentData &&
                family == that.family &&
                serverDialect == that.serverDialect &&
                Objects.equals(modelId, that.modelId) &&
                Objects.equals(endpoint, that.endpoint) &&
                Objects.equals(credential, that.credential) &&
                Objects.equals(temperature, that.temperature) &&
                Objects.equals(maxTokens, that.maxTokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, serverDialect, modelId, endpoint, credential,
                consentInstitutional, consentData, temperature, maxTokens);
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
                "family=" + family +
                ", serverDialect=" + serverDialect +
                ", modelId='" + modelId + '\'' +
                ", endpoint='" + endpoint + '\'' +
                ", credential=" + (credential != null ? "***" : "null") +
                ", consentInstitutional=" + consentInstitutional +
                ", consentData=" + consentData +
                '}';
    }

    public static class Builder {
        private ProviderFamily family;
        private ServerDialect serverDialect;
        private String modelId;
        private String endpoint;
        private String credential;
        private boolean consentInstitutional;
        private boolean consentData;
        private Double temperature;
        private Integer maxTokens;

        public Builder family(ProviderFamily family) {
            this.family = family;
            return this;
        }

        public Builder serverDialect(ServerDialect serverDialect) {
            this.serverDialect = serverDialect;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder credential(String credential) {
            this.credential = credential;
            return this;
        }

        public Builder consentInstitutional(boolean consentInstitutional) {
            this.consentInstitutional = consentInstitutional;
            return this;
        }

        public Builder consentData(boolean consentData) {
            this.consentData = consentData;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(family, serverDialect, modelId, endpoint, credential,
                    consentInstitutional, consentData, temperature, maxTokens);
        }
    }
}
