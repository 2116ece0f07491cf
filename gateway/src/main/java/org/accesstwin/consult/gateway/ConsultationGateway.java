package org.accesstwin.consult.gateway;

import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.config.GatewayConfig;
import org.accesstwin.consult.gateway.config.ProviderFamily;
import org.accesstwin.consult.gateway.config.ServerDialect;
import org.accesstwin.consult.gateway.config.SettingsStore;
import org.accesstwin.consult.gateway.providers.LLMMessage;
import org.accesstwin.consult.gateway.providers.LLMProvider;
import org.accesstwin.consult.gateway.providers.LLMProviderFactory;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.FragmentStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Single entry point for probing and generating against the configured backend.
 *
 * <p>Holds the current configuration and at most one adapter, built lazily on the
 * first probe or generation after {@link #configure(GatewayConfig)}. Cloud families
 * are gated on both consent flags; a blocked generation never builds an adapter.
 *
 * <p>Not safe for concurrent writers. Callers serialize configuration changes and
 * must not reconfigure while a stream from this gateway is being consumed.
 */
public class ConsultationGateway implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConsultationGateway.class);

    static final String NOT_CONFIGURED_MESSAGE = "No AI backend configured.";
    static final String CONSENT_REQUIRED_MESSAGE =
            "Cloud AI requires both institutional approval and data transmission consent.";

    private final LLMProviderFactory providerFactory;

    private GatewayConfig config;
    private LLMProvider provider;
    private boolean consentInstitutional;
    private boolean consentData;

    public ConsultationGateway() {
        this(new LLMProviderFactory());
    }

    public ConsultationGateway(LLMProviderFactory providerFactory) {
        this.providerFactory = providerFactory;
    }

    /**
     * Applies a new configuration. Any existing adapter is closed; the new one is built
     * on next use. Consent flags carried by {@code newConfig} replace the current ones.
     * A resident local model survives a reconfigure to the local family and is freed
     * when switching to any other family.
     *
     * @throws ProviderException of kind CONFIGURATION if the config is invalid; the
     *                           previous configuration stays in effect
     */
    public void configure(GatewayConfig newConfig) throws ProviderException {
        if (newConfig == null) {
            throw ProviderException.configuration("Configuration cannot be null");
        }

        ValidationResult validation = newConfig.validate();
        if (!validation.isValid()) {
            throw ProviderException.configuration("Invalid AI configuration: " + validation.describeErrors());
        }
        if (!validation.getWarnings().isEmpty()) {
            logger.warn("AI configuration warnings: {}", validation.getWarnings());
        }

        discardProvider();
        if (config != null && config.getFamily() == ProviderFamily.LOCAL_PROCESS
                && newConfig.getFamily() != ProviderFamily.LOCAL_PROCESS) {
            providerFactory.releaseResidentModel();
        }
        this.config = newConfig;
        this.consentInstitutional = newConfig.isConsentInstitutional();
        this.consentData = newConfig.isConsentData();

        logger.info("Configured AI backend: {}", newConfig);
    }

    /**
     * Configures a family with the current consent flags. Null model, credential or
     * endpoint fall back to the family defaults.
     */
    public void configure(ProviderFamily family, String modelId, String credential, String endpoint)
            throws ProviderException {
        configure(family, null, modelId, credential, endpoint);
    }

    public void configure(ProviderFamily family, ServerDialect dialect, String modelId,
                          String credential, String endpoint) throws ProviderException {
        configure(GatewayConfig.builder()
                .family(family)
                .serverDialect(dialect)
                .modelId(modelId)
                .credential(credential)
                .endpoint(endpoint)
                .consentInstitutional(consentInstitutional)
                .consentData(consentData)
                .build());
    }

    /**
     * Configures from persisted settings, if there are any and they are valid.
     *
     * @return true if a configuration was applied
     */
    public boolean restore(SettingsStore settingsStore) {
        Optional<GatewayConfig> saved = settingsStore.load();
        if (saved.isEmpty()) {
            return false;
        }
        try {
            configure(saved.get());
            return true;
        } catch (ProviderException e) {
            logger.warn("Ignoring saved AI settings: {}", e.getMessage());
            return false;
        }
    }

    public void setInstitutionalConsent(boolean granted) {
        this.consentInstitutional = granted;
        syncConsent();
    }

    public void setDataConsent(boolean granted) {
        this.consentData = granted;
        syncConsent();
    }

    public boolean isCloudConsentGranted() {
        return consentInstitutional && consentData;
    }

    /**
     * Checks the configured backend. Never throws.
     */
    public ProbeResult probe() {
        if (config == null) {
            return ProbeResult.failed(NOT_CONFIGURED_MESSAGE);
        }
        ProbeResult result = ensureProvider().probe();
        logger.info("Probe of {}: {}", config.getProviderId(), result.isOk() ? "ok" : result.getMessage());
        return result;
    }

    /**
     * Validates the current configuration together with the checks of the adapter it
     * selects, such as credential shape or a missing models directory. Builds the adapter
     * if needed but sends nothing. Never throws.
     */
    public ValidationResult validate() {
        if (config == null) {
            return ValidationResult.builder().addError("family", NOT_CONFIGURED_MESSAGE).build();
        }
        ValidationResult result = ValidationResult.builder()
                .merge(config.validate())
                .merge(ensureProvider().validateConfig(config.toProviderConfig()))
                .build();
        if (!result.isValid()) {
            logger.warn("AI configuration for {} has problems: {}", config.getProviderId(), result.describeErrors());
        }
        return result;
    }

    public FragmentStream generate(String userText) {
        return stream(LLMRequest.builder().text(userText).build());
    }

    public FragmentStream generate(String userText, String systemPrompt, List<LLMMessage> history) {
        return stream(LLMRequest.builder()
                .text(userText)
                .systemPrompt(systemPrompt)
                .history(history)
                .build());
    }

    /**
     * Starts a generation on the configured backend. A missing configuration or missing
     * cloud consent yields a stream of exactly one CONFIGURATION error fragment, with no
     * adapter built and no network traffic.
     */
    public FragmentStream stream(LLMRequest request) {
        if (config == null) {
            return FragmentStream.error(ProviderException.Kind.CONFIGURATION, NOT_CONFIGURED_MESSAGE);
        }
        if (config.getFamily().requiresConsent() && !isCloudConsentGranted()) {
            logger.warn("Blocked {} generation: cloud consent not granted", config.getProviderId());
            return FragmentStream.error(ProviderException.Kind.CONFIGURATION, CONSENT_REQUIRED_MESSAGE);
        }

        logger.debug("Starting generation on {} ({} history messages)",
                config.getProviderId(), request.getHistory().size());
        return ensureProvider().stream(request);
    }

    public Optional<GatewayConfig> getConfig() {
        return Optional.ofNullable(config);
    }

    public GatewayState getState() {
        return config == null ? GatewayState.UNCONFIGURED : GatewayState.CONFIGURED;
    }

    /**
     * Id of the adapter the current configuration selects, or null when unconfigured.
     */
    public String getActiveProviderId() {
        return config != null ? config.getProviderId() : null;
    }

    /**
     * Discards the adapter and frees any resident local model. The configuration is kept
     * and a new adapter is built on next use.
     */
    @Override
    public void close() {
        discardProvider();
        providerFactory.releaseResidentModel();
    }

    private LLMProvider ensureProvider() {
        if (provider == null) {
            provider = providerFactory.create(config.getFamily(), config.getServerDialect(),
                    config.toProviderConfig());
        }
        return provider;
    }

    private void discardProvider() {
        if (provider == null) {
            return;
        }
        try {
            provider.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing provider {}: {}", provider.getProviderId(), e.getMessage());
        }
        provider = null;
    }

    private void syncConsent() {
        if (config != null) {
            config = config.withConsent(consentInstitutional, consentData);
        }
    }
}
