package org.accesstwin.consult.gateway.providers.local;

import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.providers.LLMProvider;
import org.accesstwin.consult.gateway.providers.LLMRequest;
import org.accesstwin.consult.gateway.providers.ProbeResult;
import org.accesstwin.consult.gateway.providers.ProviderConfig;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.FragmentStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

/**
 * Runs a model inside this process. There is no wire protocol: the request is flattened
 * into one prompt and tokens are pulled straight from the engine.
 */
public class LocalModelProvider implements LLMProvider {

    private static final Logger logger = LoggerFactory.getLogger(LocalModelProvider.class);

    private final ProviderConfig config;
    private final ModelSpec spec;
    private final ResidentModel resident;

    public LocalModelProvider(ProviderConfig config, ModelSpec spec, ResidentModel resident) {
        this.config = config;
        this.spec = spec;
        this.resident = resident;

        logger.info("LocalModelProvider initialized (model: {}, models dir: {})",
                spec.getModelId(), spec.getModelsDir());
    }

    @Override
    public String getProviderId() {
        return "local";
    }

    @Override
    public String getDisplayName() {
        return "Local Model (in-process)";
    }

    /**
     * Loads the model if needed. A model already resident with the same fingerprint is reused.
     */
    @Override
    public ProbeResult probe() {
        try {
            ResidentModel.Lease lease = resident.acquire(spec, config.getProbeTimeout());
            lease.release();
            return ProbeResult.ok("Model loaded: " + spec.getModelId());
        } catch (ProviderException e) {
            logger.warn("Local model probe failed: {}", e.getMessage());
            return ProbeResult.failed("Failed to load model: " + e.getMessage());
        }
    }

    @Override
    public FragmentStream stream(LLMRequest request) {
        Double temperature = request.getTemperature() != null ? request.getTemperature() : config.getTemperature();
        Integer maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens();
        return new LocalSessionStream(resident, spec, PromptFlattener.flatten(request),
                temperature, maxTokens, config.getGenerationTimeout());
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (config.getDefaultModel() == null || config.getDefaultModel().isBlank()) {
            result.addError("defaultModel", "Model id is required");
        }
        if (!Files.isDirectory(spec.getModelsDir())) {
            result.addWarning("modelsDir", "Models directory does not exist: " + spec.getModelsDir());
        }

        return result.build();
    }

    /**
     * Leaves the resident model loaded so an adapter built for the same model reuses it.
     * The factory that owns the resident model decides when it is freed.
     */
    @Override
    public void close() {
        logger.debug("LocalModelProvider closed; model {} stays resident", spec.getModelId());
    }
}
