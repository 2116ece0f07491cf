package org.accesstwin.consult.gateway.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.gateway.config.ConsultPaths;
import org.accesstwin.consult.gateway.config.ProviderFamily;
import org.accesstwin.consult.gateway.config.ServerDialect;
import org.accesstwin.consult.gateway.providers.impl.ClaudeProvider;
import org.accesstwin.consult.gateway.providers.impl.LMStudioProvider;
import org.accesstwin.consult.gateway.providers.impl.OllamaProvider;
import org.accesstwin.consult.gateway.providers.impl.OpenAIProvider;
import org.accesstwin.consult.gateway.providers.local.LlamaModelLoader;
import org.accesstwin.consult.gateway.providers.local.LocalModelProvider;
import org.accesstwin.consult.gateway.providers.local.ModelLoader;
import org.accesstwin.consult.gateway.providers.local.ModelSpec;
import org.accesstwin.consult.gateway.providers.local.ResidentModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Builds one adapter per call. Adapters are not pooled; the only shared state is the
 * resident local model, which outlives individual local adapters so a reconfigure to
 * the same model does not reload it.
 */
public class LLMProviderFactory {

    private static final Logger logger = LoggerFactory.getLogger(LLMProviderFactory.class);

    private final ObjectMapper objectMapper;
    private final ResidentModel residentModel;
    private final Path modelsDir;
    private final int gpuLayers;

    public LLMProviderFactory() {
        this(new ObjectMapper(), new LlamaModelLoader(), ConsultPaths.modelsDir(), 0);
    }

    public LLMProviderFactory(ObjectMapper objectMapper, ModelLoader modelLoader, Path modelsDir, int gpuLayers) {
        this.objectMapper = objectMapper;
        this.residentModel = new ResidentModel(modelLoader);
        this.modelsDir = modelsDir;
        this.gpuLayers = gpuLayers;
        logger.info("LLMProviderFactory initialized (models dir: {})", modelsDir);
    }

    /**
     * Creates the adapter for a family. {@code dialect} only matters for local servers.
     */
    public LLMProvider create(ProviderFamily family, ServerDialect dialect, ProviderConfig config) {
        LLMProvider provider;
        switch (family) {
            case LOCAL_PROCESS:
                provider = new LocalModelProvider(config,
                        new ModelSpec(config.getDefaultModel(), modelsDir, gpuLayers), residentModel);
                break;
            case LOCAL_SERVER:
                provider = dialect == ServerDialect.OPENAI_COMPATIBLE
                        ? new LMStudioProvider(config, objectMapper)
                        : new OllamaProvider(config, objectMapper);
                break;
            case CLOUD_OPENAI:
                provider = new OpenAIProvider(config, objectMapper);
                break;
            case CLOUD_ANTHROPIC:
                provider = new ClaudeProvider(config, objectMapper);
                break;
            default:
                throw new IllegalArgumentException("Unknown provider family: " + family);
        }
        logger.info("Created LLM provider: {} ({})", provider.getProviderId(), provider.getDisplayName());
        return provider;
    }

    /**
     * Frees the resident local model, if one is loaded. A session still holding it
     * frees it when that session ends.
     */
    public void releaseResidentModel() {
        residentModel.unload();
    }

    public ResidentModel getResidentModel() {
        return residentModel;
    }
}
