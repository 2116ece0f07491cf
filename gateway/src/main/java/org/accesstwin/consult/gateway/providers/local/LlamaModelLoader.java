package org.accesstwin.consult.gateway.providers.local;

import de.kherud.llama.InferenceParameters;
import de.kherud.llama.LlamaIterator;
import de.kherud.llama.LlamaModel;
import de.kherud.llama.LlamaOutput;
import de.kherud.llama.ModelParameters;
import org.accesstwin.consult.gateway.providers.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads GGUF models through the llama.cpp Java binding.
 */
public class LlamaModelLoader implements ModelLoader {

    private static final Logger logger = LoggerFactory.getLogger(LlamaModelLoader.class);

    private static final String GGUF_SUFFIX = ".gguf";

    @Override
    public InferenceEngine load(ModelSpec spec) throws ProviderException {
        Path modelPath = resolveModelPath(spec);

        logger.debug("Opening model file {} with {} GPU layers", modelPath, spec.getGpuLayers());
        try {
            ModelParameters parameters = new ModelParameters()
                    .setModelFilePath(modelPath.toString())
                    .setNGpuLayers(spec.getGpuLayers());
            return new LlamaEngine(new LlamaModel(parameters));
        } catch (RuntimeException | LinkageError e) {
            // UnsatisfiedLinkError on the first attempt, NoClassDefFoundError on every later one
            throw new ProviderException("local", ProviderException.Kind.SERVER,
                    "llama.cpp could not load " + modelPath.getFileName() + ": " + e.getMessage(), -1, false, e);
        }
    }

    /**
     * Resolves a model id to a file: absolute paths are used as given, anything else
     * is looked up in the models directory, with {@code .gguf} appended if needed.
     */
    static Path resolveModelPath(ModelSpec spec) throws ProviderException {
        String modelId = spec.getModelId();
        Path candidate = Paths.get(modelId);
        if (!candidate.isAbsolute()) {
            candidate = spec.getModelsDir().resolve(modelId);
        }
        if (!Files.isRegularFile(candidate) && !modelId.endsWith(GGUF_SUFFIX)) {
            candidate = candidate.resolveSibling(candidate.getFileName() + GGUF_SUFFIX);
        }
        if (!Files.isRegularFile(candidate)) {
            throw new ProviderException("local", ProviderException.Kind.CONFIGURATION,
                    "Model file not found: " + candidate, -1, false);
        }
        return candidate;
    }

    private static final class LlamaEngine implements InferenceEngine {

        private final LlamaModel model;

        LlamaEngine(LlamaModel model) {
            this.model = model;
        }

        @Override
        public TokenSession generate(String prompt, Double temperature, Integer maxTokens) {
            InferenceParameters parameters = new InferenceParameters(prompt);
            if (temperature != null) {
                parameters.setTemperature(temperature.floatValue());
            }
            if (maxTokens != null) {
                parameters.setNPredict(maxTokens);
            }
            return new LlamaTokenSession(model.generate(parameters).iterator());
        }

        @Override
        public void close() {
            model.close();
        }
    }

    private static final class LlamaTokenSession implements TokenSession {

        private final LlamaIterator iterator;
        private volatile boolean cancelled;
        private volatile boolean exhausted;

        LlamaTokenSession(LlamaIterator iterator) {
            this.iterator = iterator;
        }

        @Override
        public boolean hasNext() {
            if (cancelled || exhausted) {
                return false;
            }
            exhausted = !iterator.hasNext();
            return !exhausted;
        }

        @Override
        public String next() {
            LlamaOutput output = iterator.next();
            return output.toString();
        }

        @Override
        public void cancel() {
            if (!cancelled && !exhausted) {
                cancelled = true;
                iterator.cancel();
            }
        }
    }
}
