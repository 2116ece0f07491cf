package org.accesstwin.consult.gateway.providers.local;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies a local model and how it is loaded. Two specs with the same
 * fingerprint can share one resident model.
 */
public final class ModelSpec {

    private final String modelId;
    private final Path modelsDir;
    private final int gpuLayers;

    public ModelSpec(String modelId, Path modelsDir, int gpuLayers) {
        this.modelId = Objects.requireNonNull(modelId, "modelId cannot be null");
        this.modelsDir = Objects.requireNonNull(modelsDir, "modelsDir cannot be null");
        this.gpuLayers = gpuLayers;
    }

    public String getModelId() {
        return modelId;
    }

    public Path getModelsDir() {
        return modelsDir;
    }

    public int getGpuLayers() {
        return gpuLayers;
    }

    /**
     * Stable key over everything that affects the loaded weights.
     */
    public String fingerprint() {
        return modelsDir.toAbsolutePath().normalize() + "|" + modelId + "|gpu=" + gpuLayers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelSpec that = (ModelSpec) o;
        return fingerprint().equals(that.fingerprint());
    }

    @Override
    public int hashCode() {
        return fingerprint().hashCode();
    }

    @Override
    public String toString() {
        return "ModelSpec{" +
                "modelId='" + modelId + '\'' +
                ", modelsDir=" + modelsDir +
                ", gpuLayers=" + gpuLayers +
                '}';
    }
}
