package org.accesstwin.consult.gateway.config;

/**
 * Where generation runs. Cloud families send data off the machine and need consent.
 */
public enum ProviderFamily {

    /**
     * Model loaded into this process.
     */
    LOCAL_PROCESS("local_process", false),

    /**
     * Inference server on the local machine (Ollama, LM Studio).
     */
    LOCAL_SERVER("local_server", false),

    CLOUD_OPENAI("openai", true),

    CLOUD_ANTHROPIC("anthropic", true);

    private final String value;
    private final boolean cloud;

    ProviderFamily(String value, boolean cloud) {
        this.value = value;
        this.cloud = cloud;
    }

    public String getValue() {
        return value;
    }

    public boolean isCloud() {
        return cloud;
    }

    /**
     * Returns whether both consent flags must be granted before generation.
     */
    public boolean requiresConsent() {
        return cloud;
    }

    /**
     * Parses a family from its value or enum name.
     */
    public static ProviderFamily fromString(String value) {
        for (ProviderFamily family : values()) {
            if (family.value.equalsIgnoreCase(value) || family.name().equalsIgnoreCase(value)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown provider family: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
