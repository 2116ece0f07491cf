package org.accesstwin.consult.gateway.providers.local;

/**
 * A model loaded into this process.
 */
public interface InferenceEngine extends AutoCloseable {

    /**
     * Starts generating a completion for a flattened prompt.
     *
     * @param prompt      the full role-prefixed prompt
     * @param temperature sampling temperature, or null for the engine default
     * @param maxTokens   token limit, or null for the engine default
     */
    TokenSession generate(String prompt, Double temperature, Integer maxTokens);

    /**
     * Frees the model's native resources.
     */
    @Override
    void close();
}
