package org.accesstwin.consult.gateway.providers;

import org.accesstwin.consult.common.model.ValidationResult;
import org.accesstwin.consult.gateway.stream.FragmentStream;

/**
 * Core interface for backend adapters.
 * Implemented by the local-process, local-server and cloud adapters.
 */
public interface LLMProvider extends AutoCloseable {

    /**
     * Provider identifier (e.g., "ollama", "lmstudio", "openai")
     */
    String getProviderId();

    /**
     * Display name for UI
     */
    String getDisplayName();

    /**
     * Checks that the backend is reachable and usable. Never throws; failures
     * come back as a failed result with a human-readable cause.
     */
    ProbeResult probe();

    /**
     * Starts a generation. The returned stream is lazy: no I/O happens until it is
     * first pulled. Failures are delivered as a trailing error fragment.
     */
    FragmentStream stream(LLMRequest request);

    /**
     * Validate provider configuration
     */
    ValidationResult validateConfig(ProviderConfig config);

    /**
     * Releases resources held by the adapter itself.
     */
    @Override
    default void close() {
    }
}
