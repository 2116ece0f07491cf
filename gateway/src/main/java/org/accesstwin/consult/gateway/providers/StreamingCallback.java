package org.accesstwin.consult.gateway.providers;

/**
 * Push-style receiver for a generation stream.
 * Driven by {@link org.accesstwin.consult.gateway.stream.FragmentStream#drainTo(StreamingCallback)}
 * on the caller's own thread.
 */
public interface StreamingCallback {

    /**
     * Called for each text fragment, in order
     */
    void onText(String text);

    /**
     * Called once if the stream ends with an error fragment; nothing follows it
     */
    void onError(String message, ProviderException.Kind kind);

    /**
     * Called when the stream is exhausted, after any error
     */
    void onComplete();
}
