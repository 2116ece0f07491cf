package org.accesstwin.consult.gateway.providers.local;

import java.util.Iterator;

/**
 * One running generation on an {@link InferenceEngine}, yielding text pieces as
 * the model produces them.
 */
public interface TokenSession extends Iterator<String> {

    /**
     * Stops the generation. Safe to call more than once and from another thread.
     */
    void cancel();
}
