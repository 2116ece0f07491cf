package org.accesstwin.consult.gateway.providers.local;

import org.accesstwin.consult.gateway.providers.ProviderException;

/**
 * Loads a model described by a {@link ModelSpec} into memory.
 */
public interface ModelLoader {

    InferenceEngine load(ModelSpec spec) throws ProviderException;
}
