package org.accesstwin.consult.gateway.stream;

import org.accesstwin.consult.gateway.providers.ProviderException;

import java.io.InputStream;

/**
 * Sends the generation request and returns the successful response body.
 * Called lazily on the first pull of a {@link LineDecodingStream}.
 */
@FunctionalInterface
public interface BodyOpener {

    /**
     * @throws ProviderException for transport failures and non-success statuses
     */
    InputStream open() throws ProviderException;
}
