package org.accesstwin.consult.gateway.stream;

/**
 * Thrown by a {@link LineDecoder} for a wire line it cannot parse.
 * The line is dropped; the stream carries on with the next one.
 */
public class MalformedLineException extends Exception {

    public MalformedLineException(String message) {
        super(message);
    }

    public MalformedLineException(String message, Throwable cause) {
        super(message, cause);
    }
}
