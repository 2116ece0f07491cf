package org.accesstwin.consult.gateway.providers;

/**
 * Exception raised inside provider adapters. Adapters never let it cross
 * {@link LLMProvider#probe()} or a stream iteration; it is turned into a failed
 * probe result or a terminal error fragment there.
 */
public class ProviderException extends Exception {

    /**
     * Failure taxonomy shared by all adapters.
     */
    public enum Kind {
        /** Missing configuration or ungranted cloud consent; raised before any I/O */
        CONFIGURATION,
        /** Unreachable endpoint, DNS failure, timeout or a broken connection */
        CONNECTIVITY,
        /** Malformed or unparsable wire payload */
        PROTOCOL,
        /** Missing, malformed or rejected secret */
        CREDENTIAL,
        /** Non-success status reported by the backend */
        SERVER
    }

    private final String providerId;
    private final Kind kind;
    private final int statusCode;
    private final boolean retryable;

    public ProviderException(Kind kind, String message) {
        this(null, kind, message, -1, false, null);
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        this(null, kind, message, -1, false, cause);
    }

    public ProviderException(String providerId, Kind kind, String message, int statusCode, boolean retryable) {
        this(providerId, kind, message, statusCode, retryable, null);
    }

    public ProviderException(String providerId, Kind kind, String message, int statusCode,
                             boolean retryable, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.kind = kind;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public String getProviderId() {
        return providerId;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Factory for rate limit errors
     */
    public static ProviderException rateLimited(String providerId, String message) {
        return new ProviderException(providerId, Kind.SERVER, message, 429, true);
    }

    /**
     * Factory for authentication errors
     */
    public static ProviderException unauthorized(String providerId, String message) {
        return new ProviderException(providerId, Kind.CREDENTIAL, message, 401, false);
    }

    /**
     * Factory for server errors
     */
    public static ProviderException serverError(String providerId, String message) {
        return new ProviderException(providerId, Kind.SERVER, message, 500, true);
    }

    public static ProviderException configuration(String message) {
        return new ProviderException(Kind.CONFIGURATION, message);
    }

    public static ProviderException credential(String providerId, String message) {
        return new ProviderException(providerId, Kind.CREDENTIAL, message, -1, false);
    }

    public static ProviderException connectivity(String providerId, String message, Throwable cause) {
        return new ProviderException(providerId, Kind.CONNECTIVITY, message, -1, true, cause);
    }

    public static ProviderException protocol(String providerId, String message) {
        return new ProviderException(providerId, Kind.PROTOCOL, message, -1, false);
    }
}
