package org.accesstwin.consult.gateway.providers;

import java.util.Objects;

/**
 * Outcome of a connectivity probe: whether the backend is usable, plus a human-readable reason.
 */
public final class ProbeResult {

    private final boolean ok;
    private final String message;

    private ProbeResult(boolean ok, String message) {
        this.ok = ok;
        this.message = Objects.requireNonNull(message, "message cannot be null");
    }

    public static ProbeResult ok(String message) {
        return new ProbeResult(true, message);
    }

    public static ProbeResult failed(String message) {
        return new ProbeResult(false, message);
    }

    public boolean isOk() {
        return ok;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProbeResult that = (ProbeResult) o;
        return ok == that.ok && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ok, message);
    }

    @Override
    public String toString() {
        return "ProbeResult{ok=" + ok + ", message='" + message + "'}";
    }
}
