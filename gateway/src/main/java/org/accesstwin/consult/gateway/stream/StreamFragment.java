package org.accesstwin.consult.gateway.stream;

import org.accesstwin.consult.gateway.providers.ProviderException;

import java.util.Objects;

/**
 * One normalized piece of generated output. An error fragment is always the last
 * fragment of its stream.
 */
public final class StreamFragment {

    public enum Type {
        TEXT,
        ERROR
    }

    private final Type type;
    private final String text;
    private final String message;
    private final ProviderException.Kind errorKind;

    private StreamFragment(Type type, String text, String message, ProviderException.Kind errorKind) {
        this.type = type;
        this.text = text;
        this.message = message;
        this.errorKind = errorKind;
    }

    public static StreamFragment text(String text) {
        return new StreamFragment(Type.TEXT, Objects.requireNonNull(text, "text cannot be null"), null, null);
    }

    /**
     * Creates an error fragment. Its text renders as {@code [Error: message]}.
     */
    public static StreamFragment error(ProviderException.Kind kind, String message) {
        String cause = message != null ? message : "Unknown error";
        return new StreamFragment(Type.ERROR, "[Error: " + cause + "]", cause, kind);
    }

    public static StreamFragment error(ProviderException e) {
        return error(e.getKind(), e.getMessage());
    }

    public Type getType() {
        return type;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    /**
     * Renderable text; for errors, the tagged form.
     */
    public String getText() {
        return text;
    }

    /**
     * Bare error cause, or null for text fragments.
     */
    public String getMessage() {
        return message;
    }

    public ProviderException.Kind getErrorKind() {
        return errorKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamFragment that = (StreamFragment) o;
        return type == that.type && text.equals(that.text) && errorKind == that.errorKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, errorKind);
    }

    @Override
    public String toString() {
        return isError() ? "StreamFragment{ERROR " + errorKind + ": " + message + '}'
                : "StreamFragment{TEXT length=" + text.length() + '}';
    }
}
