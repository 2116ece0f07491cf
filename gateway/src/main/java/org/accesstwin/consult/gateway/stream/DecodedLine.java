package org.accesstwin.consult.gateway.stream;

/**
 * What a single wire line means for the stream.
 */
public final class DecodedLine {

    public enum Kind {
        /** Nothing to emit (keep-alives, metadata events, empty deltas) */
        SKIP,
        /** A text fragment */
        CONTENT,
        /** End-of-stream marker, optionally preceded by a last text fragment */
        END,
        /** Error reported in-band by the backend */
        ERROR
    }

    private static final DecodedLine SKIP = new DecodedLine(Kind.SKIP, null);
    private static final DecodedLine END = new DecodedLine(Kind.END, null);

    private final Kind kind;
    private final String text;

    private DecodedLine(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static DecodedLine skip() {
        return SKIP;
    }

    public static DecodedLine end() {
        return END;
    }

    /**
     * Content, or a skip when the content is null or empty.
     */
    public static DecodedLine content(String text) {
        return text == null || text.isEmpty() ? SKIP : new DecodedLine(Kind.CONTENT, text);
    }

    /**
     * Final content carried on the end marker itself.
     */
    public static DecodedLine endWith(String text) {
        return text == null || text.isEmpty() ? END : new DecodedLine(Kind.END, text);
    }

    public static DecodedLine error(String message) {
        return new DecodedLine(Kind.ERROR, message);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Text for CONTENT and END lines, the error message for ERROR lines; may be null.
     */
    public String getText() {
        return text;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    @Override
    public String toString() {
        return "DecodedLine{" + kind + (text != null ? ", length=" + text.length() : "") + '}';
    }
}
