package org.accesstwin.consult.gateway.privacy;

import java.util.Objects;

/**
 * Complete confidential context for the model, wrapped in begin/end banners.
 * Must only ever reach the model's system context.
 */
public final class FullView {

    private final String confidentialText;

    FullView(String confidentialText) {
        this.confidentialText = Objects.requireNonNull(confidentialText, "confidentialText cannot be null");
    }

    public String getConfidentialText() {
        return confidentialText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return confidentialText.equals(((FullView) o).confidentialText);
    }

    @Override
    public int hashCode() {
        return confidentialText.hashCode();
    }

    // Content is never printed
    @Override
    public String toString() {
        return "FullView{length=" + confidentialText.length() + '}';
    }
}
