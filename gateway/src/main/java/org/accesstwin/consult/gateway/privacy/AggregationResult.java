package org.accesstwin.consult.gateway.privacy;

import java.util.Objects;

/**
 * The two views computed from one record.
 */
public final class AggregationResult {

    private final SafeView safeView;
    private final FullView fullView;

    AggregationResult(SafeView safeView, FullView fullView) {
        this.safeView = Objects.requireNonNull(safeView, "safeView cannot be null");
        this.fullView = Objects.requireNonNull(fullView, "fullView cannot be null");
    }

    public SafeView getSafeView() {
        return safeView;
    }

    public FullView getFullView() {
        return fullView;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregationResult that = (AggregationResult) o;
        return safeView.equals(that.safeView) && fullView.equals(that.fullView);
    }

    @Override
    public int hashCode() {
        return Objects.hash(safeView, fullView);
    }

    @Override
    public String toString() {
        return "AggregationResult{safeView=" + safeView + ", fullView=" + fullView + '}';
    }
}
