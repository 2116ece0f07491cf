package org.accesstwin.consult.gateway.stream;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A stream over fragments known up front, such as a single configuration error.
 */
final class FixedFragmentStream implements FragmentStream {

    private final Iterator<StreamFragment> delegate;
    private boolean closed;

    FixedFragmentStream(List<StreamFragment> fragments) {
        this.delegate = new ArrayList<>(fragments).iterator();
    }

    @Override
    public boolean hasNext() {
        return !closed && delegate.hasNext();
    }

    @Override
    public StreamFragment next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return delegate.next();
    }

    @Override
    public void close() {
        closed = true;
    }
}
