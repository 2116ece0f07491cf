package org.accesstwin.consult.gateway.stream;

import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.providers.StreamingCallback;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * A lazy, finite, non-restartable sequence of generated fragments, pulled by a
 * single consumer on its own thread.
 *
 * <p>A stream releases its resources when it is exhausted, when {@link #close()} is
 * called, or, failing both, once it becomes unreachable.
 */
public interface FragmentStream extends Iterator<StreamFragment>, AutoCloseable {

    /**
     * Stops the stream and releases sockets or model sessions. Idempotent.
     */
    @Override
    void close();

    /**
     * Pulls every remaining fragment into the callback, then closes the stream.
     */
    default void drainTo(StreamingCallback callback) {
        try {
            while (hasNext()) {
                StreamFragment fragment = next();
                if (fragment.isError()) {
                    callback.onError(fragment.getMessage(), fragment.getErrorKind());
                } else {
                    callback.onText(fragment.getText());
                }
            }
        } finally {
            close();
        }
        callback.onComplete();
    }

    /**
     * Pulls every remaining fragment into a list, then closes the stream.
     */
    default List<StreamFragment> readAll() {
        List<StreamFragment> fragments = new ArrayList<>();
        try {
            while (hasNext()) {
                fragments.add(next());
            }
        } finally {
            close();
        }
        return fragments;
    }

    static FragmentStream of(StreamFragment... fragments) {
        return new FixedFragmentStream(Arrays.asList(fragments));
    }

    static FragmentStream error(ProviderException.Kind kind, String message) {
        return of(StreamFragment.error(kind, message));
    }

    static FragmentStream error(ProviderException e) {
        return of(StreamFragment.error(e));
    }
}
