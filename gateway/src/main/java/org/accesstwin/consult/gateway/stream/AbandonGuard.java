package org.accesstwin.consult.gateway.stream;

import java.lang.ref.Cleaner;

/**
 * Runs a release action once its owner becomes unreachable, so a stream the
 * caller stops pulling and drops still gives back its socket or model session.
 */
public final class AbandonGuard {

    private static final Cleaner CLEANER = Cleaner.create();

    private AbandonGuard() {
    }

    /**
     * Registers the action. The action must not reference {@code owner}.
     */
    public static Cleaner.Cleanable register(Object owner, Runnable release) {
        return CLEANER.register(owner, release);
    }
}
