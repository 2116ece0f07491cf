package org.accesstwin.consult.gateway.stream;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fires a one-shot action when a generation runs past its deadline. Streams use it to
 * close a body or cancel a session that would otherwise block the reading thread.
 */
public final class GenerationWatchdog {

    private static final ScheduledExecutorService SCHEDULER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "accesstwin-generation-watchdog");
        t.setDaemon(true);
        return t;
    });

    private GenerationWatchdog() {
    }

    /**
     * Schedules {@code onDeadline} after {@code timeout}. Cancel the returned future once
     * the generation ends. The action must not reference the stream it guards.
     */
    public static ScheduledFuture<?> arm(Duration timeout, Runnable onDeadline) {
        return SCHEDULER.schedule(onDeadline, timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
