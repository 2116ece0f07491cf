package org.accesstwin.consult.gateway.providers.local;

import org.accesstwin.consult.gateway.providers.ProviderException;
import org.accesstwin.consult.gateway.stream.AbandonGuard;
import org.accesstwin.consult.gateway.stream.FragmentStream;
import org.accesstwin.consult.gateway.stream.GenerationWatchdog;
import org.accesstwin.consult.gateway.stream.StreamFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.ScheduledFuture;

/**
 * Pull-based stream over one generation session on the resident model.
 *
 * <p>The model permit is taken on the first {@link #hasNext()} and given back when the
 * session is exhausted, fails, is closed, or the stream is dropped unread. A session
 * still running at the deadline is cancelled from the watchdog thread; the permit is
 * only ever given back once the engine has stopped producing for this stream.
 */
final class LocalSessionStream implements FragmentStream {

    private static final Logger logger = LoggerFactory.getLogger(LocalSessionStream.class);

    private final ResidentModel resident;
    private final ModelSpec spec;
    private final String prompt;
    private final Double temperature;
    private final Integer maxTokens;
    private final Duration generationTimeout;
    private final SessionRelease release;
    private final Cleaner.Cleanable cleanable;

    private TokenSession session;
    private long deadlineNanos;
    private StreamFragment pending;
    private boolean opened;
    private boolean finished;
    private boolean endAfterPending;
    private int emitted;

    LocalSessionStream(ResidentModel resident, ModelSpec spec, String prompt, Double temperature,
                       Integer maxTokens, Duration generationTimeout) {
        this.resident = resident;
        this.spec = spec;
        this.prompt = prompt;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.generationTimeout = generationTimeout;
        this.release = new SessionRelease();
        this.cleanable = AbandonGuard.register(this, release);
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        if (!opened) {
            open();
            if (pending != null) {
                return true;
            }
        }
        advance();
        return pending != null;
    }

    @Override
    public StreamFragment next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        StreamFragment fragment = pending;
        pending = null;
        if (endAfterPending) {
            finish();
        }
        return fragment;
    }

    @Override
    public void close() {
        pending = null;
        finish();
    }

    private void open() {
        opened = true;
        try {
            ResidentModel.Lease lease = resident.acquire(spec, generationTimeout);
            release.lease = lease;
            deadlineNanos = System.nanoTime() + generationTimeout.toNanos();
            session = lease.getEngine().generate(prompt, temperature, maxTokens);
            release.session = session;
            release.watchdog = GenerationWatchdog.arm(generationTimeout, release::expire);
            logger.debug("Started local generation on {} ({} prompt chars)", spec.getModelId(), prompt.length());
        } catch (ProviderException e) {
            logger.warn("Local generation could not start: {}", e.getMessage());
            failWith(StreamFragment.error(e));
        } catch (RuntimeException e) {
            logger.warn("Local generation could not start: {}", e.toString());
            failWith(StreamFragment.error(ProviderException.Kind.SERVER,
                    "Generation failed: " + e.getMessage()));
        }
    }

    private void advance() {
        try {
            while (session.hasNext()) {
                if (release.expired || System.nanoTime() - deadlineNanos >= 0) {
                    failWith(timeoutError());
                    return;
                }
                String piece = session.next();
                if (piece != null && !piece.isEmpty()) {
                    emitted++;
                    pending = StreamFragment.text(piece);
                    return;
                }
            }
            if (release.expired) {
                failWith(timeoutError());
            } else {
                finish();
            }
        } catch (RuntimeException e) {
            logger.warn("Local generation failed after {} fragments: {}", emitted, e.toString());
            failWith(StreamFragment.error(ProviderException.Kind.SERVER,
                    "Generation failed: " + e.getMessage()));
        }
    }

    private StreamFragment timeoutError() {
        return StreamFragment.error(ProviderException.Kind.CONNECTIVITY,
                "Generation timed out after " + generationTimeout.toSeconds() + "s");
    }

    private void failWith(StreamFragment error) {
        pending = error;
        endAfterPending = true;
        release.run();
    }

    private void finish() {
        finished = true;
        endAfterPending = false;
        cleanable.clean();
    }

    /**
     * Cancels the session and returns the model permit. Holds no reference to the stream.
     */
    private static final class SessionRelease implements Runnable {

        private volatile TokenSession session;
        private volatile ResidentModel.Lease lease;
        private volatile ScheduledFuture<?> watchdog;
        private volatile boolean expired;

        // Runs on the watchdog thread. Stops token production but keeps the permit,
        // which the reading thread returns when it observes the expiry.
        void expire() {
            expired = true;
            TokenSession current = session;
            if (current != null) {
                cancel(current);
            }
        }

        @Override
        public void run() {
            ScheduledFuture<?> timer = watchdog;
            watchdog = null;
            if (timer != null) {
                timer.cancel(false);
            }
            TokenSession currentSession = session;
            session = null;
            if (currentSession != null) {
                cancel(currentSession);
            }
            ResidentModel.Lease currentLease = lease;
            lease = null;
            if (currentLease != null) {
                currentLease.release();
            }
        }

        private static void cancel(TokenSession tokenSession) {
            try {
                tokenSession.cancel();
            } catch (RuntimeException e) {
                logger.debug("Failed to cancel local session: {}", e.getMessage());
            }
        }
    }
}
