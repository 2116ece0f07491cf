package org.accesstwin.consult.gateway.stream;

import org.accesstwin.consult.gateway.providers.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.ref.Cleaner;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.ScheduledFuture;

/**
 * Pull-based stream over a line-oriented HTTP response body.
 *
 * <p>The request is sent on the first {@link #hasNext()}. Each pull reads lines until
 * one decodes to a fragment, an end marker or an error. Malformed lines are dropped.
 * If the body ends having produced nothing but malformed lines, the stream ends with
 * a protocol error. Transport failures and the generation deadline end the stream
 * with a connectivity error after whatever was already emitted. A body that stalls
 * mid-read is closed by a watchdog when the deadline passes.
 */
public final class LineDecodingStream implements FragmentStream {

    private static final Logger logger = LoggerFactory.getLogger(LineDecodingStream.class);

    private final String providerId;
    private final BodyOpener opener;
    private final LineDecoder decoder;
    private final Duration generationTimeout;
    private final BodyRelease release;
    private final Cleaner.Cleanable cleanable;

    private BufferedReader reader;
    private long deadlineNanos;
    private StreamFragment pending;
    private boolean opened;
    private boolean finished;
    private boolean endAfterPending;
    private int emitted;
    private int malformed;

    public LineDecodingStream(String providerId, BodyOpener opener, LineDecoder decoder,
                              Duration generationTimeout) {
        this.providerId = providerId;
        this.opener = opener;
        this.decoder = decoder;
        this.generationTimeout = generationTimeout;
        this.release = new BodyRelease(providerId);
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

    /**
     * Number of lines dropped as malformed so far.
     */
    public int getMalformedCount() {
        return malformed;
    }

    private void open() {
        opened = true;
        deadlineNanos = System.nanoTime() + generationTimeout.toNanos();
        try {
            InputStream body = opener.open();
            release.body = body;
            reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
            release.watchdog = GenerationWatchdog.arm(generationTimeout, release::expire);
        } catch (ProviderException e) {
            logger.warn("{} generation failed to start: {}", providerId, e.getMessage());
            failWith(StreamFragment.error(e));
        } catch (RuntimeException e) {
            logger.warn("{} generation failed to start: {}", providerId, e.toString());
            failWith(StreamFragment.error(ProviderException.Kind.CONNECTIVITY,
                    "Failed to start streaming request: " + e.getMessage()));
        }
    }

    private void advance() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (release.expired || System.nanoTime() - deadlineNanos >= 0) {
                    failWith(timeoutError());
                    return;
                }

                DecodedLine decoded;
                try {
                    decoded = decoder.decode(line);
                } catch (MalformedLineException e) {
                    malformed++;
                    logger.debug("{} dropped malformed stream line: {}", providerId, e.getMessage());
                    continue;
                }

                switch (decoded.getKind()) {
                    case CONTENT:
                        emit(decoded.getText());
                        return;
                    case END:
                        if (decoded.hasText()) {
                            emit(decoded.getText());
                            endAfterPending = true;
                        } else {
                            finish();
                        }
                        return;
                    case ERROR:
                        failWith(StreamFragment.error(ProviderException.Kind.SERVER, decoded.getText()));
                        return;
                    case SKIP:
                    default:
                        break;
                }
            }

            // Body exhausted without an explicit end marker
            if (release.expired) {
                failWith(timeoutError());
            } else if (emitted == 0 && malformed > 0) {
                logger.warn("{} response was unparsable ({} malformed lines)", providerId, malformed);
                failWith(StreamFragment.error(ProviderException.Kind.PROTOCOL,
                        "Unparsable response from " + providerId));
            } else {
                finish();
            }
        } catch (IOException e) {
            if (release.expired) {
                logger.warn("{} stream stalled past the deadline after {} fragments", providerId, emitted);
                failWith(timeoutError());
                return;
            }
            logger.warn("{} stream read failed after {} fragments: {}", providerId, emitted, e.getMessage());
            failWith(StreamFragment.error(ProviderException.Kind.CONNECTIVITY,
                    "Error reading stream: " + e.getMessage()));
        }
    }

    private StreamFragment timeoutError() {
        return StreamFragment.error(ProviderException.Kind.CONNECTIVITY,
                "Generation timed out after " + generationTimeout.toSeconds() + "s");
    }

    private void emit(String text) {
        emitted++;
        pending = StreamFragment.text(text);
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
     * Closes the response body and disarms the watchdog. Holds no reference to the
     * stream itself.
     */
    private static final class BodyRelease implements Runnable {

        private final String providerId;
        private volatile InputStream body;
        private volatile ScheduledFuture<?> watchdog;
        private volatile boolean expired;

        BodyRelease(String providerId) {
            this.providerId = providerId;
        }

        // Runs on the watchdog thread; unblocks a reader stuck in readLine()
        void expire() {
            expired = true;
            run();
        }

        @Override
        public void run() {
            ScheduledFuture<?> timer = watchdog;
            watchdog = null;
            if (timer != null) {
                timer.cancel(false);
            }
            InputStream current = body;
            body = null;
            if (current == null) {
                return;
            }
            try {
                current.close();
            } catch (IOException e) {
                logger.debug("{} failed to close response body: {}", providerId, e.getMessage());
            }
        }
    }
}
