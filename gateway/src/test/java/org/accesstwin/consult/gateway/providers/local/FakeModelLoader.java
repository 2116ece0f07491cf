package org.accesstwin.consult.gateway.providers.local;

import org.accesstwin.consult.gateway.providers.ProviderException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * In-memory model loader whose engines replay a fixed token list.
 */
class FakeModelLoader implements ModelLoader {

    final List<ModelSpec> loads = Collections.synchronizedList(new ArrayList<>());
    final List<FakeEngine> engines = Collections.synchronizedList(new ArrayList<>());

    private volatile List<String> tokens = Arrays.asList("Hello", " there");
    private volatile ProviderException failure;
    private volatile Error linkageFailure;
    private volatile boolean stallAfterTokens;

    void setTokens(String... tokens) {
        this.tokens = Arrays.asList(tokens);
    }

    void failWith(ProviderException failure) {
        this.failure = failure;
    }

    void failWithError(Error linkageFailure) {
        this.linkageFailure = linkageFailure;
    }

    /**
     * Sessions block after their last token until cancelled.
     */
    void stallAfterTokens() {
        this.stallAfterTokens = true;
    }

    @Override
    public InferenceEngine load(ModelSpec spec) throws ProviderException {
        if (failure != null) {
            throw failure;
        }
        if (linkageFailure != null) {
            throw linkageFailure;
        }
        loads.add(spec);
        FakeEngine engine = new FakeEngine();
        engines.add(engine);
        return engine;
    }

    FakeEngine lastEngine() {
        return engines.get(engines.size() - 1);
    }

    class FakeEngine implements InferenceEngine {

        volatile boolean closed;
        volatile String lastPrompt;
        volatile Double lastTemperature;
        volatile Integer lastMaxTokens;
        final List<FakeSession> sessions = Collections.synchronizedList(new ArrayList<>());

        @Override
        public TokenSession generate(String prompt, Double temperature, Integer maxTokens) {
            lastPrompt = prompt;
            lastTemperature = temperature;
            lastMaxTokens = maxTokens;
            FakeSession session = new FakeSession(tokens, stallAfterTokens);
            sessions.add(session);
            return session;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    static class FakeSession implements TokenSession {

        private final List<String> tokens;
        private final boolean stall;
        private final CountDownLatch cancelLatch = new CountDownLatch(1);
        private int index;
        volatile boolean cancelled;

        FakeSession(List<String> tokens, boolean stall) {
            this.tokens = tokens;
            this.stall = stall;
        }

        @Override
        public boolean hasNext() {
            if (stall && !cancelled && index >= tokens.size()) {
                try {
                    cancelLatch.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return !cancelled && index < tokens.size();
        }

        @Override
        public String next() {
            return tokens.get(index++);
        }

        @Override
        public void cancel() {
            cancelled = true;
            cancelLatch.countDown();
        }
    }
}
