package org.accesstwin.consult.gateway.providers.local;

import org.accesstwin.consult.gateway.providers.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Holds at most one loaded model and serializes access to it.
 *
 * <p>A single permit guards loading, probing and each generation session. The model
 * is reloaded only when a caller asks for a spec with a different fingerprint. The
 * permit is a semaphore rather than a lock so that a session abandoned on one thread
 * can be released from another.
 */
public class ResidentModel {

    private static final Logger logger = LoggerFactory.getLogger(ResidentModel.class);

    static final String BUSY_MESSAGE = "Model busy: another generation is still running";

    private final ModelLoader loader;
    private final Semaphore permit = new Semaphore(1, true);

    // Written under the permit; loadedSpec is also read without it
    private InferenceEngine engine;
    private volatile ModelSpec loadedSpec;

    private volatile boolean unloadPending;

    public ResidentModel(ModelLoader loader) {
        this.loader = loader;
    }

    /**
     * Waits up to {@code wait} for the permit, then makes sure {@code spec} is the
     * loaded model. The returned lease must be released exactly once; extra calls
     * are ignored.
     */
    public Lease acquire(ModelSpec spec, Duration wait) throws ProviderException {
        boolean acquired;
        try {
            acquired = permit.tryAcquire(wait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.connectivity("local", "Interrupted while waiting for the local model", e);
        }
        if (!acquired) {
            throw new ProviderException("local", ProviderException.Kind.SERVER, BUSY_MESSAGE, -1, true);
        }

        unloadPending = false;
        boolean loaded = false;
        try {
            ensureLoaded(spec);
            loaded = true;
        } catch (RuntimeException e) {
            throw new ProviderException("local", ProviderException.Kind.SERVER,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), -1, false, e);
        } finally {
            // Errors included, or the permit would be lost for the life of the process
            if (!loaded) {
                permit.release();
            }
        }
        return new Lease(engine);
    }

    /**
     * Frees the loaded model. If a session currently holds the model, it is freed when
     * that session ends.
     */
    public void unload() {
        unloadPending = true;
        if (permit.tryAcquire()) {
            try {
                unloadNow();
            } finally {
                permit.release();
            }
        } else {
            logger.info("Local model is in use; unloading after the current session");
        }
    }

    public boolean isLoaded() {
        return loadedSpec != null;
    }

    /**
     * Spec of the loaded model, or null.
     */
    public ModelSpec getLoadedSpec() {
        return loadedSpec;
    }

    private void ensureLoaded(ModelSpec spec) throws ProviderException {
        if (engine != null && loadedSpec.fingerprint().equals(spec.fingerprint())) {
            return;
        }
        if (engine != null) {
            logger.info("Model changed from {} to {}; unloading", loadedSpec.getModelId(), spec.getModelId());
            closeEngine();
        }

        logger.info("Loading local model {}", spec.getModelId());
        long start = System.currentTimeMillis();
        engine = loader.load(spec);
        loadedSpec = spec;
        logger.info("Loaded local model {} in {}ms", spec.getModelId(), System.currentTimeMillis() - start);
    }

    private void unloadNow() {
        if (!unloadPending) {
            return;
        }
        unloadPending = false;
        if (engine != null) {
            logger.info("Unloading local model {}", loadedSpec.getModelId());
            closeEngine();
        }
    }

    private void closeEngine() {
        try {
            engine.close();
        } catch (RuntimeException e) {
            logger.warn("Error while closing local model {}: {}", loadedSpec.getModelId(), e.getMessage());
        } finally {
            engine = null;
            loadedSpec = null;
        }
    }

    private void releasePermit() {
        if (unloadPending) {
            unloadNow();
        }
        permit.release();
        // An unload requested while we were still holding the permit
        if (unloadPending && permit.tryAcquire()) {
            try {
                unloadNow();
            } finally {
                permit.release();
            }
        }
    }

    /**
     * Exclusive use of the loaded model until {@link #release()}.
     */
    public final class Lease {

        private final InferenceEngine leasedEngine;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(InferenceEngine leasedEngine) {
            this.leasedEngine = leasedEngine;
        }

        public InferenceEngine getEngine() {
            return leasedEngine;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                releasePermit();
            }
        }
    }
}
