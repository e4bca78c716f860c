package org.janelia.tiling.engine;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation flag for tiled runs.
 *
 * One instance is passed to every component that must stop issuing work once cancellation is requested.
 * Components look at the flag at checkpoints (before dispatching a worker, before waiting for a result,
 * before processing a region sequentially); running filters are never interrupted.
 */
public class CancellationController {

    private final AtomicBoolean cancelled;
    private final AtomicBoolean observed;
    private volatile String reason;
    private volatile long cancelTime;

    public CancellationController() {
        this.cancelled = new AtomicBoolean(false);
        this.observed = new AtomicBoolean(false);
        this.reason = null;
        this.cancelTime = -1;
    }

    /**
     * Requests cancellation.  Only the first request has any effect.
     *
     * @param  reason  description of why cancellation was requested.
     *
     * @return true if this call set the flag, false if cancellation had already been requested.
     */
    public boolean cancel(final String reason) {
        final boolean firstRequest = cancelled.compareAndSet(false, true);
        if (firstRequest) {
            this.reason = reason;
            this.cancelTime = System.currentTimeMillis();
            LOG.info("cancel: cancellation requested, reason={}", reason);
        }
        return firstRequest;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return reason passed to the first {@link #cancel} call, or null if cancellation has not been requested.
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return time (in milliseconds since epoch) of the first {@link #cancel} call, or -1.
     */
    public long getCancelTime() {
        return cancelTime;
    }

    /**
     * Checks the flag at a named point of processing.  The first observation is logged, later ones are silent.
     *
     * @param  checkpointName  where the flag is being checked (for logging).
     *
     * @return true if cancellation has been requested.
     */
    public boolean checkpoint(final String checkpointName) {
        final boolean isCancelled = cancelled.get();
        if (isCancelled && observed.compareAndSet(false, true)) {
            LOG.info("checkpoint: cancellation observed at {}", checkpointName);
        }
        return isCancelled;
    }

    /**
     * Binds this controller to JVM shutdown (e.g. an interrupt signal from the terminal).
     * The returned hook must be closed when the guarded work has finished.
     *
     * @param  maxWaitMilliseconds  how long shutdown waits for guarded work to finish after requesting cancellation.
     *
     * @return installed hook.
     */
    public InterruptHook installInterruptHook(final long maxWaitMilliseconds) {
        final InterruptHook hook = new InterruptHook(this, maxWaitMilliseconds);
        hook.install();
        return hook;
    }

    @Override
    public String toString() {
        return isCancelled() ? "cancelled (" + reason + ")" : "active";
    }

    private static final Logger LOG = LoggerFactory.getLogger(CancellationController.class);
}
