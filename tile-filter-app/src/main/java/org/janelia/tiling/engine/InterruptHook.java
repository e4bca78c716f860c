package org.janelia.tiling.engine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JVM shutdown hook that converts an interrupt signal into a cancellation request
 * and then waits (for a bounded time) until the guarded work reports that it has finished.
 */
public class InterruptHook
        implements Runnable, AutoCloseable {

    private final CancellationController cancellation;
    private final long maxWaitMilliseconds;
    private final CountDownLatch workFinished;
    private final Thread hookThread;
    private boolean installed;

    InterruptHook(final CancellationController cancellation,
                  final long maxWaitMilliseconds) {
        this.cancellation = cancellation;
        this.maxWaitMilliseconds = maxWaitMilliseconds;
        this.workFinished = new CountDownLatch(1);
        this.hookThread = new Thread(this, "tile-filter-interrupt-hook");
        this.installed = false;
    }

    void install() {
        Runtime.getRuntime().addShutdownHook(hookThread);
        installed = true;
    }

    public boolean isWorkFinished() {
        return workFinished.getCount() == 0;
    }

    /**
     * Requests cancellation and waits for the guarded work to finish.
     */
    @Override
    public void run() {
        if (isWorkFinished()) {
            return;
        }
        cancellation.cancel("interrupt signal received");
        try {
            if (workFinished.await(maxWaitMilliseconds, TimeUnit.MILLISECONDS)) {
                LOG.info("run: work finished after interrupt");
            } else {
                LOG.warn("run: work did not finish within {}ms of interrupt, exiting anyway", maxWaitMilliseconds);
            }
        } catch (final InterruptedException e) {
            LOG.warn("run: interrupted while waiting for work to finish", e);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Marks the guarded work as finished and removes the hook if the JVM is not already shutting down.
     */
    @Override
    public void close() {
        workFinished.countDown();
        if (installed) {
            installed = false;
            try {
                Runtime.getRuntime().removeShutdownHook(hookThread);
            } catch (final IllegalStateException e) {
                LOG.debug("close: shutdown already in progress, hook remains registered", e);
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(InterruptHook.class);
}
