package org.janelia.tiling.engine;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names worker threads so that log messages identify the worker that produced them.
 */
public class WorkerThreadFactory
        implements ThreadFactory {

    private static final AtomicInteger POOL_NUMBER = new AtomicInteger(1);

    private final String namePrefix;
    private final AtomicInteger threadNumber;

    public WorkerThreadFactory() {
        this.namePrefix = "tile-worker-" + POOL_NUMBER.getAndIncrement() + "-";
        this.threadNumber = new AtomicInteger(0);
    }

    @Override
    public Thread newThread(final Runnable runnable) {
        final Thread thread = new Thread(runnable, namePrefix + threadNumber.getAndIncrement());
        thread.setDaemon(false);
        return thread;
    }
}
