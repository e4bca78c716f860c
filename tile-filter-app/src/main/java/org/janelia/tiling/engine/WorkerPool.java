package org.janelia.tiling.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.janelia.tiling.filter.FilterAdapter;
import org.janelia.tiling.filter.FilterParameters;
import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.transport.FailureKind;
import org.janelia.tiling.transport.RegionOutlet;
import org.janelia.tiling.transport.TransportSession;
import org.janelia.tiling.transport.WorkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one short-lived worker thread per region.
 *
 * Workers are started in region order and their results are collected in region order through each
 * region's transport handle, so the order in which workers finish does not matter.  Every started worker
 * is joined before {@link #run} returns, also when the run is cancelled.  Once cancelled, the pool stops
 * waiting for results, but results delivered by started workers are still picked up after the join.
 */
public class WorkerPool {

    private final FilterAdapter filterAdapter;
    private final ThreadFactory threadFactory;
    private final long joinLogIntervalSeconds;

    public WorkerPool(final FilterAdapter filterAdapter) {
        this(filterAdapter, new WorkerThreadFactory(), DEFAULT_JOIN_LOG_INTERVAL_SECONDS);
    }

    public WorkerPool(final FilterAdapter filterAdapter,
                      final ThreadFactory threadFactory,
                      final long joinLogIntervalSeconds) {
        this.filterAdapter = filterAdapter;
        this.threadFactory = threadFactory;
        this.joinLogIntervalSeconds = joinLogIntervalSeconds;
    }

    public FilterAdapter getFilterAdapter() {
        return filterAdapter;
    }

    /**
     * @param  source        buffer to filter (read concurrently by all workers, never modified).
     * @param  regions       regions of source in tiling order.
     * @param  parameters    read-only filter parameters shared by all workers.
     * @param  session       transport session opened for source and regions.
     * @param  cancellation  checked before each worker is started and before each result is awaited.
     *
     * @return collected results.
     */
    public PoolResult run(final PixelBuffer source,
                          final List<Region> regions,
                          final FilterParameters parameters,
                          final TransportSession session,
                          final CancellationController cancellation) {

        LOG.debug("run: entry, dispatching {} regions of {} with {} transport",
                  regions.size(), source, session.getKind());

        // pool size equals the number of regions, so every submitted region gets its own new thread
        final ExecutorService executor = Executors.newFixedThreadPool(regions.size(), threadFactory);

        boolean interrupted = false;
        int spawnedCount = 0;
        final List<WorkResult> results = new ArrayList<>(regions.size());

        try {
            for (final Region region : regions) {
                if (cancellation.checkpoint("dispatch of " + region)) {
                    break;
                }
                final RegionOutlet outlet = session.outletFor(region);
                try {
                    executor.execute(new RegionWorker(source, filterAdapter, parameters, outlet));
                } catch (final RuntimeException e) {
                    LOG.warn("run: failed to start worker for " + region, e);
                    outlet.fail(FailureKind.WORKER_LOST, e);
                    outlet.close();
                }
                spawnedCount++;
            }

            for (int i = 0; i < spawnedCount; i++) {
                final Region region = regions.get(i);
                if (cancellation.checkpoint("collection of " + region)) {
                    break;
                }
                try {
                    final WorkResult result = session.receive(region);
                    if (! result.isSuccessful()) {
                        LOG.warn("run: {} failed with {}", region, result.getFailureKind());
                    }
                    results.add(result);
                } catch (final InterruptedException e) {
                    interrupted = true;
                    cancellation.cancel("interrupted while waiting for " + region);
                    break;
                }
            }

        } finally {
            interrupted = joinAll(executor, spawnedCount, cancellation) || interrupted;
        }

        // every started worker has terminated and closed its outlet, so remaining results are already waiting
        for (int i = results.size(); i < spawnedCount; i++) {
            final Region region = regions.get(i);
            final WorkResult result = session.poll(region);
            if (result == null) {
                LOG.warn("run: no result available for {} after join", region);
                break;
            }
            if (! result.isSuccessful()) {
                LOG.warn("run: {} failed with {}", region, result.getFailureKind());
            }
            results.add(result);
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        LOG.debug("run: exit, started {} workers, collected {} results", spawnedCount, results.size());

        return new PoolResult(regions.size(), spawnedCount, results);
    }

    /**
     * Waits for every started worker to terminate.
     * An interrupt while waiting requests cancellation but does not stop the wait.
     *
     * @return true if the calling thread was interrupted while waiting.
     */
    private boolean joinAll(final ExecutorService executor,
                            final int spawnedCount,
                            final CancellationController cancellation) {
        executor.shutdown();

        boolean interrupted = false;
        boolean terminated = false;
        while (! terminated) {
            try {
                terminated = executor.awaitTermination(joinLogIntervalSeconds, TimeUnit.SECONDS);
                if (! terminated) {
                    LOG.info("joinAll: still waiting for {} started workers to finish", spawnedCount);
                }
            } catch (final InterruptedException e) {
                interrupted = true;
                cancellation.cancel("interrupted while joining workers");
            }
        }

        return interrupted;
    }

    public static final long DEFAULT_JOIN_LOG_INTERVAL_SECONDS = 30;

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);
}
