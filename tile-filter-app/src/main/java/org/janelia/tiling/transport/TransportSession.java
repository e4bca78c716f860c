package org.janelia.tiling.transport;

import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;

/**
 * Per-run transport state.
 *
 * Outlets are handed to workers, results are collected by the coordinator one region at a time,
 * and the collected results are combined into the output buffer once all regions have succeeded.
 */
public interface TransportSession {

    TransportKind getKind();

    List<Region> getRegions();

    /**
     * @return worker side for the specified region (each region's outlet can only be issued once).
     *
     * @throws IllegalStateException
     *   if the region's outlet has already been issued.
     */
    RegionOutlet outletFor(final Region region)
            throws IllegalStateException;

    /**
     * Blocks until the worker for the specified region has delivered, failed or closed.
     *
     * @return the region's result (a {@link FailureKind#WORKER_LOST} failure if the worker closed without a result).
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting.
     */
    WorkResult receive(final Region region)
            throws InterruptedException;

    /**
     * Takes the region's result without waiting (e.g. after its worker is known to have terminated).
     *
     * @return the result, or null if the region's worker has not delivered, failed or closed yet.
     */
    WorkResult poll(final Region region);

    /**
     * @param  results  successful results for every region of this session.
     *
     * @return the combined output buffer.
     *
     * @throws IncompleteResultException
     *   if any region is missing a successful result.
     */
    PixelBuffer assemble(final List<WorkResult> results)
            throws IncompleteResultException;
}
