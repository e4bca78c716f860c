package org.janelia.tiling.transport;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;

/**
 * Worker side of a transport session for one region.
 *
 * A worker calls {@link #deliver} or {@link #fail} at most once and always calls {@link #close} when done,
 * so that the coordinator is never left waiting for a worker that has terminated.
 */
public interface RegionOutlet {

    Region getRegion();

    /**
     * Hands the filtered pixels for this outlet's region to the coordinator.
     *
     * @throws RuntimeException
     *   if the pixels cannot be delivered (nothing is sent to the coordinator in that case).
     */
    void deliver(final PixelBuffer filtered);

    /**
     * Tells the coordinator that this outlet's region failed.
     */
    void fail(final FailureKind failureKind,
              final Throwable cause);

    /**
     * Closes the worker side.  Safe to call after deliver or fail.
     */
    void close();
}
