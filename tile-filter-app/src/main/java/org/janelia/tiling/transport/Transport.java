package org.janelia.tiling.transport;

import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;

/**
 * Mechanism for moving filtered regions from workers back to the coordinator.
 */
public interface Transport {

    TransportKind getKind();

    /**
     * Creates all per-region resources (channels, arenas) for one run.
     * Must be called before any worker for the run is started.
     *
     * @param  source   buffer being filtered.
     * @param  regions  regions of source in tiling order.
     *
     * @return session for the run.
     */
    TransportSession open(final PixelBuffer source,
                          final List<Region> regions);

}
