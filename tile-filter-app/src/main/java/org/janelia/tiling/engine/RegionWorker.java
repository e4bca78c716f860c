package org.janelia.tiling.engine;

import org.janelia.tiling.filter.FilterAdapter;
import org.janelia.tiling.filter.FilterParameters;
import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.transport.FailureKind;
import org.janelia.tiling.transport.RegionOutlet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters one region and delivers the result through the region's outlet.
 * The outlet is always closed, whatever happens, so the coordinator never waits for a finished worker.
 * Filter failures are caught the same way as in sequential runs; a {@link VirtualMachineError}
 * ends the worker and the region is reported as lost.
 */
public class RegionWorker
        implements Runnable {

    private final PixelBuffer source;
    private final FilterAdapter filterAdapter;
    private final FilterParameters parameters;
    private final RegionOutlet outlet;

    public RegionWorker(final PixelBuffer source,
                        final FilterAdapter filterAdapter,
                        final FilterParameters parameters,
                        final RegionOutlet outlet) {
        this.source = source;
        this.filterAdapter = filterAdapter;
        this.parameters = parameters;
        this.outlet = outlet;
    }

    @Override
    public void run() {
        final Region region = outlet.getRegion();
        try {
            final PixelBuffer filtered;
            try {
                filtered = filterAdapter.apply(source.copyRegion(region), parameters);
            } catch (final RuntimeException e) {
                LOG.warn("run: failed to filter " + region, e);
                outlet.fail(FailureKind.FILTER_FAILURE, e);
                return;
            }

            try {
                outlet.deliver(filtered);
                LOG.debug("run: delivered {}", region);
            } catch (final RuntimeException e) {
                LOG.warn("run: failed to deliver " + region, e);
                outlet.fail(FailureKind.DELIVERY_FAILURE, e);
            }
        } finally {
            outlet.close();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(RegionWorker.class);
}
