package org.janelia.tiling.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;

/**
 * Session base that creates one {@link OneShotChannel} per region before any worker starts
 * and makes sure each region's outlet is only issued once.
 */
public abstract class AbstractTransportSession
        implements TransportSession {

    private final PixelBuffer source;
    private final List<Region> regions;
    private final List<OneShotChannel<WorkResult>> channels;
    private final List<AtomicBoolean> outletIssued;

    protected AbstractTransportSession(final PixelBuffer source,
                                       final List<Region> regions) {
        if ((regions == null) || regions.isEmpty()) {
            throw new IllegalArgumentException("at least one region must be specified");
        }
        this.source = source;
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.channels = new ArrayList<>(regions.size());
        this.outletIssued = new ArrayList<>(regions.size());
        for (int i = 0; i < regions.size(); i++) {
            final Region region = regions.get(i);
            if (region.getIndex() != i) {
                throw new IllegalArgumentException(region + " is at position " + i + " of the region list");
            }
            this.channels.add(new OneShotChannel<>(region.toString()));
            this.outletIssued.add(new AtomicBoolean(false));
        }
    }

    public PixelBuffer getSource() {
        return source;
    }

    @Override
    public List<Region> getRegions() {
        return regions;
    }

    @Override
    public RegionOutlet outletFor(final Region region)
            throws IllegalStateException {
        final int index = indexOf(region);
        if (! outletIssued.get(index).compareAndSet(false, true)) {
            throw new IllegalStateException("outlet for " + region + " has already been issued");
        }
        return createOutlet(region, channels.get(index));
    }

    @Override
    public WorkResult receive(final Region region)
            throws InterruptedException {
        final OneShotChannel<WorkResult> channel = channels.get(indexOf(region));
        try {
            return channel.receive();
        } catch (final WorkerLostException e) {
            return WorkResult.failed(region, FailureKind.WORKER_LOST, e);
        }
    }

    @Override
    public WorkResult poll(final Region region) {
        final OneShotChannel<WorkResult> channel = channels.get(indexOf(region));
        try {
            return channel.poll();
        } catch (final WorkerLostException e) {
            return WorkResult.failed(region, FailureKind.WORKER_LOST, e);
        }
    }

    /**
     * @return worker side for the region, delivering through the region's channel.
     */
    protected abstract RegionOutlet createOutlet(final Region region,
                                                 final OneShotChannel<WorkResult> channel);

    protected int indexOf(final Region region)
            throws IllegalArgumentException {
        final int index = region.getIndex();
        if ((index < 0) || (index >= regions.size()) || (! regions.get(index).equals(region))) {
            throw new IllegalArgumentException(region + " is not part of this session");
        }
        return index;
    }

    /**
     * Outlet that sends failures through the region's channel and closes it.
     */
    protected abstract static class ChannelOutlet
            implements RegionOutlet {

        private final Region region;
        private final OneShotChannel<WorkResult> channel;

        protected ChannelOutlet(final Region region,
                                final OneShotChannel<WorkResult> channel) {
            this.region = region;
            this.channel = channel;
        }

        @Override
        public Region getRegion() {
            return region;
        }

        protected OneShotChannel<WorkResult> getChannel() {
            return channel;
        }

        @Override
        public void fail(final FailureKind failureKind,
                         final Throwable cause) {
            channel.send(WorkResult.failed(region, failureKind, cause));
        }

        @Override
        public void close() {
            channel.close();
        }
    }
}
