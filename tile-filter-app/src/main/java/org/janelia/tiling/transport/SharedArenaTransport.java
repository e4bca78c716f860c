package org.janelia.tiling.transport;

import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;

/**
 * Workers write filtered pixels directly into their slice of one shared output arena
 * and only send a completion token back to the coordinator.
 */
public class SharedArenaTransport
        implements Transport {

    private final Reassembler reassembler;

    public SharedArenaTransport() {
        this(new Reassembler());
    }

    public SharedArenaTransport(final Reassembler reassembler) {
        this.reassembler = reassembler;
    }

    @Override
    public TransportKind getKind() {
        return TransportKind.SHARED_ARENA;
    }

    @Override
    public TransportSession open(final PixelBuffer source,
                                 final List<Region> regions) {
        return new Session(source, regions);
    }

    private class Session
            extends AbstractTransportSession {

        private final SharedArena arena;
        private final List<ArenaSlice> slices;

        private Session(final PixelBuffer source,
                        final List<Region> regions) {
            super(source, regions);
            this.arena = new SharedArena(source.getWidth(), source.getHeight(), source.getChannels());
            this.slices = arena.issueSlices(getRegions());
        }

        @Override
        public TransportKind getKind() {
            return TransportKind.SHARED_ARENA;
        }

        @Override
        protected RegionOutlet createOutlet(final Region region,
                                            final OneShotChannel<WorkResult> channel) {
            final ArenaSlice slice = slices.get(indexOf(region));
            return new ChannelOutlet(region, channel) {
                @Override
                public void deliver(final PixelBuffer filtered) {
                    slice.write(filtered);
                    getChannel().send(WorkResult.completedInPlace(region));
                }
            };
        }

        @Override
        public PixelBuffer assemble(final List<WorkResult> results)
                throws IncompleteResultException {
            return reassembler.fromArena(arena, getRegions(), results);
        }
    }
}
