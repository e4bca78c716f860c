package org.janelia.tiling.transport;

import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;

/**
 * Each worker sends its own copy of the filtered pixels back through the region's channel.
 * The coordinator concatenates the copies into a new output buffer.
 */
public class ChannelTransport
        implements Transport {

    private final Reassembler reassembler;

    public ChannelTransport() {
        this(new Reassembler());
    }

    public ChannelTransport(final Reassembler reassembler) {
        this.reassembler = reassembler;
    }

    @Override
    public TransportKind getKind() {
        return TransportKind.CHANNEL;
    }

    @Override
    public TransportSession open(final PixelBuffer source,
                                 final List<Region> regions) {
        return new Session(source, regions);
    }

    private class Session
            extends AbstractTransportSession {

        private Session(final PixelBuffer source,
                        final List<Region> regions) {
            super(source, regions);
        }

        @Override
        public TransportKind getKind() {
            return TransportKind.CHANNEL;
        }

        @Override
        protected RegionOutlet createOutlet(final Region region,
                                            final OneShotChannel<WorkResult> channel) {
            return new ChannelOutlet(region, channel) {
                @Override
                public void deliver(final PixelBuffer filtered) {
                    getChannel().send(WorkResult.withPixels(region, filtered));
                }
            };
        }

        @Override
        public PixelBuffer assemble(final List<WorkResult> results)
                throws IncompleteResultException {
            final PixelBuffer source = getSource();
            return reassembler.combine(getRegions(), results, source.getWidth(), source.getChannels());
        }
    }
}
