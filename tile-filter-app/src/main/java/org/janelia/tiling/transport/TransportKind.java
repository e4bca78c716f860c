package org.janelia.tiling.transport;

/**
 * Ways filtered regions can be handed back to the coordinator.
 */
public enum TransportKind {

    /** Each worker sends an owned copy of its filtered pixels through a one-shot channel. */
    CHANNEL,

    /** Workers write into disjoint slices of one pre-allocated arena and only send completion tokens. */
    SHARED_ARENA;

    public Transport newTransport() {
        final Transport transport;
        switch (this) {
            case SHARED_ARENA:
                transport = new SharedArenaTransport();
                break;
            default:
                transport = new ChannelTransport();
        }
        return transport;
    }
}
