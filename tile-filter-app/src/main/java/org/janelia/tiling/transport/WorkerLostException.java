package org.janelia.tiling.transport;

/**
 * Thrown when the sending end of a channel is closed without a value.
 */
public class WorkerLostException
        extends RuntimeException {

    public WorkerLostException(final String message) {
        super(message);
    }

}
