package org.janelia.tiling.transport;

/**
 * Thrown when reassembly is attempted without a successful result for every dispatched region.
 */
public class IncompleteResultException
        extends IllegalStateException {

    public IncompleteResultException(final String message) {
        super(message);
    }

}
