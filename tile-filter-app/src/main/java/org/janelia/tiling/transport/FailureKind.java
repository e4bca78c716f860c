package org.janelia.tiling.transport;

/**
 * Reasons a region can fail to produce a result.
 */
public enum FailureKind {

    /** The filter raised an error or returned pixels with the wrong shape. */
    FILTER_FAILURE,

    /** The filtered pixels could not be handed over (e.g. rejected by an arena slice). */
    DELIVERY_FAILURE,

    /** The worker terminated without delivering anything. */
    WORKER_LOST
}
