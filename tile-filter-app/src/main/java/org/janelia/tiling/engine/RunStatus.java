package org.janelia.tiling.engine;

/**
 * Final state of a run.
 */
public enum RunStatus {

    /** Every region succeeded and the output was reassembled. */
    COMPLETED,

    /** Cancellation stopped the run before every region had a result.  Not an error. */
    CANCELLED,

    /** Every started region finished but at least one of them failed, so nothing was reassembled. */
    FAILED
}
