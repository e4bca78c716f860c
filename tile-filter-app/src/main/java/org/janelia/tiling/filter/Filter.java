package org.janelia.tiling.filter;

import ij.process.ImageProcessor;

import java.io.Serializable;

/**
 * Common interface for all filter implementations.
 *
 * Implementations must be stateless so that one instance can process different regions
 * from different threads at the same time.
 */
public interface Filter extends Serializable {

    /**
     * Verify that the specified parameters can be used with this filter.
     * Called once before any region is processed.
     *
     * @param  parameters  parameters to check.
     *
     * @throws IllegalArgumentException
     *   if any parameter is missing or invalid.
     */
    default void validate(final FilterParameters parameters)
            throws IllegalArgumentException {
    }

    /**
     * Apply this filter.
     *
     * @param  ip          pixels to process (owned by the caller, may be modified in place).
     * @param  parameters  read-only parameters shared by all regions of a run.
     *
     * @return filtered image with the same dimensions as ip.
     */
    ImageProcessor process(final ImageProcessor ip,
                           final FilterParameters parameters);

}
