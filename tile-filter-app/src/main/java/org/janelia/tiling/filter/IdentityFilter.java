package org.janelia.tiling.filter;

import ij.process.ImageProcessor;

/**
 * Returns pixels unchanged.  Useful for measuring tiling and transport overhead on their own.
 */
public class IdentityFilter
        implements Filter {

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public IdentityFilter() {
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final FilterParameters parameters) {
        return ip;
    }

}
