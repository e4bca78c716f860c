package org.janelia.tiling.filter;

/**
 * Thrown when a filter cannot produce a result for a region.
 */
public class FilterFailureException
        extends RuntimeException {

    public FilterFailureException(final String message) {
        super(message);
    }

    public FilterFailureException(final String message,
                                  final Throwable cause) {
        super(message, cause);
    }

}
