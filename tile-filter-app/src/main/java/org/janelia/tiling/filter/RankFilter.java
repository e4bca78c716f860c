package org.janelia.tiling.filter;

import ij.plugin.filter.RankFilters;
import ij.process.ImageProcessor;

/**
 * Applies one of ImageJ's rank filters (mean and median are the smoothing ones).
 */
public class RankFilter
        implements Filter {

    public static final String RADIUS = "radius";
    public static final String FILTER_TYPE = "filterType";

    public static final double DEFAULT_RADIUS = 2.0;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public RankFilter() {
    }

    /**
     * @param  filterType  should be one of:
     *                     {@link RankFilters#MEAN}, {@link RankFilters#MIN}, {@link RankFilters#MAX},
     *                     {@link RankFilters#VARIANCE}, or {@link RankFilters#MEDIAN}
     */
    public static FilterParameters parametersFor(final double radius,
                                                 final int filterType) {
        return FilterParameters.EMPTY.with(RADIUS, radius).with(FILTER_TYPE, filterType);
    }

    @Override
    public void validate(final FilterParameters parameters)
            throws IllegalArgumentException {
        final double radius = parameters.getDoubleParameter(RADIUS, DEFAULT_RADIUS);
        if (! (radius > 0)) {
            throw new IllegalArgumentException("'" + RADIUS + "' must be positive");
        }
        final int filterType = parameters.getIntegerParameter(FILTER_TYPE, RankFilters.MEDIAN);
        if ((filterType < RankFilters.MEAN) || (filterType > RankFilters.MEDIAN)) {
            throw new IllegalArgumentException("'" + FILTER_TYPE + "' parameter must be between " +
                                               RankFilters.MEAN + " and " + RankFilters.MEDIAN + " (inclusive)");
        }
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final FilterParameters parameters) {
        final RankFilters rankFilters = new RankFilters();
        rankFilters.rank(ip,
                         parameters.getDoubleParameter(RADIUS, DEFAULT_RADIUS),
                         parameters.getIntegerParameter(FILTER_TYPE, RankFilters.MEDIAN));
        return ip;
    }
}
