package org.janelia.tiling.filter;

import ij.plugin.filter.GaussianBlur;
import ij.process.ImageProcessor;

/**
 * Smooths pixels with ImageJ's gaussian blur.
 * Pixels outside a region are treated the way ImageJ treats pixels outside an image (edge extrapolation).
 */
public class GaussianBlurFilter
        implements Filter {

    public static final String SIGMA = "sigma";
    public static final String ACCURACY = "accuracy";

    public static final double DEFAULT_SIGMA = 2.0;

    /** ImageJ's recommended accuracy for 8-bit and RGB images. */
    public static final double DEFAULT_ACCURACY = 0.002;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public GaussianBlurFilter() {
    }

    public static FilterParameters parametersFor(final double sigma) {
        return FilterParameters.EMPTY.with(SIGMA, sigma);
    }

    @Override
    public void validate(final FilterParameters parameters)
            throws IllegalArgumentException {
        final double sigma = parameters.getDoubleParameter(SIGMA, DEFAULT_SIGMA);
        if (! (sigma > 0)) {
            throw new IllegalArgumentException("'" + SIGMA + "' must be positive");
        }
        final double accuracy = parameters.getDoubleParameter(ACCURACY, DEFAULT_ACCURACY);
        if (! ((accuracy > 0) && (accuracy < 0.1))) {
            throw new IllegalArgumentException("'" + ACCURACY + "' must be greater than 0 and less than 0.1");
        }
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final FilterParameters parameters) {
        final double sigma = parameters.getDoubleParameter(SIGMA, DEFAULT_SIGMA);
        final double accuracy = parameters.getDoubleParameter(ACCURACY, DEFAULT_ACCURACY);

        // GaussianBlur keeps per-call state, so each call needs its own instance
        final GaussianBlur gaussianBlur = new GaussianBlur();
        gaussianBlur.blurGaussian(ip, sigma, sigma, accuracy);

        return ip;
    }

}
