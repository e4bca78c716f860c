package org.janelia.tiling.filter;

import ij.process.ImageProcessor;

/**
 * Inverts every sample (v becomes 255 - v).
 * Each output pixel depends only on the same input pixel, so results do not depend on tiling.
 */
public class InvertFilter
        implements Filter {

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public InvertFilter() {
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final FilterParameters parameters) {
        // same loop as https://imagej.nih.gov/ij/plugins/download/Image_Inverter.java
        final int maxY = ip.getHeight();
        final int maxX = ip.getWidth();
        for (int y = 0; y < maxY; y++) {
            for (int x = 0; x < maxX; x++) {
                ip.set(x, y, ~ip.get(x, y));
            }
        }
        return ip;
    }

}
