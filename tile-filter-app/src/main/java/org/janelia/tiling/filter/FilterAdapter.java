package org.janelia.tiling.filter;

import ij.process.ImageProcessor;

import org.janelia.tiling.image.ImageProcessorConverter;
import org.janelia.tiling.image.PixelBuffer;

/**
 * Runs a {@link Filter} on the pixels of one region.
 *
 * The adapter converts each call's pixels into a private ImageJ processor,
 * so concurrent calls share nothing but the filter instance and the read-only parameters.
 */
public class FilterAdapter {

    private final Filter filter;

    public FilterAdapter(final Filter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must be specified");
        }
        this.filter = filter;
    }

    public Filter getFilter() {
        return filter;
    }

    /**
     * @param  regionPixels  pixels to filter (not modified).
     * @param  parameters    parameters for the filter.
     *
     * @return new buffer with the filtered pixels and the same shape as regionPixels.
     *
     * @throws FilterFailureException
     *   if the filter throws anything but a {@link VirtualMachineError}, returns nothing,
     *   or returns pixels with a different shape.
     */
    public PixelBuffer apply(final PixelBuffer regionPixels,
                             final FilterParameters parameters)
            throws FilterFailureException {

        final ImageProcessor ip = ImageProcessorConverter.toImageProcessor(regionPixels);

        final ImageProcessor filteredIp;
        try {
            filteredIp = filter.process(ip, parameters);
        } catch (final VirtualMachineError e) {
            throw e;
        } catch (final Throwable t) {
            throw new FilterFailureException(getFilterName() + " failed to process " + regionPixels + " pixels", t);
        }

        if (filteredIp == null) {
            throw new FilterFailureException(getFilterName() + " returned no pixels");
        }

        final PixelBuffer filtered = ImageProcessorConverter.toPixelBuffer(filteredIp);
        if (! filtered.hasSameShape(regionPixels)) {
            throw new FilterFailureException(getFilterName() + " changed shape from " + regionPixels +
                                             " to " + filtered);
        }

        return filtered;
    }

    private String getFilterName() {
        return filter.getClass().getSimpleName();
    }
}
