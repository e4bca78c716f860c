package org.janelia.tiling.transport;

import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.image.ShapeMismatchException;

/**
 * Builds one output buffer from the results of all regions of a run.
 * Results are placed by region identity, so they may be passed in any order.
 */
public class Reassembler {

    /**
     * Concatenates the filtered pixels of every region into a newly allocated buffer.
     *
     * @param  regions   all regions that were dispatched, in row order.
     * @param  results   successful results carrying pixels, one per region.
     * @param  width     width of the output.
     * @param  channels  channel depth of the output.
     *
     * @return combined buffer.
     *
     * @throws IncompleteResultException
     *   if any region lacks a successful result.
     *
     * @throws ShapeMismatchException
     *   if any tile does not have the output's width and channel depth or its region's height,
     *   or if the regions are not contiguous.
     */
    public PixelBuffer combine(final List<Region> regions,
                               final List<WorkResult> results,
                               final int width,
                               final int channels)
            throws IncompleteResultException, ShapeMismatchException {

        final WorkResult[] resultsByRegion = indexByRegion(regions, results);

        int height = 0;
        for (int i = 0; i < regions.size(); i++) {
            final Region region = regions.get(i);
            if (region.getRowStart() != height) {
                throw new ShapeMismatchException(region + " should start at row " + height);
            }
            final PixelBuffer tile = resultsByRegion[i].getPixels();
            if (tile == null) {
                throw new IncompleteResultException("result for " + region + " carries no pixels");
            }
            if ((tile.getWidth() != width) || (tile.getChannels() != channels)) {
                throw new ShapeMismatchException("tile " + tile + " for " + region + " does not have width " +
                                                 width + " and " + channels + " channel(s)");
            }
            if (tile.getHeight() != region.getHeight()) {
                throw new ShapeMismatchException("tile " + tile + " does not have the " + region.getHeight() +
                                                 " rows of " + region);
            }
            height += tile.getHeight();
        }

        final byte[] combined = new byte[new PixelBuffer(width, height, channels).getByteCount()];
        final int stride = width * channels;
        for (int i = 0; i < regions.size(); i++) {
            final PixelBuffer tile = resultsByRegion[i].getPixels();
            tile.copyRowsTo(0, tile.getHeight(), combined, regions.get(i).getRowStart() * stride);
        }

        return PixelBuffer.wrap(width, height, channels, combined);
    }

    /**
     * Adopts a fully written arena as the output buffer without copying it.
     *
     * @throws IncompleteResultException
     *   if any region lacks a completion token or the arena has unwritten slices.
     */
    public PixelBuffer fromArena(final SharedArena arena,
                                 final List<Region> regions,
                                 final List<WorkResult> results)
            throws IncompleteResultException {

        final WorkResult[] resultsByRegion = indexByRegion(regions, results);
        for (final WorkResult result : resultsByRegion) {
            if (! result.isWrittenInPlace()) {
                throw new IncompleteResultException(result.getRegion() + " was not written in place");
            }
        }

        return arena.toPixelBuffer();
    }

    private WorkResult[] indexByRegion(final List<Region> regions,
                                       final List<WorkResult> results)
            throws IncompleteResultException {

        if ((regions == null) || regions.isEmpty()) {
            throw new IllegalArgumentException("at least one region must be specified");
        }
        if (results.size() < regions.size()) {
            throw new IncompleteResultException("only " + results.size() + " out of " + regions.size() +
                                                " regions have results");
        }

        final WorkResult[] resultsByRegion = new WorkResult[regions.size()];
        for (final WorkResult result : results) {
            final Region region = result.getRegion();
            final int index = region.getIndex();
            if ((index < 0) || (index >= regions.size()) || (! regions.get(index).equals(region))) {
                throw new IllegalArgumentException("result for " + region + " does not belong to the dispatched regions");
            }
            if (resultsByRegion[index] != null) {
                throw new IllegalArgumentException("duplicate result for " + region);
            }
            if (! result.isSuccessful()) {
                throw new IncompleteResultException(region + " failed with " + result.getFailureKind());
            }
            resultsByRegion[index] = result;
        }

        for (int i = 0; i < resultsByRegion.length; i++) {
            if (resultsByRegion[i] == null) {
                throw new IncompleteResultException("missing result for " + regions.get(i));
            }
        }

        return resultsByRegion;
    }
}
