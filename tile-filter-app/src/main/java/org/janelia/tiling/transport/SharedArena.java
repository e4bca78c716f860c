package org.janelia.tiling.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.image.ShapeMismatchException;

/**
 * Output buffer shared by all workers of a run.
 *
 * Write access is only possible through {@link ArenaSlice}s, which are issued once for a list of
 * contiguous, non-overlapping regions covering every row.  Every byte therefore has exactly one writer
 * and no locking is needed.  Readers must not look at the arena until every slice has been written and
 * the writers' completion has been observed through a synchronizing hand-off (e.g. a {@link OneShotChannel}).
 */
public class SharedArena {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] bytes;
    private final AtomicBoolean slicesIssued;
    private List<ArenaSlice> slices;

    public SharedArena(final int width,
                       final int height,
                       final int channels) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.bytes = new byte[new PixelBuffer(width, height, channels).getByteCount()];
        this.slicesIssued = new AtomicBoolean(false);
        this.slices = Collections.emptyList();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public int getByteCount() {
        return bytes.length;
    }

    /**
     * Issues one write slice per region.  Can only be called once per arena.
     *
     * @param  regions  regions in row order.
     *
     * @return slices in the same order as the regions.
     *
     * @throws IllegalStateException
     *   if slices have already been issued.
     *
     * @throws ShapeMismatchException
     *   if the regions do not match this arena's width and channel depth or are not contiguous,
     *   non-overlapping and exhaustive.
     */
    public synchronized List<ArenaSlice> issueSlices(final List<Region> regions)
            throws IllegalStateException, ShapeMismatchException {

        if (slicesIssued.get()) {
            throw new IllegalStateException("slices for " + this + " have already been issued");
        }

        int expectedRowStart = 0;
        for (final Region region : regions) {
            if ((region.getWidth() != width) || (region.getChannels() != channels)) {
                throw new ShapeMismatchException(region + " with width " + region.getWidth() + " and " +
                                                 region.getChannels() + " channel(s) does not fit " + this);
            }
            if (region.getRowStart() != expectedRowStart) {
                throw new ShapeMismatchException(region + " should start at row " + expectedRowStart +
                                                 ", regions must be contiguous and must not overlap");
            }
            expectedRowStart = region.getRowEnd();
        }
        if (expectedRowStart != height) {
            throw new ShapeMismatchException("regions cover rows [0, " + expectedRowStart + ") but " + this +
                                             " has " + height + " rows");
        }

        final List<ArenaSlice> issued = new ArrayList<>(regions.size());
        for (final Region region : regions) {
            issued.add(new ArenaSlice(this, region));
        }

        slices = Collections.unmodifiableList(issued);
        slicesIssued.set(true);

        return slices;
    }

    /**
     * @return true once slices have been issued and every slice has been written.
     */
    public synchronized boolean isComplete() {
        if (! slicesIssued.get()) {
            return false;
        }
        for (final ArenaSlice slice : slices) {
            if (! slice.isWritten()) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return buffer backed directly by this arena (no copy).
     *
     * @throws IncompleteResultException
     *   if any slice has not been written.
     */
    public PixelBuffer toPixelBuffer()
            throws IncompleteResultException {
        if (! isComplete()) {
            throw new IncompleteResultException("not all slices of " + this + " have been written");
        }
        return PixelBuffer.wrap(width, height, channels, bytes);
    }

    // only called by ArenaSlice after it has verified the extent
    void write(final PixelBuffer tile,
               final int byteOffset) {
        tile.copyRowsTo(0, tile.getHeight(), bytes, byteOffset);
    }

    @Override
    public String toString() {
        return "arena " + width + "x" + height + "x" + channels;
    }
}
