package org.janelia.tiling.transport;

import java.util.concurrent.atomic.AtomicBoolean;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.image.ShapeMismatchException;

/**
 * Exclusive, write-once access to one region's bytes in a {@link SharedArena}.
 */
public class ArenaSlice {

    private final SharedArena arena;
    private final Region region;
    private final AtomicBoolean written;

    ArenaSlice(final SharedArena arena,
               final Region region) {
        this.arena = arena;
        this.region = region;
        this.written = new AtomicBoolean(false);
    }

    public Region getRegion() {
        return region;
    }

    public int getByteOffset() {
        return region.getByteOffset();
    }

    public int getByteCount() {
        return region.getByteCount();
    }

    public boolean isWritten() {
        return written.get();
    }

    /**
     * Copies the tile into this slice.  The tile must have exactly the region's height,
     * so that both the read and write extents are the region's.
     *
     * @throws ShapeMismatchException
     *   if the tile's width, height or channel depth differ from the region's.
     *
     * @throws IllegalStateException
     *   if this slice has already been written.
     */
    public void write(final PixelBuffer tile)
            throws ShapeMismatchException, IllegalStateException {

        if ((tile.getWidth() != region.getWidth()) ||
            (tile.getHeight() != region.getHeight()) ||
            (tile.getChannels() != region.getChannels())) {
            throw new ShapeMismatchException("tile " + tile + " does not fit " + region + " (" + region.getWidth() +
                                             "x" + region.getHeight() + "x" + region.getChannels() + ")");
        }

        if (! written.compareAndSet(false, true)) {
            throw new IllegalStateException("slice for " + region + " has already been written");
        }

        arena.write(tile, getByteOffset());
    }

    @Override
    public String toString() {
        return "slice for " + region;
    }
}
