package org.janelia.tiling.image;

import java.util.Objects;

/**
 * Contiguous range of rows [rowStart, rowEnd) within a {@link PixelBuffer},
 * along with the width and channel depth of that buffer and the region's position in tiling order.
 */
public class Region {

    private final int index;
    private final int rowStart;
    private final int rowEnd;
    private final int width;
    private final int channels;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private Region() {
        this.index = -1;
        this.rowStart = 0;
        this.rowEnd = 0;
        this.width = 0;
        this.channels = 0;
    }

    public Region(final int index,
                  final int rowStart,
                  final int rowEnd,
                  final int width,
                  final int channels) {
        if ((index < 0) || (rowStart < 0) || (rowEnd <= rowStart) || (width < 1) || (channels < 1)) {
            throw new IllegalArgumentException("invalid region " + index + ": [" + rowStart + ", " + rowEnd +
                                               ") with width " + width + " and " + channels + " channel(s)");
        }
        this.index = index;
        this.rowStart = rowStart;
        this.rowEnd = rowEnd;
        this.width = width;
        this.channels = channels;
    }

    public int getIndex() {
        return index;
    }

    public int getRowStart() {
        return rowStart;
    }

    public int getRowEnd() {
        return rowEnd;
    }

    public int getHeight() {
        return rowEnd - rowStart;
    }

    public int getWidth() {
        return width;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * @return offset of this region's first byte within the parent buffer's store.
     */
    public int getByteOffset() {
        return rowStart * width * channels;
    }

    public int getByteCount() {
        return getHeight() * width * channels;
    }

    public boolean overlaps(final Region that) {
        return (rowStart < that.rowEnd) && (that.rowStart < rowEnd);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final Region that = (Region) o;
        return (index == that.index) && (rowStart == that.rowStart) && (rowEnd == that.rowEnd) &&
               (width == that.width) && (channels == that.channels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, rowStart, rowEnd, width, channels);
    }

    @Override
    public String toString() {
        return "region " + index + " [" + rowStart + ", " + rowEnd + ")";
    }
}
