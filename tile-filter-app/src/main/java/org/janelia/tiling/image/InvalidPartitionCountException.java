package org.janelia.tiling.image;

/**
 * Thrown when an image cannot be split into the requested number of non-empty row ranges.
 */
public class InvalidPartitionCountException
        extends IllegalArgumentException {

    private final int height;
    private final int count;

    public InvalidPartitionCountException(final int height,
                                          final int count) {
        super("cannot split " + height + " rows into " + count +
              " regions, count must be between 1 and the number of rows");
        this.height = height;
        this.count = count;
    }

    public int getHeight() {
        return height;
    }

    public int getCount() {
        return count;
    }
}
