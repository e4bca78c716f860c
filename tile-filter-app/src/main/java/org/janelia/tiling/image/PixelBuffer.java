package org.janelia.tiling.image;

import java.util.Arrays;

/**
 * Fixed size raster of 8-bit samples stored row-major with interleaved channels
 * (e.g. one channel for grayscale, three for RGB).
 *
 * The backing store always holds exactly width * height * channels bytes.
 * Instances never expose their store, so a buffer handed to other threads
 * can be read concurrently without synchronization.
 */
public class PixelBuffer {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] pixels;

    /**
     * Constructs a zero filled buffer.
     */
    public PixelBuffer(final int width,
                       final int height,
                       final int channels) {
        this(width, height, channels, new byte[validateShape(width, height, channels)]);
    }

    private PixelBuffer(final int width,
                        final int height,
                        final int channels,
                        final byte[] pixels)
            throws ShapeMismatchException {

        final int expectedLength = validateShape(width, height, channels);
        if (pixels.length != expectedLength) {
            throw new ShapeMismatchException("store length " + pixels.length + " does not match " + width + "x" +
                                             height + "x" + channels + " (" + expectedLength + " bytes)");
        }

        this.width = width;
        this.height = height;
        this.channels = channels;
        this.pixels = pixels;
    }

    /**
     * @return a buffer backed by a copy of the specified samples.
     *
     * @throws ShapeMismatchException
     *   if the number of samples does not match the shape.
     */
    public static PixelBuffer copyOf(final int width,
                                     final int height,
                                     final int channels,
                                     final byte[] pixels)
            throws ShapeMismatchException {
        return new PixelBuffer(width, height, channels, pixels.clone());
    }

    /**
     * Wraps the specified samples without copying them.
     * Ownership of the array passes to the returned buffer: callers must not modify it afterwards.
     *
     * @throws ShapeMismatchException
     *   if the number of samples does not match the shape.
     */
    public static PixelBuffer wrap(final int width,
                                   final int height,
                                   final int channels,
                                   final byte[] pixels)
            throws ShapeMismatchException {
        return new PixelBuffer(width, height, channels, pixels);
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

    /**
     * @return number of bytes in one row.
     */
    public int getRowStride() {
        return width * channels;
    }

    public int getByteCount() {
        return pixels.length;
    }

    /**
     * @return unsigned sample value for the specified pixel and channel.
     */
    public int get(final int x,
                   final int y,
                   final int channel) {
        if ((x < 0) || (x >= width) || (y < 0) || (y >= height) || (channel < 0) || (channel >= channels)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ", " + channel + ") is outside " + this);
        }
        return pixels[(y * width + x) * channels + channel] & 0xff;
    }

    /**
     * @return an independent buffer holding the rows in [rowStart, rowEnd).
     */
    public PixelBuffer copyRows(final int rowStart,
                                final int rowEnd) {
        validateRowRange(rowStart, rowEnd);
        final int stride = getRowStride();
        final byte[] rows = Arrays.copyOfRange(pixels, rowStart * stride, rowEnd * stride);
        return new PixelBuffer(width, rowEnd - rowStart, channels, rows);
    }

    /**
     * @return an independent buffer holding the rows of the specified region.
     *
     * @throws ShapeMismatchException
     *   if the region was not derived from a buffer with this width and channel depth.
     */
    public PixelBuffer copyRegion(final Region region)
            throws ShapeMismatchException {
        if ((region.getWidth() != width) || (region.getChannels() != channels)) {
            throw new ShapeMismatchException("region " + region + " does not fit " + this);
        }
        return copyRows(region.getRowStart(), region.getRowEnd());
    }

    /**
     * Copies the rows in [rowStart, rowEnd) into the target array starting at targetOffset.
     */
    public void copyRowsTo(final int rowStart,
                           final int rowEnd,
                           final byte[] target,
                           final int targetOffset) {
        validateRowRange(rowStart, rowEnd);
        final int stride = getRowStride();
        System.arraycopy(pixels, rowStart * stride, target, targetOffset, (rowEnd - rowStart) * stride);
    }

    /**
     * @return a copy of all samples.
     */
    public byte[] toByteArray() {
        return pixels.clone();
    }

    public boolean hasSameShape(final PixelBuffer that) {
        return (that != null) &&
               (width == that.width) && (height == that.height) && (channels == that.channels);
    }

    /**
     * @return true if the specified buffer has the same shape and identical samples.
     */
    public boolean contentEquals(final PixelBuffer that) {
        return hasSameShape(that) && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public String toString() {
        return width + "x" + height + "x" + channels;
    }

    private void validateRowRange(final int rowStart,
                                  final int rowEnd) {
        if ((rowStart < 0) || (rowEnd > height) || (rowStart >= rowEnd)) {
            throw new IndexOutOfBoundsException("row range [" + rowStart + ", " + rowEnd + ") is invalid for " + this);
        }
    }

    private static int validateShape(final int width,
                                     final int height,
                                     final int channels)
            throws ShapeMismatchException {
        if ((width < 1) || (height < 1) || (channels < 1)) {
            throw new ShapeMismatchException("invalid shape " + width + "x" + height + "x" + channels +
                                             ", all dimensions must be positive");
        }
        final long length = (long) width * height * channels;
        if (length > Integer.MAX_VALUE) {
            throw new ShapeMismatchException("shape " + width + "x" + height + "x" + channels + " is too large");
        }
        return (int) length;
    }
}
