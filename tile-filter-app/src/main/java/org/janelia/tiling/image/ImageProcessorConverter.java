package org.janelia.tiling.image;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

/**
 * Converts between {@link PixelBuffer} instances and ImageJ processors.
 * Single channel buffers map to {@link ByteProcessor}s, three channel buffers to {@link ColorProcessor}s.
 * Conversions always copy, so neither side shares samples with the other.
 */
public class ImageProcessorConverter {

    public static final int GRAY_CHANNELS = 1;
    public static final int RGB_CHANNELS = 3;

    private ImageProcessorConverter() {
    }

    public static boolean isSupportedChannelDepth(final int channels) {
        return (channels == GRAY_CHANNELS) || (channels == RGB_CHANNELS);
    }

    /**
     * @return a new processor holding a copy of the buffer's samples.
     *
     * @throws IllegalArgumentException
     *   if the buffer's channel depth is neither 1 nor 3.
     */
    public static ImageProcessor toImageProcessor(final PixelBuffer buffer)
            throws IllegalArgumentException {

        final int width = buffer.getWidth();
        final int height = buffer.getHeight();
        final byte[] samples = buffer.toByteArray();

        final ImageProcessor ip;
        if (buffer.getChannels() == GRAY_CHANNELS) {
            ip = new ByteProcessor(width, height, samples);
        } else if (buffer.getChannels() == RGB_CHANNELS) {
            final int[] rgb = new int[width * height];
            for (int i = 0, s = 0; i < rgb.length; i++, s += RGB_CHANNELS) {
                rgb[i] = 0xff000000 |
                         ((samples[s] & 0xff) << 16) |
                         ((samples[s + 1] & 0xff) << 8) |
                         (samples[s + 2] & 0xff);
            }
            ip = new ColorProcessor(width, height, rgb);
        } else {
            throw new IllegalArgumentException("buffer " + buffer + " has unsupported channel depth " +
                                               buffer.getChannels() + ", only " + GRAY_CHANNELS + " and " +
                                               RGB_CHANNELS + " are supported");
        }

        return ip;
    }

    /**
     * @return a new buffer holding a copy of the processor's samples.
     *         RGB processors produce three channel buffers, 8-bit processors single channel buffers,
     *         and all other processor types are scaled to 8-bit gray first.
     */
    public static PixelBuffer toPixelBuffer(final ImageProcessor ip) {

        final int width = ip.getWidth();
        final int height = ip.getHeight();

        final PixelBuffer buffer;
        if (ip instanceof ColorProcessor) {
            final int[] rgb = (int[]) ip.getPixels();
            final byte[] samples = new byte[rgb.length * RGB_CHANNELS];
            for (int i = 0, s = 0; i < rgb.length; i++, s += RGB_CHANNELS) {
                final int c = rgb[i];
                samples[s] = (byte) ((c >> 16) & 0xff);
                samples[s + 1] = (byte) ((c >> 8) & 0xff);
                samples[s + 2] = (byte) (c & 0xff);
            }
            buffer = PixelBuffer.wrap(width, height, RGB_CHANNELS, samples);
        } else if (ip instanceof ByteProcessor) {
            buffer = PixelBuffer.copyOf(width, height, GRAY_CHANNELS, (byte[]) ip.getPixels());
        } else {
            final ByteProcessor converted = ip.convertToByteProcessor();
            buffer = PixelBuffer.wrap(width, height, GRAY_CHANNELS, (byte[]) converted.getPixels());
        }

        return buffer;
    }

}
