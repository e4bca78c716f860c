package org.janelia.tiling.client;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.janelia.tiling.image.ImageProcessorConverter;
import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and saves {@link PixelBuffer}s as image files using ImageJ.
 */
public class PixelBufferIO {

    public static final String PNG_FORMAT = "png";
    public static final String TIF_FORMAT = "tif";
    public static final String TIFF_FORMAT = "tiff";
    public static final String JPG_FORMAT = "jpg";
    public static final String JPEG_FORMAT = "jpeg";

    private PixelBufferIO() {
    }

    /**
     * @return buffer with the pixels of the specified image file.
     *         RGB images have three channels, all other images are converted to 8-bit gray.
     *
     * @throws IOException
     *   if the file cannot be opened as an image.
     */
    public static PixelBuffer load(final String path)
            throws IOException {

        final File file = new File(path);
        if (! file.canRead()) {
            throw new IOException("cannot read " + file.getAbsolutePath());
        }

        // openers keep state about the file being opened, so we need to create a new opener for each load
        final Opener opener = new Opener();
        opener.setSilentMode(true);

        final ImagePlus imagePlus = opener.openImage(file.getAbsolutePath());
        if (imagePlus == null) {
            throw new IOException("failed to open " + file.getAbsolutePath() + " as an image");
        }

        final PixelBuffer buffer = ImageProcessorConverter.toPixelBuffer(imagePlus.getProcessor());

        LOG.info("load: exit, loaded {} from {}", buffer, file.getAbsolutePath());

        return buffer;
    }

    /**
     * Saves the buffer using the format implied by the path's extension (png, tif/tiff, or jpg/jpeg).
     *
     * @throws IOException
     *   if the format is not supported or the file cannot be written.
     */
    public static void save(final PixelBuffer buffer,
                            final String path)
            throws IOException {

        final File file = prepareFileForWrite(path);
        final String format = getFormat(file);

        final ImagePlus imagePlus = new ImagePlus(file.getName(), ImageProcessorConverter.toImageProcessor(buffer));
        final FileSaver fileSaver = new FileSaver(imagePlus);

        final boolean saved;
        switch (format) {
            case PNG_FORMAT:
                saved = fileSaver.saveAsPng(file.getAbsolutePath());
                break;
            case TIF_FORMAT:
            case TIFF_FORMAT:
                saved = fileSaver.saveAsTiff(file.getAbsolutePath());
                break;
            case JPG_FORMAT:
            case JPEG_FORMAT:
                saved = fileSaver.saveAsJpeg(file.getAbsolutePath());
                break;
            default:
                throw new IOException("unsupported format '" + format + "' for " + file.getAbsolutePath() +
                                      ", supported formats are png, tif, and jpg");
        }

        if (! saved) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }

        LOG.info("save: exit, saved {} to {}", buffer, file.getAbsolutePath());
    }

    /**
     * Saves each region of the buffer as its own image named {@code <baseName>_part_<n>.<format>}
     * where n starts at 1.
     *
     * @return saved files in region order.
     */
    public static List<File> saveRegions(final PixelBuffer buffer,
                                         final List<Region> regions,
                                         final File directory,
                                         final String baseName,
                                         final String format)
            throws IOException {

        final List<File> savedFiles = new ArrayList<>(regions.size());
        for (final Region region : regions) {
            final File file = new File(directory, getPartName(baseName, region, format));
            save(buffer.copyRegion(region), file.getAbsolutePath());
            savedFiles.add(file);
        }
        return savedFiles;
    }

    public static String getPartName(final String baseName,
                                     final Region region,
                                     final String format) {
        return baseName + "_part_" + (region.getIndex() + 1) + "." + format;
    }

    /**
     * @return file name without its extension.
     */
    public static String getBaseName(final String path) {
        final String name = new File(path).getName();
        final int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }

    private static String getFormat(final File file) {
        final String name = file.getName();
        final int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(dotIndex + 1).toLowerCase(Locale.US) : "";
    }

    private static File prepareFileForWrite(final String path)
            throws IOException {

        final File file = new File(path).getAbsoluteFile();
        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists())) {
            if (! parentDirectory.mkdirs()) {
                // check again in case another process created the directory
                if (! parentDirectory.exists()) {
                    throw new IOException("failed to create " + parentDirectory.getAbsolutePath());
                }
            }
        }

        if (file.exists() && (! file.canWrite())) {
            throw new IOException("not allowed to write to " + file.getAbsolutePath());
        }

        return file;
    }

    private static final Logger LOG = LoggerFactory.getLogger(PixelBufferIO.class);
}
