package org.janelia.tiling.client;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.janelia.tiling.client.parameter.CommandLineParameters;
import org.janelia.tiling.engine.RunParameters;
import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Tiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for splitting an image into horizontal tiles (without filtering)
 * and saving each tile as its own image.
 */
public class SplitImageClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Path of image to split",
                required = true)
        public String input;

        @Parameter(
                names = "--tileCount",
                description = "Number of horizontal tiles")
        public Integer tileCount = RunParameters.DEFAULT_TILE_COUNT;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for tile images",
                required = true)
        public String outputDirectory;

        @Parameter(
                names = "--format",
                description = "Format for tile images: png, tif, or jpg")
        public String format = PixelBufferIO.PNG_FORMAT;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public int runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                if (! parameters.parse(args)) {
                    return parameters.getStopExitCode();
                }

                LOG.info("runClient: entry, parameters={}", parameters);

                final SplitImageClient client = new SplitImageClient(parameters);
                client.splitImage();

                return 0;
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    SplitImageClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    List<File> splitImage()
            throws IOException {

        final PixelBuffer input = PixelBufferIO.load(parameters.input);

        final List<File> tileFiles = PixelBufferIO.saveRegions(input,
                                                               Tiler.tile(input, parameters.tileCount),
                                                               new File(parameters.outputDirectory),
                                                               PixelBufferIO.getBaseName(parameters.input),
                                                               parameters.format);

        LOG.info("splitImage: exit, saved {} tiles to {}", tileFiles.size(), parameters.outputDirectory);

        return tileFiles;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SplitImageClient.class);
}
