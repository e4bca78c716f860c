package org.janelia.tiling.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;

import org.janelia.tiling.client.parameter.CommandLineParameters;
import org.janelia.tiling.client.parameter.FilterRunParameters;
import org.janelia.tiling.engine.CancellationController;
import org.janelia.tiling.engine.InterruptHook;
import org.janelia.tiling.engine.RunComparison;
import org.janelia.tiling.engine.RunCoordinator;
import org.janelia.tiling.engine.RunParameters;
import org.janelia.tiling.engine.RunReport;
import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Tiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for filtering an image tile by tile with one worker per tile.
 * By default the sequential baseline is run first so that elapsed times can be compared.
 *
 * An interrupt signal (e.g. Ctrl-C) cancels the run: no further tiles are started,
 * started tiles are allowed to finish, and the partial report is logged.
 */
public class TiledFilterClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public FilterRunParameters run = new FilterRunParameters();

        @Parameter(
                names = "--input",
                description = "Path of image to filter",
                required = true)
        public String input;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for filtered images (omit to skip saving)")
        public String outputDirectory;

        @Parameter(
                names = "--format",
                description = "Format for saved images: png, tif, or jpg")
        public String format = PixelBufferIO.PNG_FORMAT;

        @Parameter(
                names = "--parallelOnly",
                description = "Skip the sequential baseline run",
                arity = 0)
        public boolean parallelOnly = false;

        @Parameter(
                names = "--saveTiles",
                description = "Also save each filtered tile as its own image",
                arity = 0)
        public boolean saveTiles = false;

        @Parameter(
                names = "--maxInterruptWaitSeconds",
                description = "Maximum number of seconds an interrupt signal waits for running tiles to finish")
        public Integer maxInterruptWaitSeconds = 60;
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

                final TiledFilterClient client = new TiledFilterClient(parameters);
                return client.filterImage();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final RunParameters runParameters;

    TiledFilterClient(final Parameters parameters)
            throws IOException, IllegalArgumentException {
        this.parameters = parameters;
        this.runParameters = parameters.run.toRunParameters();
    }

    public RunParameters getRunParameters() {
        return runParameters;
    }

    /**
     * @return exit code: 0 if the final run completed, {@link #CANCELLED_EXIT_CODE} if it was cancelled,
     *         and 1 if it failed.
     */
    int filterImage()
            throws IOException {

        LOG.info("filterImage: entry, runParameters={}", runParameters);

        final PixelBuffer input = PixelBufferIO.load(parameters.input);

        final CancellationController cancellation = new CancellationController();
        final RunCoordinator coordinator = new RunCoordinator(runParameters, cancellation);

        final RunReport finalReport;
        try (final InterruptHook ignored =
                     cancellation.installInterruptHook(parameters.maxInterruptWaitSeconds * 1000L)) {

            if (parameters.parallelOnly) {
                finalReport = coordinator.runParallel(input);
                saveOutput(finalReport, input);
                LOG.info("filterImage: report is\n{}", finalReport.toJson());
            } else {
                final RunComparison comparison = coordinator.compare(input);
                saveOutput(comparison.getSequential(), input);
                if (comparison.getParallel() != null) {
                    saveOutput(comparison.getParallel(), input);
                    finalReport = comparison.getParallel();
                } else {
                    finalReport = comparison.getSequential();
                }
                LOG.info("filterImage: comparison is\n{}", comparison.toJson());
            }
        }

        final int exitCode;
        if (finalReport.isCompleted()) {
            exitCode = 0;
        } else if (finalReport.isCancelled()) {
            exitCode = CANCELLED_EXIT_CODE;
        } else {
            exitCode = 1;
        }

        LOG.info("filterImage: exit, {}", finalReport);

        return exitCode;
    }

    private void saveOutput(final RunReport report,
                            final PixelBuffer input)
            throws IOException {

        if ((parameters.outputDirectory == null) || (! report.hasOutput())) {
            return;
        }

        final File directory = new File(parameters.outputDirectory);
        final String baseName = PixelBufferIO.getBaseName(parameters.input) + "_" +
                                report.getMode().name().toLowerCase();

        PixelBufferIO.save(report.getOutput(),
                           new File(directory, baseName + "." + parameters.format).getAbsolutePath());

        if (parameters.saveTiles) {
            PixelBufferIO.saveRegions(report.getOutput(),
                                      Tiler.tile(input, runParameters.getTileCount()),
                                      directory,
                                      baseName,
                                      parameters.format);
        }
    }

    /** Conventional exit code for processes stopped by an interrupt signal. */
    static final int CANCELLED_EXIT_CODE = 130;

    private static final Logger LOG = LoggerFactory.getLogger(TiledFilterClient.class);
}
