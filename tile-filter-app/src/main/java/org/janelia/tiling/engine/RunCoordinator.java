package org.janelia.tiling.engine;

import java.util.ArrayList;
import java.util.List;

import org.janelia.tiling.filter.Filter;
import org.janelia.tiling.filter.FilterAdapter;
import org.janelia.tiling.filter.FilterParameters;
import org.janelia.tiling.image.ImageProcessorConverter;
import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.image.ShapeMismatchException;
import org.janelia.tiling.image.Tiler;
import org.janelia.tiling.transport.FailureKind;
import org.janelia.tiling.transport.Reassembler;
import org.janelia.tiling.transport.Transport;
import org.janelia.tiling.transport.TransportKind;
import org.janelia.tiling.transport.TransportSession;
import org.janelia.tiling.transport.WorkResult;
import org.janelia.tiling.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the tile, filter and reassemble pipeline for an image, either with one worker per tile
 * or sequentially in the calling thread.  Both modes use the same tiling and the same filter adapter,
 * so their outputs are identical and their elapsed times are comparable.
 */
public class RunCoordinator {

    private final int tileCount;
    private final FilterAdapter filterAdapter;
    private final FilterParameters filterParameters;
    private final Transport transport;
    private final WorkerPool workerPool;
    private final Reassembler reassembler;
    private final CancellationController cancellation;

    /**
     * @throws IllegalArgumentException
     *   if the parameters are invalid or the filter cannot be built.
     */
    public RunCoordinator(final RunParameters parameters,
                          final CancellationController cancellation)
            throws IllegalArgumentException {
        this(validated(parameters).getTileCount(),
             parameters.getFilterSpec().buildInstance(),
             parameters.getFilterSpec().getFilterParameters(),
             parameters.getTransportKind().newTransport(),
             cancellation);
    }

    public RunCoordinator(final int tileCount,
                          final Filter filter,
                          final FilterParameters filterParameters,
                          final Transport transport,
                          final CancellationController cancellation) {
        this(tileCount, filterParameters, transport, cancellation, new WorkerPool(new FilterAdapter(filter)));
    }

    /**
     * Constructs a coordinator with a custom worker pool (e.g. one with a specific thread factory).
     * The pool's filter adapter is also used for sequential runs.
     */
    public RunCoordinator(final int tileCount,
                          final FilterParameters filterParameters,
                          final Transport transport,
                          final CancellationController cancellation,
                          final WorkerPool workerPool) {
        if (tileCount < 1) {
            throw new IllegalArgumentException("tileCount must be positive");
        }
        workerPool.getFilterAdapter().getFilter().validate(filterParameters);

        this.tileCount = tileCount;
        this.filterAdapter = workerPool.getFilterAdapter();
        this.filterParameters = filterParameters;
        this.transport = transport;
        this.workerPool = workerPool;
        this.reassembler = new Reassembler();
        this.cancellation = cancellation;
    }

    public int getTileCount() {
        return tileCount;
    }

    public TransportKind getTransportKind() {
        return transport.getKind();
    }

    public CancellationController getCancellation() {
        return cancellation;
    }

    /**
     * Filters every tile of the input with its own worker and reassembles the results.
     *
     * @throws ShapeMismatchException
     *   if the input's channel depth cannot be filtered (no worker is started).
     *
     * @throws org.janelia.tiling.image.InvalidPartitionCountException
     *   if the input cannot be split into the configured number of tiles (no worker is started).
     */
    public RunReport runParallel(final PixelBuffer input) {

        LOG.info("runParallel: entry, input={}, tileCount={}, transport={}", input, tileCount, transport.getKind());

        checkChannelDepth(input);

        final ProcessTimer timer = new ProcessTimer();
        final List<Region> regions = Tiler.tile(input, tileCount);

        final TransportSession session = transport.open(input, regions);
        final PoolResult poolResult = workerPool.run(input, regions, filterParameters, session, cancellation);

        final RunReport report = buildReport(RunMode.PARALLEL, transport.getKind(), regions,
                                             poolResult.getResults(), timer, session::assemble);

        LOG.info("runParallel: exit, {}", report);

        return report;
    }

    /**
     * Filters every tile of the input one after the other in the calling thread.
     *
     * @throws ShapeMismatchException
     *   if the input's channel depth cannot be filtered.
     *
     * @throws org.janelia.tiling.image.InvalidPartitionCountException
     *   if the input cannot be split into the configured number of tiles.
     */
    public RunReport runSequential(final PixelBuffer input) {

        LOG.info("runSequential: entry, input={}, tileCount={}", input, tileCount);

        checkChannelDepth(input);

        final ProcessTimer timer = new ProcessTimer();
        final List<Region> regions = Tiler.tile(input, tileCount);

        final List<WorkResult> results = new ArrayList<>(regions.size());
        for (final Region region : regions) {
            if (cancellation.checkpoint("sequential processing of " + region)) {
                break;
            }
            try {
                results.add(WorkResult.withPixels(region, filterAdapter.apply(input.copyRegion(region),
                                                                              filterParameters)));
            } catch (final RuntimeException e) {
                LOG.warn("runSequential: failed to filter " + region, e);
                results.add(WorkResult.failed(region, FailureKind.FILTER_FAILURE, e));
            }
        }

        final RunReport report = buildReport(RunMode.SEQUENTIAL, null, regions, results, timer,
                                             completeResults -> reassembler.combine(regions,
                                                                                    completeResults,
                                                                                    input.getWidth(),
                                                                                    input.getChannels()));

        LOG.info("runSequential: exit, {}", report);

        return report;
    }

    /**
     * Runs the sequential baseline and then (unless the baseline was cancelled) the parallel pipeline.
     */
    public RunComparison compare(final PixelBuffer input) {

        final RunReport sequential = runSequential(input);

        RunReport parallel = null;
        if (sequential.isCancelled()) {
            LOG.info("compare: skipping parallel run because sequential run was cancelled");
        } else {
            parallel = runParallel(input);
        }

        final RunComparison comparison = new RunComparison(sequential, parallel);

        if (comparison.getSpeedup() != null) {
            LOG.info("compare: sequential took {}, parallel took {}, speedup is {}, outputs identical: {}",
                     ProcessTimer.formatSeconds(sequential.getElapsedMilliseconds()),
                     ProcessTimer.formatSeconds(parallel.getElapsedMilliseconds()),
                     String.format("%.2f", comparison.getSpeedup()),
                     comparison.getOutputIdentical());
        }

        return comparison;
    }

    private RunReport buildReport(final RunMode mode,
                                  final TransportKind transportKind,
                                  final List<Region> regions,
                                  final List<WorkResult> results,
                                  final ProcessTimer timer,
                                  final Assembler assembler) {

        final List<Region> completedRegions = new ArrayList<>();
        final List<RegionFailure> failures = new ArrayList<>();
        for (final WorkResult result : results) {
            if (result.isSuccessful()) {
                completedRegions.add(result.getRegion());
            } else {
                failures.add(RegionFailure.fromResult(result));
            }
        }

        final RunStatus status;
        PixelBuffer output = null;
        if (results.size() < regions.size()) {
            status = RunStatus.CANCELLED;
        } else if (failures.size() > 0) {
            status = RunStatus.FAILED;
        } else {
            output = assembler.assemble(results);
            status = RunStatus.COMPLETED;
        }

        final long elapsed = timer.stop();

        return new RunReport(mode,
                             transportKind,
                             regions.size(),
                             status,
                             timer.getStartMilliseconds(),
                             elapsed,
                             completedRegions,
                             failures,
                             status == RunStatus.CANCELLED ? cancellation.getReason() : null,
                             output);
    }

    private static void checkChannelDepth(final PixelBuffer input)
            throws ShapeMismatchException {
        if (! ImageProcessorConverter.isSupportedChannelDepth(input.getChannels())) {
            throw new ShapeMismatchException("input " + input + " has " + input.getChannels() +
                                             " channels, only " + ImageProcessorConverter.GRAY_CHANNELS +
                                             " or " + ImageProcessorConverter.RGB_CHANNELS +
                                             " channel images can be filtered");
        }
    }

    private static RunParameters validated(final RunParameters parameters)
            throws IllegalArgumentException {
        if (parameters == null) {
            throw new IllegalArgumentException("run parameters must be specified");
        }
        parameters.validate();
        return parameters;
    }

    private interface Assembler {
        PixelBuffer assemble(final List<WorkResult> results);
    }

    private static final Logger LOG = LoggerFactory.getLogger(RunCoordinator.class);
}
