package org.janelia.tiling.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.json.JsonUtils;
import org.janelia.tiling.transport.TransportKind;

/**
 * Outcome of one run: status, timing, completed and failed regions, and (for completed runs) the output.
 * The JSON form leaves out the output pixels.
 */
public class RunReport {

    private final RunMode mode;
    private final TransportKind transportKind;
    private final int tileCount;
    private final RunStatus status;
    private final long startTime;
    private final long elapsedMilliseconds;
    private final List<Region> completedRegions;
    private final List<RegionFailure> failures;
    private final String cancellationReason;

    private final transient PixelBuffer output;

    public RunReport(final RunMode mode,
                     final TransportKind transportKind,
                     final int tileCount,
                     final RunStatus status,
                     final long startTime,
                     final long elapsedMilliseconds,
                     final List<Region> completedRegions,
                     final List<RegionFailure> failures,
                     final String cancellationReason,
                     final PixelBuffer output) {

        if ((status == RunStatus.COMPLETED) != (output != null)) {
            throw new IllegalArgumentException("output must be provided for completed runs and only for them");
        }

        this.mode = mode;
        this.transportKind = transportKind;
        this.tileCount = tileCount;
        this.status = status;
        this.startTime = startTime;
        this.elapsedMilliseconds = elapsedMilliseconds;
        this.completedRegions = Collections.unmodifiableList(new ArrayList<>(completedRegions));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        this.cancellationReason = cancellationReason;
        this.output = output;
    }

    public RunMode getMode() {
        return mode;
    }

    /**
     * @return transport used for parallel runs, null for sequential runs.
     */
    public TransportKind getTransportKind() {
        return transportKind;
    }

    public int getTileCount() {
        return tileCount;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public boolean isCancelled() {
        return status == RunStatus.CANCELLED;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getElapsedMilliseconds() {
        return elapsedMilliseconds;
    }

    public List<Region> getCompletedRegions() {
        return completedRegions;
    }

    public List<RegionFailure> getFailures() {
        return failures;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public boolean hasOutput() {
        return output != null;
    }

    /**
     * @return reassembled output, or null if the run was not completed.
     */
    public PixelBuffer getOutput() {
        return output;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return mode + (transportKind == null ? "" : " (" + transportKind + ")") + " run with " + tileCount +
               " tiles " + status + " after " + elapsedMilliseconds + "ms, " + completedRegions.size() +
               " regions completed, " + failures.size() + " failed";
    }

    private static final JsonUtils.Helper<RunReport> JSON_HELPER =
            new JsonUtils.Helper<>(RunReport.class);
}
