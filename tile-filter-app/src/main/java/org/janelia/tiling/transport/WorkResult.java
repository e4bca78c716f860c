package org.janelia.tiling.transport;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;

/**
 * Outcome of processing one region: filtered pixels, a completion token for pixels written in place,
 * or a failure marker.
 */
public class WorkResult {

    private final Region region;
    private final PixelBuffer pixels;
    private final boolean writtenInPlace;
    private final FailureKind failureKind;
    private final Throwable failure;

    private WorkResult(final Region region,
                       final PixelBuffer pixels,
                       final boolean writtenInPlace,
                       final FailureKind failureKind,
                       final Throwable failure) {
        this.region = region;
        this.pixels = pixels;
        this.writtenInPlace = writtenInPlace;
        this.failureKind = failureKind;
        this.failure = failure;
    }

    /**
     * @return result carrying the region's filtered pixels (owned by the result).
     */
    public static WorkResult withPixels(final Region region,
                                        final PixelBuffer pixels) {
        if (pixels == null) {
            throw new IllegalArgumentException("pixels must be specified for " + region);
        }
        return new WorkResult(region, pixels, false, null, null);
    }

    /**
     * @return completion token for a region whose pixels were written in place.
     */
    public static WorkResult completedInPlace(final Region region) {
        return new WorkResult(region, null, true, null, null);
    }

    public static WorkResult failed(final Region region,
                                    final FailureKind failureKind,
                                    final Throwable failure) {
        if (failureKind == null) {
            throw new IllegalArgumentException("failure kind must be specified for " + region);
        }
        return new WorkResult(region, null, false, failureKind, failure);
    }

    public Region getRegion() {
        return region;
    }

    public boolean isSuccessful() {
        return failureKind == null;
    }

    /**
     * @return filtered pixels or null if this is a completion token or a failure.
     */
    public PixelBuffer getPixels() {
        return pixels;
    }

    public boolean isWrittenInPlace() {
        return writtenInPlace;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public Throwable getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        final String outcome;
        if (failureKind != null) {
            outcome = failureKind.name();
        } else if (writtenInPlace) {
            outcome = "written in place";
        } else {
            outcome = pixels + " pixels";
        }
        return region + ": " + outcome;
    }
}
