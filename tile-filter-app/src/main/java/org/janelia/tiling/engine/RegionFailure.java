package org.janelia.tiling.engine;

import org.janelia.tiling.image.Region;
import org.janelia.tiling.transport.FailureKind;
import org.janelia.tiling.transport.WorkResult;

/**
 * Failure of one region, as listed in a {@link RunReport}.
 */
public class RegionFailure {

    private final Region region;
    private final FailureKind kind;
    private final String message;

    private final transient Throwable cause;

    public RegionFailure(final Region region,
                         final FailureKind kind,
                         final Throwable cause) {
        this.region = region;
        this.kind = kind;
        this.cause = cause;
        this.message = cause == null ? null : describe(cause);
    }

    public static RegionFailure fromResult(final WorkResult result) {
        return new RegionFailure(result.getRegion(), result.getFailureKind(), result.getFailure());
    }

    public Region getRegion() {
        return region;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return region + " failed with " + kind + (message == null ? "" : ": " + message);
    }

    private static String describe(final Throwable cause) {
        final StringBuilder sb = new StringBuilder(String.valueOf(cause.getMessage()));
        Throwable nested = cause.getCause();
        while (nested != null) {
            sb.append(", caused by ").append(nested.getClass().getSimpleName()).append(": ").append(nested.getMessage());
            nested = nested.getCause();
        }
        return sb.toString();
    }
}
