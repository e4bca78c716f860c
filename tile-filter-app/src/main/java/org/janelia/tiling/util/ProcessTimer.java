package org.janelia.tiling.util;

/**
 * Utility to track elapsed wall-clock time of a run.
 */
public class ProcessTimer {

    private final long start;
    private long stop;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
        this.stop = -1;
    }

    public long getStartMilliseconds() {
        return start;
    }

    /**
     * Freezes the elapsed time.  Later calls have no effect.
     *
     * @return elapsed milliseconds at the time of the first call.
     */
    public long stop() {
        if (stop < 0) {
            stop = System.currentTimeMillis();
        }
        return getElapsedMilliseconds();
    }

    public long getElapsedMilliseconds() {
        final long end = stop < 0 ? System.currentTimeMillis() : stop;
        return end - start;
    }

    public double getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000.0;
    }

    @Override
    public String toString() {
        return formatSeconds(getElapsedMilliseconds());
    }

    public static String formatSeconds(final long milliseconds) {
        return String.format("%.3f seconds", milliseconds / 1000.0);
    }
}
