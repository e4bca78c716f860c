package org.janelia.tiling.engine;

import org.janelia.tiling.json.JsonUtils;

/**
 * Sequential baseline and parallel run of the same input, parameters and tiling.
 */
public class RunComparison {

    private final RunReport sequential;
    private final RunReport parallel;
    private final Double speedup;
    private final Boolean outputIdentical;

    public RunComparison(final RunReport sequential,
                         final RunReport parallel) {
        this.sequential = sequential;
        this.parallel = parallel;

        if ((parallel != null) && sequential.isCompleted() && parallel.isCompleted()) {
            this.speedup = sequential.getElapsedMilliseconds() / (double) Math.max(1, parallel.getElapsedMilliseconds());
            this.outputIdentical = sequential.getOutput().contentEquals(parallel.getOutput());
        } else {
            this.speedup = null;
            this.outputIdentical = null;
        }
    }

    public RunReport getSequential() {
        return sequential;
    }

    /**
     * @return parallel run report, or null if the parallel run was skipped.
     */
    public RunReport getParallel() {
        return parallel;
    }

    /**
     * @return sequential elapsed time divided by parallel elapsed time, or null unless both runs completed.
     */
    public Double getSpeedup() {
        return speedup;
    }

    /**
     * @return whether both runs produced byte-identical output, or null unless both runs completed.
     */
    public Boolean getOutputIdentical() {
        return outputIdentical;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    private static final JsonUtils.Helper<RunComparison> JSON_HELPER =
            new JsonUtils.Helper<>(RunComparison.class);
}
