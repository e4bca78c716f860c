package org.janelia.tiling.engine;

import java.util.Collections;
import java.util.List;

import org.janelia.tiling.transport.WorkResult;

/**
 * Results collected by a {@link WorkerPool} for one run.
 */
public class PoolResult {

    private final int regionCount;
    private final int spawnedCount;
    private final List<WorkResult> results;

    public PoolResult(final int regionCount,
                      final int spawnedCount,
                      final List<WorkResult> results) {
        this.regionCount = regionCount;
        this.spawnedCount = spawnedCount;
        this.results = Collections.unmodifiableList(results);
    }

    public int getRegionCount() {
        return regionCount;
    }

    /**
     * @return number of workers that were started (all of them have terminated).
     */
    public int getSpawnedCount() {
        return spawnedCount;
    }

    /**
     * @return collected results (successes and failures) in region order.
     */
    public List<WorkResult> getResults() {
        return results;
    }

    /**
     * @return true if a result was collected for every region.
     */
    public boolean isComplete() {
        return results.size() == regionCount;
    }
}
