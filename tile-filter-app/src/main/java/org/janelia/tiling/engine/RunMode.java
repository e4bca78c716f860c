package org.janelia.tiling.engine;

public enum RunMode {
    SEQUENTIAL,
    PARALLEL
}
