package org.janelia.tiling.engine;

import java.io.Reader;
import java.util.HashMap;

import org.janelia.tiling.filter.FilterSpec;
import org.janelia.tiling.filter.GaussianBlurFilter;
import org.janelia.tiling.json.JsonUtils;
import org.janelia.tiling.transport.TransportKind;

/**
 * Configuration for a tiled run: how many tiles, which filter, and which transport.
 */
public class RunParameters {

    public static final int DEFAULT_TILE_COUNT = 2;

    private final int tileCount;
    private final FilterSpec filterSpec;
    private final TransportKind transportKind;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private RunParameters() {
        this(DEFAULT_TILE_COUNT,
             new FilterSpec(GaussianBlurFilter.class.getName(), new HashMap<>()),
             TransportKind.CHANNEL);
    }

    public RunParameters(final int tileCount,
                         final FilterSpec filterSpec,
                         final TransportKind transportKind) {
        this.tileCount = tileCount;
        this.filterSpec = filterSpec;
        this.transportKind = transportKind;
    }

    public int getTileCount() {
        return tileCount;
    }

    public FilterSpec getFilterSpec() {
        return filterSpec;
    }

    public TransportKind getTransportKind() {
        return transportKind;
    }

    /**
     * @throws IllegalArgumentException
     *   if any parameter is missing or invalid.
     */
    public void validate()
            throws IllegalArgumentException {
        if (tileCount < 1) {
            throw new IllegalArgumentException("tileCount must be positive");
        }
        if (filterSpec == null) {
            throw new IllegalArgumentException("filterSpec must be specified");
        }
        if (transportKind == null) {
            throw new IllegalArgumentException("transportKind must be specified");
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static RunParameters fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    public static RunParameters fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<RunParameters> JSON_HELPER =
            new JsonUtils.Helper<>(RunParameters.class);
}
