package org.janelia.tiling.engine;

import org.janelia.tiling.filter.FilterSpec;
import org.janelia.tiling.filter.GaussianBlurFilter;
import org.janelia.tiling.filter.RankFilter;
import org.janelia.tiling.transport.TransportKind;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link RunParameters} class.
 */
public class RunParametersTest {

    @Test
    public void testJsonProcessing() {
        final RunParameters parameters =
                new RunParameters(6,
                                  FilterSpec.forFilter(RankFilter.class, RankFilter.parametersFor(3.0, 0)),
                                  TransportKind.SHARED_ARENA);

        final RunParameters parsed = RunParameters.fromJson(parameters.toJson());

        Assert.assertEquals("invalid tile count", 6, parsed.getTileCount());
        Assert.assertEquals("invalid transport", TransportKind.SHARED_ARENA, parsed.getTransportKind());
        Assert.assertEquals("invalid filter class", RankFilter.class.getName(), parsed.getFilterSpec().getClassName());
        Assert.assertEquals("invalid radius",
                            "3.0", parsed.getFilterSpec().getParameters().get(RankFilter.RADIUS));
    }

    @Test
    public void testDefaults() {
        final RunParameters parsed = RunParameters.fromJson("{}");
        parsed.validate();

        Assert.assertEquals("invalid default tile count", RunParameters.DEFAULT_TILE_COUNT, parsed.getTileCount());
        Assert.assertEquals("invalid default transport", TransportKind.CHANNEL, parsed.getTransportKind());
        Assert.assertEquals("invalid default filter",
                            GaussianBlurFilter.class.getName(), parsed.getFilterSpec().getClassName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveTileCount() {
        RunParameters.fromJson("{\"tileCount\": 0}").validate();
    }

}
