package org.janelia.tiling.filter;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FilterSpec} class.
 */
public class FilterSpecTest {

    @Test
    public void testJsonProcessing() {
        final FilterSpec spec = FilterSpec.forFilter(GaussianBlurFilter.class,
                                                     GaussianBlurFilter.parametersFor(3.5));

        final String json = spec.toJson();
        Assert.assertNotNull("json generation returned null string", json);

        final FilterSpec parsedSpec = FilterSpec.fromJson(json);
        Assert.assertNotNull("null spec returned from json parse", parsedSpec);
        Assert.assertEquals("invalid class name", GaussianBlurFilter.class.getName(), parsedSpec.getClassName());
        Assert.assertEquals("invalid sigma",
                            3.5, parsedSpec.getFilterParameters().getDoubleParameter(GaussianBlurFilter.SIGMA),
                            0.0);

        final Filter filter = parsedSpec.buildInstance();
        Assert.assertTrue("invalid filter instance type", filter instanceof GaussianBlurFilter);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingClass() {
        new FilterSpec("org.janelia.tiling.filter.MissingFilter", null).buildInstance();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClassThatIsNotAFilter() {
        new FilterSpec(String.class.getName(), null).buildInstance();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidParametersAreRejectedOnBuild() {
        FilterSpec.forFilter(GaussianBlurFilter.class, GaussianBlurFilter.parametersFor(-1.0)).buildInstance();
    }

}
