package org.janelia.tiling.filter;

import ij.process.ByteProcessor;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.TestImages;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FilterAdapter} class.
 */
public class FilterAdapterTest {

    @Test
    public void testIdentityReturnsEqualCopy() {
        final PixelBuffer source = TestImages.random(10, 6, 3, 3);

        final PixelBuffer filtered = new FilterAdapter(new IdentityFilter()).apply(source, FilterParameters.EMPTY);

        Assert.assertNotSame("filtered pixels should be a new buffer", source, filtered);
        Assert.assertTrue("identity should not change pixels", source.contentEquals(filtered));
    }

    @Test
    public void testSourceIsNotModified() {
        final PixelBuffer source = TestImages.filled(4, 4, 1, 30);

        final PixelBuffer filtered = new FilterAdapter(new InvertFilter()).apply(source, FilterParameters.EMPTY);

        Assert.assertEquals("source should not be modified", 30, source.get(0, 0, 0));
        Assert.assertEquals("filtered pixel should be inverted", 225, filtered.get(0, 0, 0));
    }

    @Test
    public void testFilterExceptionIsWrapped() {
        final IllegalStateException cause = new IllegalStateException("broken filter");
        final Filter brokenFilter = (ip, parameters) -> {
            throw cause;
        };

        try {
            new FilterAdapter(brokenFilter).apply(TestImages.filled(4, 4, 1, 0), FilterParameters.EMPTY);
            Assert.fail("failure should have been reported");
        } catch (final FilterFailureException e) {
            Assert.assertSame("cause should be retained", cause, e.getCause());
        }
    }

    @Test
    public void testFilterErrorIsWrapped() {
        final AssertionError cause = new AssertionError("broken filter");
        final Filter brokenFilter = (ip, parameters) -> {
            throw cause;
        };

        try {
            new FilterAdapter(brokenFilter).apply(TestImages.filled(4, 4, 1, 0), FilterParameters.EMPTY);
            Assert.fail("failure should have been reported");
        } catch (final FilterFailureException e) {
            Assert.assertSame("cause should be retained", cause, e.getCause());
        }
    }

    @Test(expected = OutOfMemoryError.class)
    public void testVirtualMachineErrorIsNotWrapped() {
        final Filter exhaustedFilter = (ip, parameters) -> {
            throw new OutOfMemoryError("test exhaustion");
        };
        new FilterAdapter(exhaustedFilter).apply(TestImages.filled(4, 4, 1, 0), FilterParameters.EMPTY);
    }

    @Test(expected = FilterFailureException.class)
    public void testShapeChangeIsRejected() {
        final Filter shrinkingFilter = (ip, parameters) -> new ByteProcessor(1, 1);
        new FilterAdapter(shrinkingFilter).apply(TestImages.filled(4, 4, 1, 0), FilterParameters.EMPTY);
    }

    @Test(expected = FilterFailureException.class)
    public void testMissingResultIsRejected() {
        final Filter nullFilter = (ip, parameters) -> null;
        new FilterAdapter(nullFilter).apply(TestImages.filled(4, 4, 1, 0), FilterParameters.EMPTY);
    }

}
