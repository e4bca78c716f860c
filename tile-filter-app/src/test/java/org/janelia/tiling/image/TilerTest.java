package org.janelia.tiling.image;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Tiler} class.
 */
public class TilerTest {

    @Test
    public void testRegionsCoverAllRowsForEveryValidCount() {
        for (int height = 1; height <= 64; height++) {
            for (int count = 1; count <= height; count++) {
                final List<Region> regions = Tiler.tile(7, height, 3, count);
                final String context = "height " + height + ", count " + count;

                Assert.assertEquals("invalid number of regions for " + context, count, regions.size());

                int expectedStart = 0;
                for (int i = 0; i < regions.size(); i++) {
                    final Region region = regions.get(i);
                    Assert.assertEquals("invalid index for " + context, i, region.getIndex());
                    Assert.assertEquals("region " + i + " is not contiguous for " + context,
                                        expectedStart, region.getRowStart());
                    Assert.assertTrue("region " + i + " is empty for " + context, region.getHeight() > 0);
                    Assert.assertEquals("invalid width for " + context, 7, region.getWidth());
                    Assert.assertEquals("invalid channels for " + context, 3, region.getChannels());
                    expectedStart = region.getRowEnd();
                }

                Assert.assertEquals("regions do not end at last row for " + context, height, expectedStart);

                final Region last = regions.get(count - 1);
                Assert.assertEquals("invalid last region height for " + context,
                                    height - (count - 1) * (height / count), last.getHeight());
            }
        }
    }

    @Test
    public void testEvenSplit() {
        final PixelBuffer buffer = new PixelBuffer(40, 100, 3);
        final List<Region> regions = Tiler.tile(buffer, 4);

        final int[][] expectedRanges = { {0, 25}, {25, 50}, {50, 75}, {75, 100} };
        Assert.assertEquals("invalid number of regions", expectedRanges.length, regions.size());
        for (int i = 0; i < expectedRanges.length; i++) {
            Assert.assertEquals("invalid start for region " + i, expectedRanges[i][0], regions.get(i).getRowStart());
            Assert.assertEquals("invalid end for region " + i, expectedRanges[i][1], regions.get(i).getRowEnd());
            Assert.assertEquals("invalid byte offset for region " + i,
                                expectedRanges[i][0] * 40 * 3, regions.get(i).getByteOffset());
        }
    }

    @Test
    public void testLastRegionAbsorbsRemainder() {
        final List<Region> regions = Tiler.tile(5, 10, 1, 3);
        Assert.assertEquals("invalid first region", 3, regions.get(0).getHeight());
        Assert.assertEquals("invalid second region", 3, regions.get(1).getHeight());
        Assert.assertEquals("invalid last region start", 6, regions.get(2).getRowStart());
        Assert.assertEquals("invalid last region height", 4, regions.get(2).getHeight());
    }

    @Test
    public void testSingleRegion() {
        final List<Region> regions = Tiler.tile(5, 10, 1, 1);
        Assert.assertEquals("invalid number of regions", 1, regions.size());
        Assert.assertEquals("invalid region end", 10, regions.get(0).getRowEnd());
    }

    @Test
    public void testMoreRegionsThanRows() {
        try {
            Tiler.tile(40, 2, 3, 3);
            Assert.fail("three regions should not be created for two rows");
        } catch (final InvalidPartitionCountException e) {
            Assert.assertEquals("invalid height in exception", 2, e.getHeight());
            Assert.assertEquals("invalid count in exception", 3, e.getCount());
        }
    }

    @Test
    public void testNonPositiveCounts() {
        for (final int count : new int[] { 0, -1 }) {
            try {
                Tiler.tile(40, 10, 3, count);
                Assert.fail("count " + count + " should be rejected");
            } catch (final InvalidPartitionCountException e) {
                Assert.assertEquals("invalid count in exception", count, e.getCount());
            }
        }
    }

}
