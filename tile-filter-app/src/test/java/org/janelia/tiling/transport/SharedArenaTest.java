package org.janelia.tiling.transport;

import java.util.Arrays;
import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.image.ShapeMismatchException;
import org.janelia.tiling.image.TestImages;
import org.janelia.tiling.image.Tiler;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SharedArena} and {@link ArenaSlice} classes.
 */
public class SharedArenaTest {

    @Test
    public void testSlicesFillArena() {
        final PixelBuffer source = TestImages.random(9, 23, 3, 5);
        final List<Region> regions = Tiler.tile(source, 4);
        final SharedArena arena = new SharedArena(9, 23, 3);

        final List<ArenaSlice> slices = arena.issueSlices(regions);
        Assert.assertEquals("invalid number of slices", regions.size(), slices.size());

        // write out of order
        for (int i = slices.size() - 1; i >= 0; i--) {
            Assert.assertFalse("arena should not be complete before all slices are written", arena.isComplete());
            slices.get(i).write(source.copyRegion(regions.get(i)));
        }

        Assert.assertTrue("arena should be complete", arena.isComplete());
        Assert.assertTrue("arena should match source", source.contentEquals(arena.toPixelBuffer()));
    }

    @Test(expected = IllegalStateException.class)
    public void testSlicesAreOnlyIssuedOnce() {
        final SharedArena arena = new SharedArena(4, 4, 1);
        arena.issueSlices(Tiler.tile(4, 4, 1, 2));
        arena.issueSlices(Tiler.tile(4, 4, 1, 2));
    }

    @Test(expected = IllegalStateException.class)
    public void testSliceIsWrittenOnce() {
        final SharedArena arena = new SharedArena(4, 4, 1);
        final ArenaSlice slice = arena.issueSlices(Tiler.tile(4, 4, 1, 2)).get(0);
        slice.write(TestImages.filled(4, 2, 1, 1));
        slice.write(TestImages.filled(4, 2, 1, 2));
    }

    @Test
    public void testTileMustHaveRegionHeight() {
        final SharedArena arena = new SharedArena(4, 6, 1);
        final ArenaSlice slice = arena.issueSlices(Tiler.tile(4, 6, 1, 2)).get(0);

        for (final PixelBuffer tile : new PixelBuffer[] {
                TestImages.filled(4, 4, 1, 1), TestImages.filled(4, 2, 1, 1), TestImages.filled(3, 3, 1, 1) }) {
            try {
                slice.write(tile);
                Assert.fail("tile " + tile + " should not fit " + slice);
            } catch (final ShapeMismatchException e) {
                Assert.assertFalse("rejected tile should not mark slice as written", slice.isWritten());
            }
        }
    }

    @Test(expected = IncompleteResultException.class)
    public void testIncompleteArenaCannotBeRead() {
        final SharedArena arena = new SharedArena(4, 4, 1);
        final List<ArenaSlice> slices = arena.issueSlices(Tiler.tile(4, 4, 1, 2));
        slices.get(0).write(TestImages.filled(4, 2, 1, 1));
        arena.toPixelBuffer();
    }

    @Test
    public void testInvalidRegionLayouts() {
        final List<List<Region>> invalidLayouts = Arrays.asList(
                // overlap
                Arrays.asList(new Region(0, 0, 5, 4, 1), new Region(1, 4, 10, 4, 1)),
                // gap
                Arrays.asList(new Region(0, 0, 4, 4, 1), new Region(1, 5, 10, 4, 1)),
                // not exhaustive
                Arrays.asList(new Region(0, 0, 5, 4, 1)),
                // wrong width
                Arrays.asList(new Region(0, 0, 10, 5, 1)));

        for (final List<Region> regions : invalidLayouts) {
            try {
                new SharedArena(4, 10, 1).issueSlices(regions);
                Assert.fail("slices should not be issued for " + regions);
            } catch (final ShapeMismatchException e) {
                Assert.assertNotNull("exception should have message", e.getMessage());
            }
        }
    }

}
