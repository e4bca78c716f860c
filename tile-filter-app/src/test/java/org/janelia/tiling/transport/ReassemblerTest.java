package org.janelia.tiling.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.image.ShapeMismatchException;
import org.janelia.tiling.image.TestImages;
import org.janelia.tiling.image.Tiler;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Reassembler} class.
 */
public class ReassemblerTest {

    @Test
    public void testCombiningUnfilteredTilesRestoresSource() {
        final Reassembler reassembler = new Reassembler();
        final Random random = new Random(31);
        for (final int channels : new int[] { 1, 3 }) {
            final PixelBuffer source = TestImages.random(13, 37, channels, 19);
            for (int count = 1; count <= source.getHeight(); count++) {
                final List<Region> regions = Tiler.tile(source, count);
                final List<WorkResult> results = copyResults(source, regions);
                Collections.shuffle(results, random);

                final PixelBuffer combined = reassembler.combine(regions, results, 13, channels);

                Assert.assertTrue("combined buffer should match source for " + count + " regions and " +
                                  channels + " channel(s)",
                                  source.contentEquals(combined));
            }
        }
    }

    @Test(expected = IncompleteResultException.class)
    public void testMissingResult() {
        final PixelBuffer source = TestImages.random(5, 10, 1, 1);
        final List<Region> regions = Tiler.tile(source, 3);
        final List<WorkResult> results = copyResults(source, regions);
        results.remove(1);
        new Reassembler().combine(regions, results, 5, 1);
    }

    @Test(expected = IncompleteResultException.class)
    public void testFailedResult() {
        final PixelBuffer source = TestImages.random(5, 10, 1, 1);
        final List<Region> regions = Tiler.tile(source, 3);
        final List<WorkResult> results = copyResults(source, regions);
        results.set(2, WorkResult.failed(regions.get(2), FailureKind.FILTER_FAILURE, null));
        new Reassembler().combine(regions, results, 5, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateResult() {
        final PixelBuffer source = TestImages.random(5, 10, 1, 1);
        final List<Region> regions = Tiler.tile(source, 2);
        final List<WorkResult> results = copyResults(source, regions);
        results.set(1, results.get(0));
        new Reassembler().combine(regions, results, 5, 1);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testTileWithWrongWidth() {
        final PixelBuffer source = TestImages.random(5, 10, 1, 1);
        final List<Region> regions = Tiler.tile(source, 2);
        final List<WorkResult> results = copyResults(source, regions);
        results.set(1, WorkResult.withPixels(regions.get(1), TestImages.filled(4, 5, 1, 0)));
        new Reassembler().combine(regions, results, 5, 1);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testTileWithWrongHeight() {
        final PixelBuffer source = TestImages.random(5, 10, 1, 1);
        final List<Region> regions = Tiler.tile(source, 2);
        final List<WorkResult> results = copyResults(source, regions);
        results.set(0, WorkResult.withPixels(regions.get(0), TestImages.filled(5, 6, 1, 0)));
        new Reassembler().combine(regions, results, 5, 1);
    }

    @Test
    public void testFromArena() {
        final PixelBuffer source = TestImages.random(6, 8, 3, 23);
        final List<Region> regions = Tiler.tile(source, 3);
        final SharedArena arena = new SharedArena(6, 8, 3);
        final List<ArenaSlice> slices = arena.issueSlices(regions);

        final List<WorkResult> tokens = new ArrayList<>();
        for (int i = 0; i < regions.size(); i++) {
            slices.get(i).write(source.copyRegion(regions.get(i)));
            tokens.add(0, WorkResult.completedInPlace(regions.get(i)));
        }

        final PixelBuffer output = new Reassembler().fromArena(arena, regions, tokens);
        Assert.assertTrue("arena output should match source", source.contentEquals(output));
    }

    @Test(expected = IncompleteResultException.class)
    public void testFromArenaWithPixelResult() {
        final PixelBuffer source = TestImages.random(6, 8, 1, 23);
        final List<Region> regions = Tiler.tile(source, 2);
        final SharedArena arena = new SharedArena(6, 8, 1);
        arena.issueSlices(regions);
        new Reassembler().fromArena(arena, regions, copyResults(source, regions));
    }

    private static List<WorkResult> copyResults(final PixelBuffer source,
                                                final List<Region> regions) {
        final List<WorkResult> results = new ArrayList<>();
        for (final Region region : regions) {
            results.add(WorkResult.withPixels(region, source.copyRegion(region)));
        }
        return results;
    }

}
