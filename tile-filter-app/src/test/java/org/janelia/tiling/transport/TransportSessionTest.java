package org.janelia.tiling.transport;

import java.util.ArrayList;
import java.util.List;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.Region;
import org.janelia.tiling.image.ShapeMismatchException;
import org.janelia.tiling.image.TestImages;
import org.janelia.tiling.image.Tiler;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ChannelTransport} and {@link SharedArenaTransport} sessions.
 */
public class TransportSessionTest {

    @Test
    public void testDeliveredTilesAreAssembled() throws Exception {
        final PixelBuffer source = TestImages.random(8, 12, 3, 29);
        final List<Region> regions = Tiler.tile(source, 3);

        for (final TransportKind kind : TransportKind.values()) {
            final TransportSession session = kind.newTransport().open(source, regions);
            Assert.assertEquals("invalid session kind", kind, session.getKind());

            for (final Region region : regions) {
                final RegionOutlet outlet = session.outletFor(region);
                outlet.deliver(source.copyRegion(region));
                outlet.close();
            }

            final List<WorkResult> results = new ArrayList<>();
            for (final Region region : regions) {
                final WorkResult result = session.receive(region);
                Assert.assertTrue(kind + " result for " + region + " should be successful", result.isSuccessful());
                Assert.assertEquals(kind + " result should be written in place only for shared arena",
                                    kind == TransportKind.SHARED_ARENA, result.isWrittenInPlace());
                results.add(result);
            }

            Assert.assertTrue(kind + " output should match source", source.contentEquals(session.assemble(results)));
        }
    }

    @Test
    public void testClosedOutletReportsLostWorker() throws Exception {
        for (final TransportKind kind : TransportKind.values()) {
            final PixelBuffer source = TestImages.random(4, 4, 1, 2);
            final List<Region> regions = Tiler.tile(source, 2);
            final TransportSession session = kind.newTransport().open(source, regions);

            session.outletFor(regions.get(1)).close();

            final WorkResult result = session.receive(regions.get(1));
            Assert.assertFalse(kind + " result should not be successful", result.isSuccessful());
            Assert.assertEquals(kind + " invalid failure kind", FailureKind.WORKER_LOST, result.getFailureKind());
        }
    }

    @Test
    public void testPollTakesOnlyFinishedResults() throws Exception {
        for (final TransportKind kind : TransportKind.values()) {
            final PixelBuffer source = TestImages.random(4, 6, 1, 3);
            final List<Region> regions = Tiler.tile(source, 3);
            final TransportSession session = kind.newTransport().open(source, regions);

            Assert.assertNull(kind + " poll should not wait for a running worker", session.poll(regions.get(0)));

            final RegionOutlet outlet = session.outletFor(regions.get(0));
            outlet.deliver(source.copyRegion(regions.get(0)));
            outlet.close();
            session.outletFor(regions.get(2)).close();

            Assert.assertTrue(kind + " delivered result should be polled",
                              session.poll(regions.get(0)).isSuccessful());
            Assert.assertEquals(kind + " closed outlet should be polled as lost worker",
                                FailureKind.WORKER_LOST, session.poll(regions.get(2)).getFailureKind());
        }
    }

    @Test
    public void testFailureIsReceived() throws Exception {
        final PixelBuffer source = TestImages.random(4, 4, 1, 2);
        final List<Region> regions = Tiler.tile(source, 2);
        final TransportSession session = new ChannelTransport().open(source, regions);

        final RegionOutlet outlet = session.outletFor(regions.get(0));
        final IllegalStateException cause = new IllegalStateException("test");
        outlet.fail(FailureKind.FILTER_FAILURE, cause);
        outlet.close();

        final WorkResult result = session.receive(regions.get(0));
        Assert.assertEquals("invalid failure kind", FailureKind.FILTER_FAILURE, result.getFailureKind());
        Assert.assertSame("invalid failure", cause, result.getFailure());
    }

    @Test(expected = IllegalStateException.class)
    public void testOutletIsIssuedOnce() {
        final PixelBuffer source = TestImages.random(4, 4, 1, 2);
        final List<Region> regions = Tiler.tile(source, 2);
        final TransportSession session = new ChannelTransport().open(source, regions);
        session.outletFor(regions.get(0));
        session.outletFor(regions.get(0));
    }

    @Test
    public void testArenaRejectsTileWithWrongHeight() throws Exception {
        final PixelBuffer source = TestImages.random(4, 6, 1, 2);
        final List<Region> regions = Tiler.tile(source, 2);
        final TransportSession session = new SharedArenaTransport().open(source, regions);

        final RegionOutlet outlet = session.outletFor(regions.get(0));
        try {
            outlet.deliver(TestImages.filled(4, 2, 1, 0));
            Assert.fail("tile with wrong height should be rejected");
        } catch (final ShapeMismatchException e) {
            outlet.fail(FailureKind.DELIVERY_FAILURE, e);
        }
        outlet.close();

        final WorkResult result = session.receive(regions.get(0));
        Assert.assertEquals("invalid failure kind", FailureKind.DELIVERY_FAILURE, result.getFailureKind());
    }

}
