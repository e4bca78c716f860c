package org.janelia.tiling.engine;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CancellationController} and {@link InterruptHook} classes.
 */
public class CancellationControllerTest {

    @Test
    public void testOnlyFirstCancelHasEffect() {
        final CancellationController controller = new CancellationController();

        Assert.assertFalse("new controller should not be cancelled", controller.isCancelled());
        Assert.assertFalse("checkpoint should pass", controller.checkpoint("start"));
        Assert.assertNull("new controller should not have reason", controller.getReason());

        Assert.assertTrue("first cancel should set flag", controller.cancel("first"));
        final long cancelTime = controller.getCancelTime();
        Assert.assertFalse("second cancel should not set flag", controller.cancel("second"));

        Assert.assertTrue("controller should be cancelled", controller.isCancelled());
        Assert.assertTrue("checkpoint should observe cancellation", controller.checkpoint("after cancel"));
        Assert.assertTrue("later checkpoints should also observe cancellation", controller.checkpoint("later"));
        Assert.assertEquals("reason should come from first cancel", "first", controller.getReason());
        Assert.assertEquals("cancel time should not change", cancelTime, controller.getCancelTime());
    }

    @Test
    public void testHookRequestsCancellation() {
        final CancellationController controller = new CancellationController();
        try (final InterruptHook hook = controller.installInterruptHook(50)) {
            Assert.assertFalse("work should not be finished yet", hook.isWorkFinished());
            hook.run();
            Assert.assertTrue("hook should cancel", controller.isCancelled());
        }
    }

    @Test
    public void testClosedHookDoesNothing() {
        final CancellationController controller = new CancellationController();
        final InterruptHook hook = controller.installInterruptHook(5000);
        hook.close();
        hook.close();

        Assert.assertTrue("work should be finished", hook.isWorkFinished());
        hook.run();
        Assert.assertFalse("closed hook should not cancel", controller.isCancelled());
    }

}
