package org.janelia.tiling.transport;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link OneShotChannel} class.
 */
public class OneShotChannelTest {

    @Test
    public void testSendAndReceive() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        channel.send("value");
        channel.close();
        Assert.assertEquals("invalid value received", "value", channel.receive());
    }

    @Test(expected = WorkerLostException.class)
    public void testCloseWithoutSend() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        channel.close();
        channel.close();
        channel.receive();
    }

    @Test(expected = IllegalStateException.class)
    public void testSecondSend() {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        channel.send("first");
        channel.send("second");
    }

    @Test(expected = IllegalStateException.class)
    public void testSecondReceive() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        channel.send("value");
        channel.receive();
        channel.receive();
    }

    @Test
    public void testReceiveWaitsForSender() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        final Thread sender = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (final InterruptedException e) {
                throw new IllegalStateException(e);
            }
            channel.send("late value");
        });
        sender.start();

        Assert.assertEquals("invalid value received", "late value", channel.receive());
        sender.join();
    }

    @Test
    public void testInterruptedReceiveCanBeRetried() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");

        Thread.currentThread().interrupt();
        try {
            channel.receive();
            Assert.fail("interrupted receive should fail");
        } catch (final InterruptedException e) {
            Assert.assertFalse("interrupt flag should be cleared", Thread.currentThread().isInterrupted());
        }

        channel.send("value");
        Assert.assertEquals("retry should receive value", "value", channel.receive());
    }

    @Test
    public void testPollDoesNotWait() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        Assert.assertNull("poll before send should return nothing", channel.poll());

        channel.send("value");
        Assert.assertEquals("invalid value polled", "value", channel.poll());
    }

    @Test
    public void testReceiveAfterEmptyPoll() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        Assert.assertNull("poll before send should return nothing", channel.poll());

        channel.send("value");
        Assert.assertEquals("receive should still work after empty poll", "value", channel.receive());
    }

    @Test(expected = WorkerLostException.class)
    public void testPollAfterCloseWithoutSend() throws Exception {
        final OneShotChannel<String> channel = new OneShotChannel<>("test");
        channel.close();
        channel.poll();
    }

}
