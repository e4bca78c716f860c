package org.janelia.tiling.transport;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single value hand-off between one sender and one receiver.
 *
 * The sender either sends exactly one value or closes the channel without one.
 * Closing after a send has no effect.  The receiver receives exactly once and
 * sees a {@link WorkerLostException} if the channel was closed empty.
 *
 * @param <T> type of the transferred value.
 */
public class OneShotChannel<T> {

    private final String name;
    private final BlockingQueue<Envelope<T>> queue;
    private final AtomicBoolean sendingEndUsed;
    private final AtomicBoolean receivingEndUsed;

    public OneShotChannel(final String name) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(1);
        this.sendingEndUsed = new AtomicBoolean(false);
        this.receivingEndUsed = new AtomicBoolean(false);
    }

    /**
     * @throws IllegalStateException
     *   if a value has already been sent or the channel has already been closed.
     */
    public void send(final T value)
            throws IllegalStateException {
        if (value == null) {
            throw new IllegalArgumentException("cannot send null value on " + this);
        }
        if (! sendingEndUsed.compareAndSet(false, true)) {
            throw new IllegalStateException(this + " has already been used by its sender");
        }
        queue.add(new Envelope<>(value));
    }

    /**
     * Closes the sending end.  Receivers of a channel closed before any send see a {@link WorkerLostException}.
     */
    public void close() {
        if (sendingEndUsed.compareAndSet(false, true)) {
            queue.add(new Envelope<>(null));
        }
    }

    /**
     * Blocks until the sender sends or closes.
     *
     * @return the sent value.
     *
     * @throws WorkerLostException
     *   if the channel was closed without a value.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting.
     *
     * @throws IllegalStateException
     *   if this channel has already been received from.
     */
    public T receive()
            throws WorkerLostException, InterruptedException, IllegalStateException {
        if (! receivingEndUsed.compareAndSet(false, true)) {
            throw new IllegalStateException(this + " has already been received from");
        }
        final Envelope<T> envelope;
        try {
            envelope = queue.take();
        } catch (final InterruptedException e) {
            // nothing was taken, so allow a later retry
            receivingEndUsed.set(false);
            throw e;
        }
        if (envelope.value == null) {
            throw new WorkerLostException(this + " was closed without a value");
        }
        return envelope.value;
    }

    /**
     * Takes the value without waiting.  A poll that finds nothing leaves the receiving end unused.
     *
     * @return the sent value, or null if the sender has neither sent nor closed yet.
     *
     * @throws WorkerLostException
     *   if the channel was closed without a value.
     *
     * @throws IllegalStateException
     *   if this channel has already been received from.
     */
    public T poll()
            throws WorkerLostException, IllegalStateException {
        if (! receivingEndUsed.compareAndSet(false, true)) {
            throw new IllegalStateException(this + " has already been received from");
        }
        final Envelope<T> envelope = queue.poll();
        if (envelope == null) {
            receivingEndUsed.set(false);
            return null;
        }
        if (envelope.value == null) {
            throw new WorkerLostException(this + " was closed without a value");
        }
        return envelope.value;
    }

    @Override
    public String toString() {
        return "channel for " + name;
    }

    private static class Envelope<T> {
        private final T value;

        private Envelope(final T value) {
            this.value = value;
        }
    }
}
