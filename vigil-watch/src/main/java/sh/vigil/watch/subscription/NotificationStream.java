// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.subscription;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.Nullable;

import sh.vigil.core.error.ConnectionException;

/**
 * Turns pushed head notifications into a blocking pull.
 *
 * <p>
 * The multiplexer's dispatch thread writes into an unbounded queue; a single
 * consumer reads with {@link #take()}. {@link #wake()} and {@link #cancel()}
 * may be called from any thread and release a blocked consumer; only
 * {@code cancel()} detaches from the multiplexer.
 *
 * <pre>{@code
 * try (NotificationStream stream = NotificationStream.open(multiplexer)) {
 *     HeadNotification next;
 *     while ((next = stream.take()) != null) {
 *         ...
 *     }
 * }
 * }</pre>
 */
public final class NotificationStream implements HeadListener, AutoCloseable {

    private static final Signal END = new Signal(null, null);

    private final HeadSubscriptionMultiplexer multiplexer;
    private final LinkedBlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean detached = new AtomicBoolean(false);
    private volatile @Nullable ConnectionException failure;

    private NotificationStream(final HeadSubscriptionMultiplexer multiplexer) {
        this.multiplexer = multiplexer;
    }

    /**
     * Creates a stream attached to {@code multiplexer}. Returns without
     * waiting for the subscription; a failure to open it surfaces from
     * {@link #take()}.
     */
    public static NotificationStream open(final HeadSubscriptionMultiplexer multiplexer) {
        final NotificationStream stream = new NotificationStream(multiplexer);
        multiplexer.attach(stream);
        return stream;
    }

    @Override
    public void onHead(final HeadNotification notification) {
        if (!cancelled.get()) {
            queue.add(new Signal(notification, null));
        }
    }

    @Override
    public void onError(final ConnectionException error) {
        queue.add(new Signal(null, error));
    }

    /**
     * Blocks for the next notification.
     *
     * @return the next notification, or null once cancelled
     * @throws ConnectionException  if the subscription failed
     * @throws InterruptedException if the calling thread is interrupted
     */
    public @Nullable HeadNotification take() throws InterruptedException {
        final ConnectionException error = failure;
        if (error != null) {
            throw error;
        }
        if (cancelled.get()) {
            return null;
        }
        final Signal signal = queue.take();
        if (signal.error() != null) {
            failure = signal.error();
            throw signal.error();
        }
        if (signal == END || cancelled.get()) {
            return null;
        }
        return signal.notification();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Number of buffered, not yet taken items. */
    public int pending() {
        return queue.size();
    }

    /**
     * Ends the stream for its consumer without touching the multiplexer:
     * a blocked {@link #take()} returns null promptly, as does every later
     * one. Does no I/O, so it is safe on timer threads.
     */
    public void wake() {
        if (cancelled.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    /**
     * Ends the stream and detaches it from the multiplexer. Safe to call
     * more than once and from any thread.
     */
    public void cancel() {
        wake();
        if (detached.compareAndSet(false, true)) {
            multiplexer.detach(this);
        }
    }

    @Override
    public void close() {
        cancel();
    }

    private record Signal(@Nullable HeadNotification notification, @Nullable ConnectionException error) {
    }
}
