// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors the watch engine runs on.
 *
 * <ul>
 * <li><strong>I/O executor</strong>: watcher tasks and block fetches. These
 * spend nearly all their time blocked on the network or on a notification
 * queue, so the pool grows on demand.</li>
 * <li><strong>Scheduler</strong>: watch timeouts and connection teardown
 * after the grace period.</li>
 * <li><strong>Dispatch executor</strong>: one per live head subscription,
 * giving that subscription a single writer and in-order delivery.</li>
 * </ul>
 *
 * <p>
 * All threads are daemons so a forgotten registry never keeps a test JVM
 * alive.
 */
public final class VigilExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);
    private static final AtomicInteger TIMER_THREAD_ID = new AtomicInteger(0);

    private VigilExecutors() {
        // Utility class
    }

    /**
     * Creates a cached pool for blocking I/O-bound work. Threads are named
     * {@code vigil-io-N}.
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(daemon(IO_THREAD_ID, "vigil-io-"));
    }

    /**
     * Creates a single-threaded scheduler for timers. Cancelled tasks are
     * removed from the queue immediately.
     */
    public static ScheduledExecutorService newScheduler() {
        ScheduledThreadPoolExecutor scheduler =
                new ScheduledThreadPoolExecutor(1, daemon(TIMER_THREAD_ID, "vigil-timer-"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Creates a single-threaded executor with a fixed thread name.
     *
     * @param name the thread name, e.g. {@code vigil-heads-localnet-best}
     */
    public static ExecutorService newDispatchExecutor(final String name) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    private static ThreadFactory daemon(final AtomicInteger counter, final String prefix) {
        return r -> {
            // Mask off sign bit to keep ids non-negative after overflow
            Thread t = new Thread(r, prefix + (counter.getAndIncrement() & 0x7FFFFFFF));
            t.setDaemon(true);
            return t;
        };
    }
}
