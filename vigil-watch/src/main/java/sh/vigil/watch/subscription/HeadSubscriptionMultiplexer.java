// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.subscription;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.DebugLogger;
import sh.vigil.core.error.ConnectionException;
import sh.vigil.core.model.BlockHeader;
import sh.vigil.core.model.CacheEntry;
import sh.vigil.rpc.Subscription;
import sh.vigil.watch.VigilExecutors;
import sh.vigil.watch.cache.EventCache;
import sh.vigil.watch.journal.EventJournal;
import sh.vigil.watch.pool.ChainConnectionPool;
import sh.vigil.watch.pool.ChainHandle;

/**
 * Shares one head subscription of a (chain, finalized) pair between any
 * number of {@link HeadListener}s.
 *
 * <p>
 * The subscription is opened when the first listener attaches and closed
 * when the last one detaches. While open, the multiplexer holds a
 * {@link ChainHandle} from the pool and a dedicated dispatch thread. For each
 * head, that thread:
 * <ol>
 * <li>loads the block's events through the {@link EventCache}</li>
 * <li>advances the {@link SubscriptionState} pointer</li>
 * <li>appends the block to the {@link EventJournal}</li>
 * <li>publishes a {@link HeadNotification} to every listener</li>
 * </ol>
 *
 * <p>
 * A listener attaching to a live subscription first receives the most recent
 * notification, then every following one. If the subscription fails, every
 * attached listener gets a {@link ConnectionException}, the pooled connection
 * is invalidated, and the next attach starts over.
 */
public final class HeadSubscriptionMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(HeadSubscriptionMultiplexer.class);

    private final String chainId;
    private final boolean finalized;
    private final ChainConnectionPool pool;
    private final EventCache cache;
    private final SubscriptionState state;
    private final EventJournal journal;
    private final Object lock = new Object();
    private @Nullable Generation generation;

    public HeadSubscriptionMultiplexer(
            final String chainId,
            final boolean finalized,
            final ChainConnectionPool pool,
            final EventCache cache,
            final SubscriptionState state,
            final EventJournal journal) {
        this.chainId = Objects.requireNonNull(chainId, "chainId");
        this.finalized = finalized;
        this.pool = Objects.requireNonNull(pool, "pool");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.state = Objects.requireNonNull(state, "state");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    public String chainId() {
        return chainId;
    }

    public boolean isFinalized() {
        return finalized;
    }

    public SubscriptionState state() {
        return state;
    }

    /** Whether a low-level subscription is currently open. */
    public boolean isActive() {
        synchronized (lock) {
            return generation != null;
        }
    }

    /**
     * Attaches {@code listener}, opening the subscription if it is the first.
     * Attaching the same listener twice has no effect.
     *
     * <p>
     * Never blocks on the network: the connection and the low-level
     * subscription are opened on the dispatch thread. If opening fails the
     * listener receives {@link HeadListener#onError(ConnectionException)}.
     */
    public void attach(final HeadListener listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (lock) {
            Generation g = generation;
            if (g == null) {
                g = new Generation(VigilExecutors.newDispatchExecutor(
                        "vigil-heads-" + chainId + (finalized ? "-finalized" : "-best")));
                final Generation opening = g;
                g.execute(() -> open(opening));
                generation = g;
            }
            if (!g.attached.add(listener)) {
                return;
            }
            final Generation gen = g;
            gen.execute(() -> gen.register(listener));
            state.listenerAdded();
        }
    }

    /**
     * Detaches {@code listener}, closing the subscription if it was the last.
     * Detaching an unknown listener, or one whose subscription already failed,
     * has no effect. The unsubscribe and handle release run on the dispatch
     * thread, after any open still in progress.
     */
    public void detach(final HeadListener listener) {
        Generation closing = null;
        synchronized (lock) {
            final Generation g = generation;
            if (g == null || !g.attached.remove(listener)) {
                return;
            }
            state.listenersRemoved(1);
            if (g.attached.isEmpty()) {
                generation = null;
                g.closed = true;
                closing = g;
            } else {
                g.execute(() -> g.listeners.remove(listener));
            }
        }
        if (closing != null) {
            log.debug("Last listener detached from {}, closing subscription", describe());
            final Generation g = closing;
            g.execute(() -> teardown(g, false));
        }
    }

    /** Runs on the dispatch thread. */
    private void open(final Generation g) {
        if (g.closed) {
            return;
        }
        final ChainHandle handle;
        try {
            handle = pool.acquire(chainId);
        } catch (RuntimeException e) {
            log.warn("Failed to open {}: {}", describe(), e.getMessage());
            fail(g, toConnectionException(e));
            return;
        }
        g.handle = handle;
        if (g.closed) {
            return;
        }
        try {
            g.subscription = handle.client().subscribeHeads(
                    finalized,
                    header -> {
                        if (!g.closed) {
                            g.execute(() -> process(g, header));
                        }
                    },
                    error -> g.execute(() -> fail(g, toConnectionException(error))));
        } catch (RuntimeException e) {
            log.warn("Failed to open {}: {}", describe(), e.getMessage());
            fail(g, toConnectionException(e));
            return;
        }
        log.debug("Opened {}", describe());
    }

    private void process(final Generation g, final BlockHeader header) {
        if (g.closed) {
            return;
        }
        final CacheEntry entry;
        try {
            entry = cache.load(header).join();
        } catch (CompletionException | CancellationException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(g, new ConnectionException(chainId,
                    "Failed to load events for head #" + header.number() + ": " + cause.getMessage(), cause));
            return;
        }
        if (g.closed) {
            return;
        }
        state.advance(header);
        journal.append(chainId, finalized, entry);
        final HeadNotification notification = new HeadNotification(entry.header(), entry.events());
        g.latest = notification;
        DebugLogger.logWatch("[DISPATCH] %s #%d %s events=%d listeners=%d", describe(), header.number(),
                header.hash().abbreviated(), entry.events().size(), g.listeners.size());
        for (HeadListener listener : List.copyOf(g.listeners)) {
            deliver(listener, notification);
        }
    }

    private void fail(final Generation g, final ConnectionException error) {
        synchronized (lock) {
            if (g.closed) {
                return;
            }
            g.closed = true;
            g.failure = error;
            if (generation == g) {
                generation = null;
            }
            state.listenersRemoved(g.attached.size());
            g.attached.clear();
        }
        log.warn("{} failed: {}", describe(), error.getMessage());
        for (HeadListener listener : g.listeners) {
            notifyError(listener, error);
        }
        g.listeners.clear();
        teardown(g, true);
    }

    /** Runs on the dispatch thread; a generation still opening is closed once its open returns. */
    private void teardown(final Generation g, final boolean invalidate) {
        final Subscription subscription = g.subscription;
        g.subscription = null;
        if (subscription != null) {
            try {
                subscription.unsubscribe();
            } catch (RuntimeException e) {
                log.debug("Unsubscribe from {} failed: {}", describe(), e.getMessage());
            }
        }
        final ChainHandle handle = g.handle;
        g.handle = null;
        if (handle != null) {
            if (invalidate) {
                pool.invalidate(handle);
            }
            handle.close();
        }
        g.dispatch.shutdown();
    }

    private ConnectionException toConnectionException(final Throwable error) {
        if (error instanceof ConnectionException ce) {
            return ce;
        }
        return new ConnectionException(chainId,
                (finalized ? "Finalized" : "Best") + " head subscription failed: " + error.getMessage(), error);
    }

    private void deliver(final HeadListener listener, final HeadNotification notification) {
        try {
            listener.onHead(notification);
        } catch (RuntimeException e) {
            log.error("Listener {} failed on head #{}", listener, notification.header().number(), e);
        }
    }

    private void notifyError(final HeadListener listener, final ConnectionException error) {
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            log.error("Listener {} failed handling subscription error", listener, e);
        }
    }

    private String describe() {
        return (finalized ? "finalized" : "best") + " head subscription on " + chainId;
    }

    /**
     * One subscription, from open to teardown. {@code handle},
     * {@code subscription}, {@code listeners} and {@code latest} are confined
     * to the dispatch thread; {@code attached} is guarded by the multiplexer
     * lock.
     */
    private final class Generation {
        final ExecutorService dispatch;
        final Set<HeadListener> attached = new LinkedHashSet<>();
        final List<HeadListener> listeners = new ArrayList<>();
        @Nullable ChainHandle handle;
        @Nullable Subscription subscription;
        @Nullable HeadNotification latest;
        volatile boolean closed;
        volatile @Nullable ConnectionException failure;

        Generation(final ExecutorService dispatch) {
            this.dispatch = dispatch;
        }

        void register(final HeadListener listener) {
            final ConnectionException error = failure;
            if (error != null) {
                notifyError(listener, error);
                return;
            }
            if (closed) {
                return;
            }
            listeners.add(listener);
            if (latest != null) {
                deliver(listener, latest);
            }
        }

        void execute(final Runnable task) {
            try {
                dispatch.execute(task);
            } catch (RejectedExecutionException e) {
                log.debug("Dispatch for {} already stopped, dropping task", describe());
            }
        }
    }
}
