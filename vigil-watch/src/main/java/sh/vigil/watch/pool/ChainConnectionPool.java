// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.DebugLogger;
import sh.vigil.core.error.ConnectionException;
import sh.vigil.rpc.ChainClient;

/**
 * Refcounted pool of one {@link ChainClient} per chain id.
 *
 * <p>
 * The first {@link #acquire(String)} for a chain creates its client through
 * the {@link ChainClientFactory}; concurrent acquirers wait on the same
 * in-flight creation. When the last handle is released the client is kept
 * for a grace period so that a release immediately followed by a re-acquire
 * does not reconnect.
 *
 * <p>
 * <strong>Thread Safety:</strong> All bookkeeping happens under a single
 * pool lock. Client creation and closing run outside of it. Clients whose
 * grace period elapses are closed on the closer executor, off the
 * scheduler thread.
 */
public final class ChainConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChainConnectionPool.class);

    private final ChainClientFactory factory;
    private final Duration gracePeriod;
    private final ScheduledExecutorService scheduler;
    private final Executor closer;
    private final Object lock = new Object();
    private final Map<String, PoolEntry> entries = new HashMap<>();
    private boolean closed;

    /**
     * @param factory     opens a client for a chain id
     * @param gracePeriod how long an unreferenced client is kept open
     * @param scheduler   times delayed teardowns
     * @param closer      closes clients whose grace period elapsed
     */
    public ChainConnectionPool(
            final ChainClientFactory factory,
            final Duration gracePeriod,
            final ScheduledExecutorService scheduler,
            final Executor closer) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.closer = Objects.requireNonNull(closer, "closer");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
    }

    /**
     * Returns a handle to the shared client for {@code chainId}, creating the
     * client if needed. Cancels a pending teardown.
     *
     * @throws ConnectionException if the client could not be created
     * @throws IllegalStateException if the pool is closed
     */
    public ChainHandle acquire(final String chainId) {
        Objects.requireNonNull(chainId, "chainId");
        final PoolEntry entry;
        boolean creator = false;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("ChainConnectionPool is closed");
            }
            PoolEntry existing = entries.get(chainId);
            if (existing == null) {
                existing = new PoolEntry(chainId);
                entries.put(chainId, existing);
                creator = true;
            }
            entry = existing;
            entry.refs++;
            if (entry.teardown != null) {
                entry.teardown.cancel(false);
                entry.teardown = null;
                DebugLogger.log("[POOL] %s teardown cancelled by re-acquire", chainId);
            }
        }
        if (creator) {
            create(entry);
        }
        final ChainClient client;
        try {
            client = await(entry);
        } catch (ConnectionException e) {
            synchronized (lock) {
                entry.refs--;
            }
            throw e;
        }
        return new ChainHandle(this, entry, client);
    }

    /**
     * Releases {@code handle}. Equivalent to {@link ChainHandle#close()}.
     */
    public void release(final ChainHandle handle) {
        handle.close();
    }

    /**
     * Marks the connection behind {@code handle} as broken. The next acquire
     * for the chain creates a fresh client; the broken one is closed once
     * its last holder releases. The handle itself still has to be released.
     */
    public void invalidate(final ChainHandle handle) {
        final PoolEntry entry = handle.entry();
        boolean closeNow = false;
        synchronized (lock) {
            if (entry.broken) {
                return;
            }
            entry.broken = true;
            if (entries.get(entry.chainId) == entry) {
                entries.remove(entry.chainId);
            }
            if (entry.refs == 0) {
                closeNow = markClosed(entry);
            }
        }
        log.warn("Connection to chain {} invalidated", entry.chainId);
        if (closeNow) {
            closeClient(entry);
        }
    }

    /**
     * Returns the number of unreleased handles for the current connection to
     * {@code chainId}, or 0 when there is none.
     */
    public int refCount(final String chainId) {
        synchronized (lock) {
            final PoolEntry entry = entries.get(chainId);
            return entry == null ? 0 : entry.refs;
        }
    }

    /**
     * Returns whether a connection to {@code chainId} is currently pooled,
     * including one waiting out its grace period.
     */
    public boolean isPooled(final String chainId) {
        synchronized (lock) {
            return entries.containsKey(chainId);
        }
    }

    /**
     * Closes every pooled client. Outstanding handles stay valid objects but
     * their client is closed; further acquires fail.
     */
    @Override
    public void close() {
        final List<PoolEntry> toClose = new ArrayList<>();
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            for (PoolEntry entry : entries.values()) {
                if (entry.teardown != null) {
                    entry.teardown.cancel(false);
                    entry.teardown = null;
                }
                if (markClosed(entry)) {
                    toClose.add(entry);
                }
            }
            entries.clear();
        }
        for (PoolEntry entry : toClose) {
            closeClient(entry);
        }
    }

    void release(final PoolEntry entry) {
        boolean closeNow = false;
        synchronized (lock) {
            entry.refs--;
            if (entry.refs > 0) {
                return;
            }
            if (entry.broken) {
                closeNow = markClosed(entry);
            } else if (!closed && entries.get(entry.chainId) == entry) {
                try {
                    entry.teardown = scheduler.schedule(
                            () -> teardown(entry), gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    log.debug("Scheduler unavailable, closing {} immediately", entry.chainId);
                    entries.remove(entry.chainId);
                    closeNow = markClosed(entry);
                }
            }
        }
        if (closeNow) {
            closeClient(entry);
        }
    }

    private void teardown(final PoolEntry entry) {
        synchronized (lock) {
            if (entry.refs > 0 || entries.get(entry.chainId) != entry) {
                return;
            }
            entries.remove(entry.chainId);
            entry.teardown = null;
            if (!markClosed(entry)) {
                return;
            }
        }
        log.debug("Grace period elapsed, closing connection to {}", entry.chainId);
        try {
            closer.execute(() -> closeClient(entry));
        } catch (RejectedExecutionException e) {
            log.debug("Closer unavailable, closing {} on the timer thread", entry.chainId);
            closeClient(entry);
        }
    }

    private void create(final PoolEntry entry) {
        try {
            final ChainClient client = factory.create(entry.chainId);
            log.debug("Connected to chain {}", entry.chainId);
            entry.client.complete(client);
            final boolean closedMeanwhile;
            synchronized (lock) {
                closedMeanwhile = entry.closed;
            }
            if (closedMeanwhile) {
                closeClient(entry);
            }
        } catch (RuntimeException e) {
            synchronized (lock) {
                if (entries.get(entry.chainId) == entry) {
                    entries.remove(entry.chainId);
                }
                entry.closed = true;
            }
            log.warn("Failed to connect to chain {}: {}", entry.chainId, e.getMessage());
            entry.client.completeExceptionally(e instanceof ConnectionException
                    ? e
                    : new ConnectionException(entry.chainId, "Failed to connect: " + e.getMessage(), e));
        }
    }

    private static ChainClient await(final PoolEntry entry) {
        try {
            return entry.client.join();
        } catch (CompletionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ConnectionException ce) {
                throw ce;
            }
            throw new ConnectionException(entry.chainId, "Failed to connect", cause);
        }
    }

    /** Returns true if the caller is responsible for closing the client. Must hold the lock. */
    private static boolean markClosed(final PoolEntry entry) {
        if (entry.closed) {
            return false;
        }
        entry.closed = true;
        return true;
    }

    private static void closeClient(final PoolEntry entry) {
        final ChainClient client = entry.client.getNow(null);
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("Error closing client for chain {}: {}", entry.chainId, e.getMessage());
        }
    }
}
