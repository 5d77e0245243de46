// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.error.ConnectionException;
import sh.vigil.rpc.WebSocketChainClient;
import sh.vigil.watch.cache.EventCache;
import sh.vigil.watch.journal.EventJournal;
import sh.vigil.watch.pool.ChainClientFactory;
import sh.vigil.watch.pool.ChainConnectionPool;
import sh.vigil.watch.subscription.HeadSubscriptionMultiplexer;
import sh.vigil.watch.subscription.SubscriptionState;

/**
 * Owns all shared watch state of a process: the connection pool, one event
 * cache per chain, and one multiplexer and subscription state per
 * (chain, finalized) pair.
 *
 * <p>
 * Build one registry at startup, hand it to every {@link EventObserver}, and
 * close it at shutdown.
 *
 * <pre>{@code
 * try (SubscriptionRegistry registry = SubscriptionRegistry.create(config)) {
 *     EventObserver observer = new EventObserver(registry);
 *     ...
 * }
 * }</pre>
 */
public final class SubscriptionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final VigilConfig config;
    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService scheduler;
    private final ChainConnectionPool pool;
    private final EventJournal journal;
    private final ConcurrentHashMap<String, EventCache> caches = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<StreamKey, SubscriptionState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<StreamKey, HeadSubscriptionMultiplexer> multiplexers = new ConcurrentHashMap<>();

    /**
     * Creates a registry whose connections are opened by {@code factory}.
     */
    public SubscriptionRegistry(final VigilConfig config, final ChainClientFactory factory) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(factory, "factory");
        this.ioExecutor = VigilExecutors.newIoBoundExecutor();
        this.scheduler = VigilExecutors.newScheduler();
        this.pool = new ChainConnectionPool(factory, config.gracePeriod(), scheduler, ioExecutor);
        this.journal = EventJournal.open(config.journalPath());
    }

    /**
     * Creates a registry connecting to each chain's configured WebSocket URL.
     */
    public static SubscriptionRegistry create(final VigilConfig config) {
        return new SubscriptionRegistry(config, chainId -> {
            final ChainProfile profile = config.profile(chainId);
            if (profile.url() == null) {
                throw new ConnectionException(chainId, "No url configured");
            }
            return WebSocketChainClient.connect(profile.url());
        });
    }

    public VigilConfig config() {
        return config;
    }

    public ChainConnectionPool pool() {
        return pool;
    }

    public ExecutorService ioExecutor() {
        return ioExecutor;
    }

    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    public EventCache cache(final String chainId) {
        return caches.computeIfAbsent(chainId, id -> new EventCache(
                id, pool, config.profile(id).decoder(), config.ageLimit(), ioExecutor));
    }

    public SubscriptionState state(final String chainId, final boolean finalized) {
        return states.computeIfAbsent(new StreamKey(chainId, finalized), k -> new SubscriptionState());
    }

    public HeadSubscriptionMultiplexer multiplexer(final String chainId, final boolean finalized) {
        return multiplexers.computeIfAbsent(new StreamKey(chainId, finalized), k -> new HeadSubscriptionMultiplexer(
                chainId, finalized, pool, cache(chainId), state(chainId, finalized), journal));
    }

    /**
     * Closes every connection and stops the executors. Running watches fail.
     */
    @Override
    public void close() {
        log.debug("Closing subscription registry");
        pool.close();
        ioExecutor.shutdownNow();
        scheduler.shutdownNow();
        journal.close();
    }

    private record StreamKey(String chainId, boolean finalized) {
    }
}
