// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.DebugLogger;
import sh.vigil.core.model.BlockHeader;
import sh.vigil.core.model.CacheEntry;
import sh.vigil.core.model.ChainEvent;
import sh.vigil.core.types.Hash;
import sh.vigil.rpc.ChainClient;
import sh.vigil.rpc.EventDecoder;
import sh.vigil.rpc.RawEventRecord;
import sh.vigil.watch.pool.ChainConnectionPool;
import sh.vigil.watch.pool.ChainHandle;

/**
 * Per-chain cache of decoded block events keyed by block hash.
 *
 * <p>
 * Entries are written once per hash. Misses are fetched through the
 * {@link ChainConnectionPool} on the supplied executor, and concurrent misses
 * for the same hash share a single fetch.
 *
 * <p>
 * The cache keeps roughly {@code ageLimit} blocks behind the best number it
 * has seen. Once it holds more than twice that many entries, an insert evicts
 * every entry older than {@code bestNumber - ageLimit} that is not pinned by
 * a running {@link #walkBack historical walk}.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * EventCache cache = new EventCache("localnet", pool, decoder, 100, ioExecutor);
 *
 * CacheEntry head = cache.load(header).join();
 * List<ChainEvent> recent = cache.getHistorical(header.hash(), 10);
 * }</pre>
 */
public final class EventCache {

    private static final Logger log = LoggerFactory.getLogger(EventCache.class);

    private final String chainId;
    private final ChainConnectionPool pool;
    private final EventDecoder decoder;
    private final int ageLimit;
    private final Executor fetchExecutor;
    private final ConcurrentHashMap<Hash, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Hash, CompletableFuture<CacheEntry>> inflight = new ConcurrentHashMap<>();
    /** Guarded by itself; also serializes eviction passes. */
    private final Map<Hash, Integer> pins = new HashMap<>();
    private final AtomicLong bestNumber = new AtomicLong(-1);

    /**
     * @param chainId       chain whose blocks are cached
     * @param pool          source of connections for misses
     * @param decoder       turns raw records into events
     * @param ageLimit      number of blocks kept behind the best block
     * @param fetchExecutor runs fetches for misses
     */
    public EventCache(
            final String chainId,
            final ChainConnectionPool pool,
            final EventDecoder decoder,
            final int ageLimit,
            final Executor fetchExecutor) {
        this.chainId = Objects.requireNonNull(chainId, "chainId");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
        if (ageLimit <= 0) {
            throw new IllegalArgumentException("ageLimit must be positive, got: " + ageLimit);
        }
        this.ageLimit = ageLimit;
    }

    public String chainId() {
        return chainId;
    }

    public int ageLimit() {
        return ageLimit;
    }

    /** Highest block number inserted so far, or -1 when empty. */
    public long bestNumber() {
        return bestNumber.get();
    }

    public int size() {
        return entries.size();
    }

    public Optional<List<ChainEvent>> get(final Hash hash) {
        return entry(hash).map(CacheEntry::events);
    }

    public Optional<CacheEntry> entry(final Hash hash) {
        return Optional.ofNullable(entries.get(hash));
    }

    public boolean isPinned(final Hash hash) {
        synchronized (pins) {
            return pins.containsKey(hash);
        }
    }

    /**
     * Stores the events of a block. A second insert for the same hash keeps
     * the first entry.
     *
     * @return the entry now stored for the block
     */
    public CacheEntry put(final BlockHeader header, final List<ChainEvent> events) {
        final CacheEntry entry = new CacheEntry(header, events);
        final CacheEntry existing = entries.putIfAbsent(header.hash(), entry);
        if (existing != null) {
            return existing;
        }
        bestNumber.accumulateAndGet(header.number(), Math::max);
        evictIfNeeded();
        return entry;
    }

    /**
     * Returns the entry for a block whose header is already known, querying
     * and decoding its events on a miss.
     */
    public CompletableFuture<CacheEntry> load(final BlockHeader header) {
        return load(header.hash(), header);
    }

    /**
     * Returns the entry for {@code hash}, fetching its header and events on a
     * miss.
     */
    public CompletableFuture<CacheEntry> fetch(final Hash hash) {
        return load(hash, null);
    }

    /**
     * Events of up to {@code depth} ancestors of {@code startHash}, oldest
     * block first. The start block itself is excluded and the walk stops at
     * block 0.
     */
    public List<ChainEvent> getHistorical(final Hash startHash, final int depth) {
        return getHistorical(startHash, depth, null);
    }

    /**
     * Like {@link #getHistorical(Hash, int)} but gives up as soon as
     * {@code interrupt} completes.
     *
     * @throws CancellationException if interrupted
     */
    public List<ChainEvent> getHistorical(
            final Hash startHash, final int depth, final @Nullable CompletableFuture<?> interrupt) {
        final List<ChainEvent> events = new ArrayList<>();
        for (CacheEntry entry : walkBack(startHash, depth, interrupt)) {
            events.addAll(entry.events());
        }
        return events;
    }

    /**
     * Walks parent links backward from {@code startHash}, returning up to
     * {@code depth} ancestor entries, oldest first. Every visited block stays
     * pinned until the walk returns. A depth above the age limit is clamped.
     *
     * @throws CancellationException if {@code interrupt} completes first
     */
    public List<CacheEntry> walkBack(
            final Hash startHash, final int depth, final @Nullable CompletableFuture<?> interrupt) {
        Objects.requireNonNull(startHash, "startHash");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative, got: " + depth);
        }
        int effectiveDepth = depth;
        if (depth > ageLimit) {
            log.warn("Historical depth {} exceeds age limit {} on {}, clamping to {}",
                    depth, ageLimit, chainId, ageLimit);
            effectiveDepth = ageLimit;
        }
        final List<CacheEntry> collected = new ArrayList<>(effectiveDepth);
        if (effectiveDepth == 0) {
            return collected;
        }

        final List<Hash> pinned = new ArrayList<>();
        try {
            pin(startHash);
            pinned.add(startHash);
            CacheEntry current = await(fetch(startHash), interrupt);
            while (collected.size() < effectiveDepth && current.number() > 0) {
                checkInterrupt(interrupt);
                final Hash parent = current.header().parentHash();
                pin(parent);
                pinned.add(parent);
                current = await(fetch(parent), interrupt);
                collected.add(current);
            }
        } finally {
            pinned.forEach(this::unpin);
        }
        Collections.reverse(collected);
        DebugLogger.logWatch("[HISTORY] %s walked %d blocks back from %s", chainId, collected.size(),
                startHash.abbreviated());
        return collected;
    }

    private CompletableFuture<CacheEntry> load(final Hash hash, final @Nullable BlockHeader knownHeader) {
        final CacheEntry cached = entries.get(hash);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        final CompletableFuture<CacheEntry> promise = new CompletableFuture<>();
        final CompletableFuture<CacheEntry> existing = inflight.putIfAbsent(hash, promise);
        if (existing != null) {
            return existing;
        }
        // A fetch may have finished between the lookup and the claim
        final CacheEntry landed = entries.get(hash);
        if (landed != null) {
            inflight.remove(hash, promise);
            promise.complete(landed);
            return promise;
        }
        try {
            fetchExecutor.execute(() -> {
                try {
                    final CacheEntry entry = fetchFromChain(hash, knownHeader);
                    inflight.remove(hash, promise);
                    promise.complete(entry);
                } catch (RuntimeException e) {
                    inflight.remove(hash, promise);
                    promise.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            inflight.remove(hash, promise);
            promise.completeExceptionally(e);
        }
        return promise;
    }

    private CacheEntry fetchFromChain(final Hash hash, final @Nullable BlockHeader knownHeader) {
        try (ChainHandle handle = pool.acquire(chainId)) {
            final ChainClient client = handle.client();
            final BlockHeader header = knownHeader != null ? knownHeader : client.getHeader(hash);
            final List<RawEventRecord> records = client.queryBlockEvents(hash);
            final List<ChainEvent> events = new ArrayList<>(records.size());
            for (RawEventRecord record : records) {
                events.add(decoder.decode(header, record));
            }
            DebugLogger.logWatch("[CACHE] %s fetched #%d %s (%d events)", chainId, header.number(),
                    hash.abbreviated(), events.size());
            return put(header, events);
        }
    }

    private void evictIfNeeded() {
        if (entries.size() <= 2L * ageLimit) {
            return;
        }
        final long threshold = bestNumber.get() - ageLimit;
        int evicted = 0;
        synchronized (pins) {
            final Iterator<Map.Entry<Hash, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                final Map.Entry<Hash, CacheEntry> e = it.next();
                if (e.getValue().number() < threshold && !pins.containsKey(e.getKey())) {
                    it.remove();
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} entries below #{} from {} cache", evicted, threshold, chainId);
        }
    }

    private void pin(final Hash hash) {
        synchronized (pins) {
            pins.merge(hash, 1, Integer::sum);
        }
    }

    private void unpin(final Hash hash) {
        synchronized (pins) {
            pins.computeIfPresent(hash, (h, count) -> count == 1 ? null : count - 1);
        }
    }

    private static void checkInterrupt(final @Nullable CompletableFuture<?> interrupt) {
        if (interrupt != null && interrupt.isDone()) {
            throw new CancellationException("Historical walk interrupted");
        }
    }

    /**
     * Waits for {@code future} or {@code interrupt}, whichever completes
     * first. A completed fetch wins over a simultaneous interrupt.
     */
    private static CacheEntry await(
            final CompletableFuture<CacheEntry> future, final @Nullable CompletableFuture<?> interrupt) {
        if (interrupt != null) {
            CompletableFuture.anyOf(future, interrupt).handle((r, e) -> null).join();
            if (!future.isDone()) {
                throw new CancellationException("Historical walk interrupted");
            }
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
