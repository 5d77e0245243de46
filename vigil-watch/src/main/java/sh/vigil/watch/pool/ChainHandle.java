// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.pool;

import java.util.concurrent.atomic.AtomicBoolean;

import sh.vigil.rpc.ChainClient;

/**
 * One holder's reference to a pooled chain connection.
 *
 * <p>
 * Closing the handle releases the reference; closing it again has no effect.
 * Use with try-with-resources:
 *
 * <pre>{@code
 * try (ChainHandle handle = pool.acquire("localnet")) {
 *     BlockHeader header = handle.client().getHeader(hash);
 * }
 * }</pre>
 */
public final class ChainHandle implements AutoCloseable {

    private final ChainConnectionPool pool;
    private final PoolEntry entry;
    private final ChainClient client;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ChainHandle(final ChainConnectionPool pool, final PoolEntry entry, final ChainClient client) {
        this.pool = pool;
        this.entry = entry;
        this.client = client;
    }

    public String chainId() {
        return entry.chainId;
    }

    public ChainClient client() {
        return client;
    }

    public boolean isReleased() {
        return released.get();
    }

    PoolEntry entry() {
        return entry;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(entry);
        }
    }

    @Override
    public String toString() {
        return "ChainHandle[" + entry.chainId + (released.get() ? ", released]" : "]");
    }
}
