// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.pool;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

import org.jspecify.annotations.Nullable;

import sh.vigil.rpc.ChainClient;

/**
 * Bookkeeping for one pooled connection. Mutable fields are guarded by the
 * owning pool's lock.
 */
final class PoolEntry {

    final String chainId;
    /** Completed once by the acquirer that created the entry. */
    final CompletableFuture<ChainClient> client = new CompletableFuture<>();
    int refs;
    boolean broken;
    boolean closed;
    @Nullable ScheduledFuture<?> teardown;

    PoolEntry(final String chainId) {
        this.chainId = chainId;
    }
}
