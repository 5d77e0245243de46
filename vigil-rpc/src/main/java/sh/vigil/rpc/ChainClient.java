// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import java.util.List;
import java.util.function.Consumer;

import sh.vigil.core.error.RpcException;
import sh.vigil.core.model.BlockHeader;
import sh.vigil.core.types.Hash;

/**
 * Narrow capability interface over one chain's node connection.
 *
 * <p>
 * This is everything the watch engine needs from a chain: a head stream, a
 * header lookup for walking parent links, and the raw event records of a
 * block.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe. Head
 * callbacks may be invoked on I/O threads and must not be blocked by the
 * consumer.
 *
 * @see WebSocketChainClient
 */
public interface ChainClient extends AutoCloseable {

    /**
     * Subscribes to new best or finalized heads.
     *
     * @param finalized whether to follow finalized heads instead of best heads
     * @param onHead    invoked for each header, in the order the node emits them
     * @param onError   invoked at most once if the subscription fails; no
     *                  headers follow an error
     * @return the live subscription
     * @throws RpcException if the subscription cannot be established
     */
    Subscription subscribeHeads(boolean finalized, Consumer<BlockHeader> onHead, Consumer<Throwable> onError);

    /**
     * Fetches a block header by hash.
     *
     * @param hash the block hash
     * @return the header
     * @throws RpcException if the block is unknown or the request fails
     */
    BlockHeader getHeader(Hash hash);

    /**
     * Queries the raw event records emitted in a block.
     *
     * @param hash the block hash
     * @return records in block order, empty if the block has no events
     * @throws RpcException if the request fails
     */
    List<RawEventRecord> queryBlockEvents(Hash hash);

    /**
     * Releases the underlying connection. Live subscriptions end without an
     * error callback.
     */
    @Override
    void close();
}
