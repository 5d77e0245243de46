// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.pool;

import sh.vigil.rpc.ChainClient;

/**
 * Creates the client for a chain the first time the pool needs one.
 */
@FunctionalInterface
public interface ChainClientFactory {

    /**
     * Opens a new connection to {@code chainId}.
     *
     * @param chainId the configured chain id
     * @return a connected client; ownership passes to the pool
     * @throws RuntimeException if the connection cannot be established
     */
    ChainClient create(String chainId);
}
