// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the connection to a chain, or a head subscription riding on it,
 * fails.
 *
 * <p>
 * Delivered to every watcher attached to the affected (chain, finalized)
 * subscription. A subsequent watch re-establishes the connection.
 */
public final class ConnectionException extends VigilException {

    private final String chainId;

    public ConnectionException(final String chainId, final String message) {
        this(chainId, message, null);
    }

    public ConnectionException(final String chainId, final String message, final @Nullable Throwable cause) {
        super("[" + chainId + "] " + message, cause);
        this.chainId = chainId;
    }

    public String chainId() {
        return chainId;
    }
}
