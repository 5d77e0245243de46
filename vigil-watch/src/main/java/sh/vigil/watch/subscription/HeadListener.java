// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.subscription;

import sh.vigil.core.error.ConnectionException;

/**
 * Receives heads from a {@link HeadSubscriptionMultiplexer}.
 *
 * <p>
 * Both callbacks run on the multiplexer's dispatch thread and must return
 * quickly.
 */
public interface HeadListener {

    void onHead(HeadNotification notification);

    /**
     * Called once when the underlying subscription fails. Nothing is delivered
     * afterward.
     */
    void onError(ConnectionException error);
}
