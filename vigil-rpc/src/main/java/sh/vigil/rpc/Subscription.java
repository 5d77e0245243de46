// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

/**
 * Represents an active subscription to a real-time notification stream.
 */
public interface Subscription {
    /**
     * Returns the unique identifier for this subscription.
     *
     * @return the subscription ID
     */
    String id();

    /**
     * Unsubscribes from the notification stream.
     */
    void unsubscribe();
}
