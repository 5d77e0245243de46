// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import java.util.List;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.JsonNode;

import sh.vigil.core.error.RpcException;

/**
 * Low-level abstraction for exchanging JSON-RPC messages with a chain node.
 *
 * <p>
 * This interface abstracts the transport from the chain query logic in
 * {@link WebSocketChainClient}. Implementations handle request
 * serialization, response correlation, and subscription notification routing.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @see WebSocketProvider
 */
public interface VigilProvider extends AutoCloseable {

    /**
     * Sends a JSON-RPC request and waits for its response.
     *
     * @param method the JSON-RPC method name
     * @param params the positional parameters
     * @return the JSON-RPC response, which may carry an error object
     * @throws RpcException if the request cannot be delivered or times out
     */
    JsonRpcResponse send(String method, List<?> params);

    /**
     * Opens a server-side subscription.
     *
     * <p>
     * Notifications for one subscription are delivered to {@code onNotification}
     * sequentially and in arrival order. {@code onError} is invoked at most once,
     * when the connection carrying the subscription is lost; no notifications
     * follow it.
     *
     * @param method         the subscribe method (e.g. {@code chain_subscribeNewHeads})
     * @param params         subscribe parameters
     * @param onNotification receives the {@code params.result} tree of each notification
     * @param onError        receives the terminal connection failure
     * @return the subscription id assigned by the node
     * @throws RpcException if the node rejects the subscription
     */
    String subscribe(String method, List<?> params, Consumer<JsonNode> onNotification, Consumer<Throwable> onError);

    /**
     * Cancels a subscription.
     *
     * @param method         the unsubscribe method (e.g. {@code chain_unsubscribeNewHeads})
     * @param subscriptionId the id returned by {@link #subscribe}
     * @return whether the node acknowledged the cancellation
     * @throws RpcException if the request fails
     */
    boolean unsubscribe(String method, String subscriptionId);

    /**
     * Closes the transport. Pending requests fail with {@link RpcException}.
     */
    @Override
    void close();
}
