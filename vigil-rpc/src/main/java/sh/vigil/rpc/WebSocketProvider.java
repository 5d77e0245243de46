// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import static sh.vigil.rpc.internal.RpcUtils.MAPPER;

import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.DebugLogger;
import sh.vigil.core.LogSanitizer;
import sh.vigil.core.error.RpcException;
import sh.vigil.rpc.internal.RpcUtils;

/**
 * JSON-RPC 2.0 provider over a Netty WebSocket connection.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Requests are correlated
 * to responses through a {@link ConcurrentHashMap} keyed by request id.
 *
 * <p><b>Subscriptions:</b> Notifications are recognised by a
 * {@code params.subscription} field and handed to a single dispatch thread,
 * so callbacks never block Netty I/O and each subscription observes its
 * notifications in arrival order.
 *
 * <p><b>Connection loss:</b> The provider does not reconnect. When the channel
 * goes inactive every pending request fails with {@link RpcException} and every
 * subscription's error callback fires once. Callers create a fresh provider.
 */
public class WebSocketProvider implements VigilProvider {

    private static final Logger log = LoggerFactory.getLogger(WebSocketProvider.class);

    /**
     * Connection state.
     *
     * <pre>
     * CONNECTING ---(success)---> CONNECTED ---(channel lost)---> DISCONNECTED
     *     |                           |                               |
     *     +------(failure)------------+----------(close())------------+--> CLOSED
     * </pre>
     */
    public enum ConnectionState {
        /** Initial connection in progress. */
        CONNECTING,
        /** Handshake complete, requests are sent immediately. */
        CONNECTED,
        /** Channel lost. Requests are rejected; the provider must be replaced. */
        DISCONNECTED,
        /** Closed by the owner. */
        CLOSED
    }

    private record SubscriptionListener(Consumer<JsonNode> onNotification, Consumer<Throwable> onError) {}

    private static final AtomicInteger PROVIDER_ID = new AtomicInteger();

    private final AtomicReference<ConnectionState> connectionState =
            new AtomicReference<>(ConnectionState.CONNECTING);

    private final WebSocketConfig config;
    private final URI uri;
    private final EventLoopGroup group;
    /**
     * Accessed from caller threads and the Netty I/O thread.
     */
    private volatile @Nullable Channel channel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final ConcurrentHashMap<Long, CompletableFuture<JsonRpcResponse>> pendingRequests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SubscriptionListener> subscriptions = new ConcurrentHashMap<>();
    private final ExecutorService notificationExecutor;

    private final AtomicLong idGenerator = new AtomicLong(1);
    private final LongAdder orphanedResponses = new LongAdder();

    private WebSocketProvider(WebSocketConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.uri = URI.create(config.url());
        final int providerId = PROVIDER_ID.incrementAndGet();
        this.group = new NioEventLoopGroup(config.ioThreads(), daemonFactory("vigil-netty-io-" + providerId));
        this.notificationExecutor = Executors.newSingleThreadExecutor(daemonFactory("vigil-ws-notify-" + providerId));
        try {
            connect();
        } catch (RuntimeException e) {
            shutdownResources();
            throw e;
        }
    }

    /**
     * Creates a provider and connects it.
     *
     * @param config the WebSocket configuration
     * @return a connected provider
     * @throws RpcException if the connection cannot be established
     */
    public static WebSocketProvider create(WebSocketConfig config) {
        return new WebSocketProvider(config);
    }

    /**
     * Creates a provider with default settings and connects it.
     *
     * @param url the {@code ws://} or {@code wss://} endpoint
     * @return a connected provider
     * @throws RpcException if the connection cannot be established
     */
    public static WebSocketProvider create(String url) {
        return new WebSocketProvider(WebSocketConfig.withDefaults(url));
    }

    private static ThreadFactory daemonFactory(final String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    public ConnectionState getConnectionState() {
        return connectionState.get();
    }

    public int getPendingRequestCount() {
        return pendingRequests.size();
    }

    /**
     * Responses that arrived with no matching pending request, typically after
     * the request timed out.
     */
    public long getOrphanedResponseCount() {
        return orphanedResponses.sum();
    }

    private void connect() {
        final boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (Exception e) {
            throw new RpcException(-32000, "Failed to initialise TLS", null, e);
        }
        final int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        final String endpoint = LogSanitizer.sanitize(uri.toString());

        long delay = 100;
        Exception lastError = null;
        for (int attempt = 1; attempt <= config.connectAttempts() && !closed.get(); attempt++) {
            // Handshaker state is per channel, so each attempt gets a fresh handler
            final WebSocketClientHandler handler = new WebSocketClientHandler(
                    WebSocketClientHandshakerFactory.newHandshaker(
                            uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), config.maxFrameSize()));

            Bootstrap b = new Bootstrap();
            b.group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.SO_KEEPALIVE, true)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            if (sslContext != null) {
                                p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port));
                            }
                            p.addLast(new HttpClientCodec());
                            p.addLast(new HttpObjectAggregator(65536));
                            p.addLast(new WebSocketFrameAggregator(config.maxFrameSize()));
                            p.addLast(handler);
                        }
                    });

            Channel ch = null;
            try {
                ch = b.connect(uri.getHost(), port).sync().channel();
                if (!handler.handshakeFuture().await(config.connectTimeout().toMillis())) {
                    throw new RpcException(-32000, "WebSocket handshake timed out", null);
                }
                if (!handler.handshakeFuture().isSuccess()) {
                    throw new RpcException(-32000, "WebSocket handshake failed", null,
                            handler.handshakeFuture().cause());
                }
                this.channel = ch;
                connectionState.set(ConnectionState.CONNECTED);
                log.debug("Connected to {}", endpoint);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                closeQuietly(ch);
                throw new RpcException(-32000, "Interrupted while connecting to " + endpoint, null, e);
            } catch (Exception e) {
                lastError = e;
                closeQuietly(ch);
                log.warn("Connection attempt {}/{} to {} failed: {}",
                        attempt, config.connectAttempts(), endpoint, e.getMessage());
                if (attempt < config.connectAttempts()) {
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RpcException(-32000, "Interrupted while connecting to " + endpoint, null, ie);
                    }
                    delay = Math.min(delay * 2, 2000);
                }
            }
        }
        connectionState.set(ConnectionState.CLOSED);
        throw new RpcException(-32000,
                "Failed to connect to " + endpoint + " after " + config.connectAttempts() + " attempts",
                null, lastError);
    }

    private static void closeQuietly(@Nullable Channel ch) {
        if (ch != null && ch.isOpen()) {
            ch.close();
        }
    }

    private class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private ChannelPromise handshakeFuture;

        WebSocketClientHandler(WebSocketClientHandshaker handshaker) {
            this.handshaker = handshaker;
        }

        ChannelFuture handshakeFuture() {
            return handshakeFuture;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(new RpcException(-32000, "Channel closed during handshake", null));
            }
            if (ctx.channel() == channel) {
                onConnectionLost(new RpcException(-32000, "WebSocket connection lost", null));
            }
        }

        @Override
        public void channelRead0(ChannelHandlerContext ctx, Object msg) throws Exception {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                        handshakeFuture.setSuccess();
                    } catch (WebSocketHandshakeException e) {
                        handshakeFuture.setFailure(e);
                    }
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException(
                        "Unexpected FullHttpResponse (status=" + response.status() + ")");
            }

            if (msg instanceof WebSocketFrame frame) {
                if (frame instanceof TextWebSocketFrame textFrame) {
                    ByteBuf content = textFrame.content();
                    try (JsonParser parser = MAPPER.getFactory()
                            .createParser((InputStream) new ByteBufInputStream(content))) {
                        JsonNode node = MAPPER.readTree(parser);
                        if (node == null) {
                            return;
                        }
                        DebugLogger.logRpc("[WS-RECV] %s", node);
                        if (isNotification(node)) {
                            handleNotificationNode(node);
                        } else {
                            processResponseNode(node);
                        }
                    } catch (Exception e) {
                        log.error("Error parsing WebSocket frame", e);
                    }
                } else if (frame instanceof CloseWebSocketFrame) {
                    ch.close();
                }
            }
        }

        private boolean isNotification(JsonNode node) {
            JsonNode params = node.get("params");
            return !node.has("id") && params != null && params.has("subscription");
        }

        private void handleNotificationNode(JsonNode node) {
            JsonNode params = node.get("params");
            String subId = params.get("subscription").asText();
            SubscriptionListener listener = subscriptions.get(subId);
            if (listener == null) {
                log.debug("Dropping notification for unknown subscription {}", subId);
                return;
            }
            JsonNode result = params.path("result");
            notificationExecutor.execute(() -> {
                // Unsubscribed while queued
                if (subscriptions.get(subId) != listener) {
                    return;
                }
                try {
                    listener.onNotification().accept(result);
                } catch (RuntimeException callbackEx) {
                    log.error("Subscription callback error for subscription {}", subId, callbackEx);
                }
            });
        }

        private void processResponseNode(JsonNode node) throws com.fasterxml.jackson.core.JsonProcessingException {
            JsonNode idNode = node.get("id");
            if (idNode == null) {
                return;
            }
            long id;
            if (idNode.isNumber()) {
                id = idNode.asLong();
            } else if (idNode.isTextual()) {
                try {
                    id = Long.parseLong(idNode.asText());
                } catch (NumberFormatException e) {
                    log.error("Orphaned response: could not parse ID '{}'", idNode.asText());
                    orphanedResponses.increment();
                    return;
                }
            } else {
                log.error("Orphaned response: ID node has unexpected type '{}'", idNode.getNodeType());
                orphanedResponses.increment();
                return;
            }

            CompletableFuture<JsonRpcResponse> future = pendingRequests.remove(id);
            if (future == null) {
                log.warn("Orphaned response: no pending request found for ID {}", id);
                orphanedResponses.increment();
                return;
            }

            JsonNode errorNode = node.get("error");
            JsonRpcError error = null;
            if (errorNode != null && !errorNode.isNull()) {
                error = MAPPER.treeToValue(errorNode, JsonRpcError.class);
            }
            future.complete(new JsonRpcResponse("2.0", node.get("result"), error, String.valueOf(id)));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Channel exception", cause);
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
            }
            ctx.close();
        }
    }

    @Override
    public JsonRpcResponse send(String method, List<?> params) {
        return await(sendAsync(method, params), method);
    }

    /**
     * Sends a request with the configured default timeout.
     */
    public CompletableFuture<JsonRpcResponse> sendAsync(String method, List<?> params) {
        return sendAsync(method, params, config.defaultRequestTimeout(), null);
    }

    /**
     * Sends a request.
     *
     * @param timeout    per-request timeout; {@code null} or zero disables it
     * @param onResponse invoked on the I/O thread before the returned future
     *                   completes, ahead of any later inbound frame
     */
    private CompletableFuture<JsonRpcResponse> sendAsync(
            String method,
            List<?> params,
            @Nullable Duration timeout,
            @Nullable Consumer<JsonRpcResponse> onResponse) {
        ConnectionState state = connectionState.get();
        if (state != ConnectionState.CONNECTED) {
            return CompletableFuture.failedFuture(new RpcException(
                    -32000, "WebSocket is " + state.name().toLowerCase(Locale.ROOT) + ", request rejected (method: " + method + ")", null));
        }
        if (pendingRequests.size() >= config.maxPendingRequests()) {
            return CompletableFuture.failedFuture(new RpcException(
                    -32000, "Too many pending requests (" + config.maxPendingRequests() + " limit reached)", null));
        }

        final long id = idGenerator.getAndIncrement();
        final CompletableFuture<JsonRpcResponse> pending = new CompletableFuture<>();
        final CompletableFuture<JsonRpcResponse> result = onResponse == null
                ? pending
                : pending.thenApply(response -> {
                    onResponse.accept(response);
                    return response;
                });
        pendingRequests.put(id, pending);

        final Channel ch = this.channel;
        if (ch == null || !ch.isActive()) {
            pendingRequests.remove(id, pending);
            pending.completeExceptionally(new RpcException(-32000, "Channel not active", null));
            return result;
        }

        if (timeout != null && timeout.toMillis() > 0) {
            ch.eventLoop().schedule(() -> {
                if (pendingRequests.remove(id, pending)) {
                    pending.completeExceptionally(new RpcException(
                            -32000,
                            "Request timed out after " + timeout.toMillis() + "ms (method: " + method + ")",
                            null));
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        final byte[] payload;
        try {
            ObjectNode request = MAPPER.createObjectNode();
            request.put("jsonrpc", "2.0");
            request.put("method", method);
            request.set("params", MAPPER.valueToTree(params == null ? List.of() : params));
            request.put("id", id);
            payload = MAPPER.writeValueAsBytes(request);
            DebugLogger.logRpc("[WS-SEND] %s", request);
        } catch (Exception e) {
            pendingRequests.remove(id, pending);
            pending.completeExceptionally(new RpcException(-32602, "Failed to serialize request for " + method, null, e));
            return result;
        }

        ch.eventLoop().execute(() -> {
            ByteBuf buffer = ch.alloc().buffer(payload.length);
            buffer.writeBytes(payload);
            ch.writeAndFlush(new TextWebSocketFrame(buffer)).addListener(f -> {
                if (!f.isSuccess() && pendingRequests.remove(id, pending)) {
                    pending.completeExceptionally(new RpcException(-32000, "Write failed", null, f.cause()));
                }
            });
        });
        return result;
    }

    @Override
    public String subscribe(
            String method,
            List<?> params,
            Consumer<JsonNode> onNotification,
            Consumer<Throwable> onError) {
        Objects.requireNonNull(onNotification, "onNotification");
        Objects.requireNonNull(onError, "onError");
        final SubscriptionListener listener = new SubscriptionListener(onNotification, onError);
        final AtomicReference<String> registered = new AtomicReference<>();

        // Registration runs on the I/O thread as the response is processed, so a
        // notification sent right after the subscribe response is not dropped.
        JsonRpcResponse response = await(sendAsync(method, params, config.defaultRequestTimeout(), r -> {
            if (!r.hasError() && r.result() != null && !r.result().isNull()) {
                String id = r.result().asText();
                subscriptions.put(id, listener);
                registered.set(id);
            }
        }), method);
        if (response.hasError()) {
            throw RpcUtils.toRpcException(response.error(), null);
        }
        String subscriptionId = registered.get();
        if (subscriptionId == null) {
            throw new RpcException(-32000, "Subscribe returned no subscription id (method: " + method + ")", null);
        }
        log.debug("Subscribed {} as {}", method, subscriptionId);
        return subscriptionId;
    }

    @Override
    public boolean unsubscribe(String method, String subscriptionId) {
        if (subscriptions.remove(subscriptionId) == null) {
            return false;
        }
        if (connectionState.get() != ConnectionState.CONNECTED) {
            return false;
        }
        JsonRpcResponse response = send(method, List.of(subscriptionId));
        if (response.hasError()) {
            throw RpcUtils.toRpcException(response.error(), null);
        }
        return response.result() != null && response.result().asBoolean(false);
    }

    private JsonRpcResponse await(CompletableFuture<JsonRpcResponse> future, String method) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RpcException rpc) {
                throw rpc;
            }
            throw new RpcException(-32000, "Request failed (method: " + method + ")", null, e.getCause());
        }
    }

    private void onConnectionLost(RpcException cause) {
        if (!connectionState.compareAndSet(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED)) {
            return;
        }
        log.warn("Connection to {} lost, failing {} pending requests and {} subscriptions",
                LogSanitizer.sanitize(uri.toString()), pendingRequests.size(), subscriptions.size());
        failAllPending(cause);

        List<SubscriptionListener> listeners = new ArrayList<>();
        for (Map.Entry<String, SubscriptionListener> entry : subscriptions.entrySet()) {
            if (subscriptions.remove(entry.getKey(), entry.getValue())) {
                listeners.add(entry.getValue());
            }
        }
        for (SubscriptionListener listener : listeners) {
            notificationExecutor.execute(() -> {
                try {
                    listener.onError().accept(cause);
                } catch (RuntimeException callbackEx) {
                    log.error("Subscription error callback failed", callbackEx);
                }
            });
        }
    }

    private void failAllPending(RpcException e) {
        pendingRequests.forEach((id, future) -> {
            if (pendingRequests.remove(id, future)) {
                future.completeExceptionally(e);
            }
        });
    }

    /**
     * Closes the connection. Pending requests fail; live subscriptions end
     * without an error callback.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        connectionState.set(ConnectionState.CLOSED);
        subscriptions.clear();
        failAllPending(new RpcException(-32000, "WebSocketProvider is shutting down", null));

        Channel ch = this.channel;
        if (ch != null) {
            try {
                ch.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing channel", e);
            }
        }
        shutdownResources();
    }

    private void shutdownResources() {
        notificationExecutor.shutdown();
        try {
            group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down EventLoopGroup", e);
        }
    }
}
