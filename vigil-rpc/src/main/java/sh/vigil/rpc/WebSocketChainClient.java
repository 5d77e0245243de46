// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.DebugLogger;
import sh.vigil.core.error.RpcException;
import sh.vigil.core.model.BlockHeader;
import sh.vigil.core.types.Hash;
import sh.vigil.rpc.internal.RpcUtils;

/**
 * {@link ChainClient} for Substrate-style nodes speaking JSON-RPC.
 *
 * <p>
 * Methods used:
 * <ul>
 * <li>{@code chain_subscribeNewHeads} / {@code chain_unsubscribeNewHeads}</li>
 * <li>{@code chain_subscribeFinalizedHeads} / {@code chain_unsubscribeFinalizedHeads}</li>
 * <li>{@code chain_getHeader}, and {@code chain_getBlockHash} for head
 * notifications that carry no {@code hash} field</li>
 * <li>the configured {@link EventsQuery}, {@code state_getStorage} of
 * {@code System.Events} by default</li>
 * </ul>
 *
 * <p>
 * Queries are retried on transient failures according to the configured
 * {@link RpcRetryConfig}. Subscribe and unsubscribe are not retried.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * ChainClient client = WebSocketChainClient.connect("ws://127.0.0.1:9944");
 *
 * ChainClient custom = WebSocketChainClient.builder(WebSocketProvider.create(config))
 *     .eventsQuery(EventsQuery.byBlockHash("indexer_getBlockEvents"))
 *     .retry(RpcRetryConfig.noRetry())
 *     .build();
 * }</pre>
 */
public final class WebSocketChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(WebSocketChainClient.class);

    private final VigilProvider provider;
    private final EventsQuery eventsQuery;
    private final RpcRetryConfig retryConfig;

    private WebSocketChainClient(final Builder builder) {
        this.provider = builder.provider;
        this.eventsQuery = builder.eventsQuery;
        this.retryConfig = builder.retryConfig;
    }

    /**
     * Connects to {@code url} with default WebSocket, query and retry settings.
     *
     * @throws RpcException if the connection cannot be established
     */
    public static WebSocketChainClient connect(final String url) {
        return builder(WebSocketProvider.create(url)).build();
    }

    public static Builder builder(final VigilProvider provider) {
        return new Builder(provider);
    }

    @Override
    public Subscription subscribeHeads(
            final boolean finalized,
            final Consumer<BlockHeader> onHead,
            final Consumer<Throwable> onError) {
        Objects.requireNonNull(onHead, "onHead");
        Objects.requireNonNull(onError, "onError");
        final String subscribeMethod = finalized ? "chain_subscribeFinalizedHeads" : "chain_subscribeNewHeads";
        final String unsubscribeMethod = finalized ? "chain_unsubscribeFinalizedHeads" : "chain_unsubscribeNewHeads";
        final AtomicBoolean failed = new AtomicBoolean(false);
        final Consumer<Throwable> failOnce = e -> {
            if (failed.compareAndSet(false, true)) {
                onError.accept(e);
            }
        };

        final String id = provider.subscribe(subscribeMethod, List.of(), result -> {
            if (failed.get()) {
                return;
            }
            final BlockHeader header;
            try {
                header = parseHeader(result, null);
            } catch (RuntimeException e) {
                log.warn("Head notification on {} could not be resolved: {}", subscribeMethod, e.getMessage());
                failOnce.accept(e);
                return;
            }
            DebugLogger.logRpc("[HEAD] finalized=%s #%d %s", finalized, header.number(), header.hash());
            onHead.accept(header);
        }, failOnce);
        log.debug("Subscribed to {} heads ({})", finalized ? "finalized" : "best", id);
        return new SubscriptionImpl(id, unsubscribeMethod, provider);
    }

    @Override
    public BlockHeader getHeader(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        final JsonNode result = sendWithRetry("chain_getHeader", List.of(hash.value()));
        if (result.isNull()) {
            throw new RpcException(-32000, "Unknown block " + hash, null);
        }
        return parseHeader(result, hash);
    }

    @Override
    public List<RawEventRecord> queryBlockEvents(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        final JsonNode result = sendWithRetry(eventsQuery.method(), eventsQuery.paramsFor(hash));
        if (result.isNull() || result.isMissingNode()) {
            return List.of();
        }
        if (result.isArray()) {
            final List<RawEventRecord> records = new ArrayList<>(result.size());
            for (int i = 0; i < result.size(); i++) {
                records.add(new RawEventRecord(i, result.get(i)));
            }
            return records;
        }
        return List.of(new RawEventRecord(0, result));
    }

    @Override
    public void close() {
        provider.close();
    }

    /**
     * Parses a header object. The hash is taken from {@code knownHash}, the
     * object's own {@code hash} field, or resolved by number, in that order.
     */
    private BlockHeader parseHeader(final JsonNode node, final @Nullable Hash knownHash) {
        if (node == null || !node.isObject()) {
            throw new RpcException(-32000, "Malformed header", node == null ? null : node.toString());
        }
        final long number;
        final Hash parentHash;
        try {
            number = RpcUtils.decodeNumber(node.get("number"));
            parentHash = new Hash(node.path("parentHash").asText());
        } catch (IllegalArgumentException e) {
            throw new RpcException(-32000, "Malformed header: " + e.getMessage(), node.toString(), e);
        }
        Hash hash = knownHash;
        if (hash == null && node.hasNonNull("hash")) {
            hash = new Hash(node.get("hash").asText());
        }
        if (hash == null) {
            hash = getBlockHash(number);
        }
        return new BlockHeader(hash, number, parentHash);
    }

    private Hash getBlockHash(final long number) {
        final JsonNode result = sendWithRetry("chain_getBlockHash", List.of(number));
        if (result.isNull()) {
            throw new RpcException(-32000, "Unknown block #" + number, null);
        }
        return new Hash(result.asText());
    }

    private JsonNode sendWithRetry(final String method, final List<?> params) {
        return RpcRetry.run(() -> {
            final JsonRpcResponse response = provider.send(method, params);
            if (response.hasError()) {
                throw RpcUtils.toRpcException(response.error(), null);
            }
            return response.resultNode();
        }, retryConfig);
    }

    private record SubscriptionImpl(String id, String unsubscribeMethod, VigilProvider provider)
            implements Subscription {
        @Override
        public void unsubscribe() {
            provider.unsubscribe(unsubscribeMethod, id);
        }
    }

    /**
     * Builder for {@link WebSocketChainClient}.
     */
    public static final class Builder {
        private final VigilProvider provider;
        private EventsQuery eventsQuery = EventsQuery.systemEvents();
        private RpcRetryConfig retryConfig = RpcRetryConfig.defaults();

        private Builder(final VigilProvider provider) {
            this.provider = Objects.requireNonNull(provider, "provider");
        }

        /**
         * Sets the call used to fetch a block's raw events. Default:
         * {@link EventsQuery#systemEvents()}.
         */
        public Builder eventsQuery(final EventsQuery eventsQuery) {
            this.eventsQuery = Objects.requireNonNull(eventsQuery, "eventsQuery");
            return this;
        }

        public Builder retry(final RpcRetryConfig retryConfig) {
            this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
            return this;
        }

        public WebSocketChainClient build() {
            return new WebSocketChainClient(this);
        }
    }
}
