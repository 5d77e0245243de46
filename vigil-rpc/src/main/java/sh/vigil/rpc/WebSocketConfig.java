// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import static sh.vigil.rpc.internal.RpcUtils.WS_SCHEMES;
import static sh.vigil.rpc.internal.RpcUtils.validateUrl;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link WebSocketProvider}.
 *
 * <p>
 * Zero or {@code null} values are replaced by defaults in the compact
 * constructor, so {@code withDefaults(url)} and a bare builder are equivalent.
 *
 * @param url                   the {@code ws://} or {@code wss://} endpoint
 * @param maxPendingRequests    in-flight request limit before new requests are rejected (default 1024)
 * @param defaultRequestTimeout per-request timeout (default 30s)
 * @param connectTimeout        TCP connect and handshake timeout (default 10s)
 * @param connectAttempts       connection attempts before creation fails (default 3)
 * @param ioThreads             Netty event loop threads (default 1)
 * @param maxFrameSize          maximum inbound frame size in bytes (default 16MB)
 */
public record WebSocketConfig(
        String url,
        int maxPendingRequests,
        Duration defaultRequestTimeout,
        Duration connectTimeout,
        int connectAttempts,
        int ioThreads,
        int maxFrameSize) {

    // Defaults
    private static final int DEFAULT_MAX_PENDING = 1024;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_CONNECT_ATTEMPTS = 3;
    private static final int DEFAULT_IO_THREADS = 1;
    // Event records of busy blocks are large
    private static final int DEFAULT_MAX_FRAME_SIZE = 16 * 1024 * 1024;
    private static final int MAX_FRAME_SIZE_LIMIT = 64 * 1024 * 1024;

    public WebSocketConfig {
        validateUrl(url, WS_SCHEMES);

        if (maxPendingRequests <= 0)
            maxPendingRequests = DEFAULT_MAX_PENDING;
        if (defaultRequestTimeout == null)
            defaultRequestTimeout = DEFAULT_TIMEOUT;
        if (connectTimeout == null)
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (connectAttempts <= 0)
            connectAttempts = DEFAULT_CONNECT_ATTEMPTS;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (maxFrameSize <= 0)
            maxFrameSize = DEFAULT_MAX_FRAME_SIZE;

        if (maxFrameSize > MAX_FRAME_SIZE_LIMIT) {
            throw new IllegalArgumentException(
                    "maxFrameSize (" + maxFrameSize + ") exceeds maximum allowed (" + MAX_FRAME_SIZE_LIMIT + " bytes / 64MB)");
        }
        if (defaultRequestTimeout.isNegative() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("timeouts must not be negative");
        }
    }

    /**
     * Creates a configuration with all defaults for the given URL.
     */
    public static WebSocketConfig withDefaults(String url) {
        return new WebSocketConfig(url, 0, null, null, 0, 0, 0);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    /**
     * Builder for {@link WebSocketConfig}.
     */
    public static final class Builder {
        private final String url;
        private int maxPendingRequests = 0;
        private Duration defaultRequestTimeout = null;
        private Duration connectTimeout = null;
        private int connectAttempts = 0;
        private int ioThreads = 0;
        private int maxFrameSize = 0;

        private Builder(String url) {
            this.url = Objects.requireNonNull(url, "url");
        }

        public Builder maxPendingRequests(int maxPendingRequests) {
            this.maxPendingRequests = maxPendingRequests;
            return this;
        }

        /**
         * Sets the default request timeout. Default: 30 seconds.
         */
        public Builder defaultRequestTimeout(Duration timeout) {
            this.defaultRequestTimeout = timeout;
            return this;
        }

        /**
         * Sets the connection timeout. Default: 10 seconds.
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder connectAttempts(int connectAttempts) {
            this.connectAttempts = connectAttempts;
            return this;
        }

        /**
         * Sets the number of Netty I/O threads. Default: 1.
         */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Sets the maximum WebSocket frame size. Default: 16MB. Maximum: 64MB.
         */
        public Builder maxFrameSize(int bytes) {
            this.maxFrameSize = bytes;
            return this;
        }

        public WebSocketConfig build() {
            return new WebSocketConfig(
                    url,
                    maxPendingRequests,
                    defaultRequestTimeout,
                    connectTimeout,
                    connectAttempts,
                    ioThreads,
                    maxFrameSize);
        }
    }
}
