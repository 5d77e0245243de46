// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

/**
 * Configuration for RPC retry behavior with exponential backoff.
 *
 * <p><strong>Backoff Formula:</strong>
 * <pre>
 *   delay = min(base * 2^(attempt-1), max)
 *   finalDelay = delay + delay * random(jitterMin, jitterMax)
 * </pre>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * RpcRetryConfig fast = RpcRetryConfig.builder()
 *     .maxAttempts(5)
 *     .backoffBaseMs(50)
 *     .backoffMaxMs(1000)
 *     .build();
 * }</pre>
 *
 * @param maxAttempts   total attempts including the first (must be &gt;= 1)
 * @param backoffBaseMs base delay in milliseconds (must be &gt; 0)
 * @param backoffMaxMs  maximum delay cap in milliseconds (must be &gt;= backoffBaseMs)
 * @param jitterMin     minimum jitter fraction (must be &gt;= 0 and &lt; jitterMax)
 * @param jitterMax     maximum jitter fraction (must be &gt; jitterMin)
 * @see RpcRetry
 */
public record RpcRetryConfig(
        int maxAttempts,
        long backoffBaseMs,
        long backoffMaxMs,
        double jitterMin,
        double jitterMax) {

    /** Default attempts: 3. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /** Default base delay: 200ms. */
    public static final long DEFAULT_BACKOFF_BASE_MS = 200;

    /** Default maximum delay: 5000ms. */
    public static final long DEFAULT_BACKOFF_MAX_MS = 5000;

    /** Default minimum jitter: 10%. */
    public static final double DEFAULT_JITTER_MIN = 0.10;

    /** Default maximum jitter: 25%. */
    public static final double DEFAULT_JITTER_MAX = 0.25;

    public RpcRetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be > 0, got: " + backoffBaseMs);
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                    "backoffMaxMs must be >= backoffBaseMs, got: " + backoffMaxMs + " < " + backoffBaseMs);
        }
        if (jitterMin < 0) {
            throw new IllegalArgumentException("jitterMin must be >= 0, got: " + jitterMin);
        }
        if (jitterMax <= jitterMin) {
            throw new IllegalArgumentException(
                    "jitterMax must be > jitterMin, got: " + jitterMax + " <= " + jitterMin);
        }
    }

    /**
     * Returns the default configuration: 3 attempts, 200ms base, 5000ms max,
     * 10-25% jitter.
     */
    public static RpcRetryConfig defaults() {
        return new RpcRetryConfig(
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_BACKOFF_BASE_MS,
                DEFAULT_BACKOFF_MAX_MS,
                DEFAULT_JITTER_MIN,
                DEFAULT_JITTER_MAX);
    }

    /**
     * A configuration that never retries.
     */
    public static RpcRetryConfig noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link RpcRetryConfig}. All values start at their defaults.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;
        private double jitterMin = DEFAULT_JITTER_MIN;
        private double jitterMax = DEFAULT_JITTER_MAX;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder backoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
            return this;
        }

        /**
         * Sets the minimum jitter fraction (e.g., 0.10 for 10%).
         */
        public Builder jitterMin(double jitterMin) {
            this.jitterMin = jitterMin;
            return this;
        }

        /**
         * Sets the maximum jitter fraction (e.g., 0.25 for 25%).
         */
        public Builder jitterMax(double jitterMax) {
            this.jitterMax = jitterMax;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public RpcRetryConfig build() {
            return new RpcRetryConfig(maxAttempts, backoffBaseMs, backoffMaxMs, jitterMin, jitterMax);
        }
    }
}
