// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc.exception;

import org.jspecify.annotations.Nullable;

import sh.vigil.core.error.RpcException;

/**
 * Thrown when all retry attempts for a chain query have been exhausted.
 *
 * <p>
 * The cause is always the final failure. Earlier failures are attached as
 * suppressed exceptions, in attempt order.
 */
public final class RetryExhaustedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attemptCount;
    private final long totalRetryDurationMs;

    public RetryExhaustedException(
            final int attemptCount,
            final long totalRetryDurationMs,
            final Throwable cause) {
        super(
            String.format("All %d retry attempts exhausted (total: %dms)", attemptCount, totalRetryDurationMs),
            cause
        );
        this.attemptCount = attemptCount;
        this.totalRetryDurationMs = totalRetryDurationMs;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * Returns the total time spent retrying, including backoff delays.
     */
    public long getTotalRetryDurationMs() {
        return totalRetryDurationMs;
    }

    /**
     * Returns the RPC error code from the final failure, or 0 if it was not
     * an RPC error.
     */
    public int getRpcErrorCode() {
        if (getCause() instanceof RpcException rpc) {
            return rpc.code();
        }
        return 0;
    }

    public @Nullable String getRpcErrorData() {
        if (getCause() instanceof RpcException rpc) {
            return rpc.data();
        }
        return null;
    }
}
