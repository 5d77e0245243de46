// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.error.RpcException;
import sh.vigil.rpc.exception.RetryExhaustedException;

/**
 * Internal utility for retrying chain queries with exponential backoff.
 *
 * <p>
 * <strong>Retry Conditions:</strong>
 * <ul>
 * <li>"unknown block" - block announced but not yet imported by the queried node</li>
 * <li>"timeout" / "connection reset" - network hiccups</li>
 * <li>"rate limit" / "too many requests" / "429" - provider rate limiting</li>
 * <li>"internal error" / -32603 - transient server errors</li>
 * <li>"server busy" / "overloaded" - server capacity issues</li>
 * <li>any {@link IOException} in the cause chain</li>
 * </ul>
 * Method-not-found, invalid params, and decoding problems are thrown
 * immediately.
 *
 * <p>
 * <strong>Thread Interruption:</strong> If the calling thread is interrupted
 * during backoff, the retry loop terminates and rethrows the last failure with
 * the {@link InterruptedException} suppressed.
 */
final class RpcRetry {

    private static final Logger log = LoggerFactory.getLogger(RpcRetry.class);

    private RpcRetry() {
    }

    /**
     * Executes the supplier with retry on transient failures.
     *
     * @param <T>      the return type
     * @param supplier the operation to retry
     * @param config   retry configuration
     * @return the result from the supplier
     * @throws RpcException            if the error is non-retryable
     * @throws RetryExhaustedException if all attempts failed with retryable errors
     */
    static <T> T run(final Supplier<T> supplier, final RpcRetryConfig config) {
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(config, "config");

        List<Throwable> failedAttempts = null;
        final long startTime = System.currentTimeMillis();

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            final RuntimeException failure;
            try {
                return supplier.get();
            } catch (RpcException e) {
                if (!isRetryableRpcError(e)) {
                    throw e;
                }
                failure = e;
            } catch (RuntimeException e) {
                if (unwrapIo(e) == null) {
                    throw e;
                }
                failure = e;
            }

            if (failedAttempts == null) {
                failedAttempts = new ArrayList<>();
            }
            failedAttempts.add(failure);
            if (attempt == config.maxAttempts()) {
                break;
            }

            final long delayMillis = backoff(attempt, config);
            log.debug("Attempt {}/{} failed ({}), retrying in {}ms",
                    attempt, config.maxAttempts(), failure.getMessage(), delayMillis);
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure.addSuppressed(e);
                throw failure;
            }
        }

        throw createRetryExhaustedException(failedAttempts, startTime);
    }

    private static RetryExhaustedException createRetryExhaustedException(
            final List<Throwable> failedAttempts,
            final long startTime) {
        final long totalDuration = System.currentTimeMillis() - startTime;
        final Throwable lastFailure = failedAttempts.get(failedAttempts.size() - 1);

        final RetryExhaustedException exhausted = new RetryExhaustedException(
                failedAttempts.size(),
                totalDuration,
                lastFailure);

        for (int i = 0; i < failedAttempts.size() - 1; i++) {
            exhausted.addSuppressed(failedAttempts.get(i));
        }
        return exhausted;
    }

    static boolean isRetryableRpcError(final RpcException e) {
        if (e == null || e.getMessage() == null) {
            return false;
        }
        if (e.isUnknownBlock()) {
            return true;
        }
        if (e.code() == -32603) {
            return true;
        }
        final String message = e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("timeout")
                || message.contains("timed out")
                || message.contains("connection reset")
                || message.contains("temporarily unavailable")
                || message.contains("try again")
                // Rate limiting from RPC providers
                || message.contains("rate limit")
                || message.contains("too many requests")
                || message.contains("429")
                // Transient server errors
                || message.contains("internal error")
                || message.contains("server busy")
                || message.contains("overloaded");
    }

    static long backoff(final int attempt, final RpcRetryConfig config) {
        final long delay = config.backoffBaseMs() * (1L << Math.min(attempt - 1, 30));
        final long cappedDelay = Math.min(delay, config.backoffMaxMs());
        final double jitter = ThreadLocalRandom.current().nextDouble(config.jitterMin(), config.jitterMax());
        return cappedDelay + (long) (cappedDelay * jitter);
    }

    private static IOException unwrapIo(final Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof IOException io) {
                return io;
            }
            current = current.getCause();
        }
        return null;
    }
}
