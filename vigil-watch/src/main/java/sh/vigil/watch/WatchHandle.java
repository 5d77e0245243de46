// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.jspecify.annotations.Nullable;

/**
 * A running watch.
 *
 * <p>
 * {@link #result()} completes with the watch's value, {@code null} or an
 * empty list when it was stopped, or exceptionally with
 * {@link sh.vigil.core.error.WatchTimeoutException},
 * {@link sh.vigil.core.error.ConnectionException} or
 * {@link sh.vigil.core.error.WatchFailedException}.
 *
 * @param <T> the result type
 */
public final class WatchHandle<T> {

    private final String description;
    private final CompletableFuture<T> result;
    private final @Nullable Runnable stopper;

    WatchHandle(final String description, final CompletableFuture<T> result, final @Nullable Runnable stopper) {
        this.description = Objects.requireNonNull(description, "description");
        this.result = Objects.requireNonNull(result, "result");
        this.stopper = stopper;
    }

    public CompletableFuture<T> result() {
        return result;
    }

    public boolean isAbortable() {
        return stopper != null;
    }

    /**
     * Waits for the result, rethrowing the failure unwrapped.
     */
    public T await() {
        try {
            return result.join();
        } catch (CompletionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    /**
     * Stops the watch. Its result resolves with {@code null} or an empty list
     * unless it already completed.
     *
     * @throws IllegalStateException if the watch was not started as abortable
     */
    public void stop() {
        if (stopper == null) {
            throw new IllegalStateException("Watch for " + description + " is not abortable");
        }
        stopper.run();
    }

    @Override
    public String toString() {
        return "WatchHandle[" + description + (result.isDone() ? ", done]" : "]");
    }
}
