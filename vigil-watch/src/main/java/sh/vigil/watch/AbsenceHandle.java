// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.concurrent.CompletableFuture;

/**
 * A running absence check.
 *
 * <p>
 * The check fails with {@link UnexpectedEventError} as soon as the event is
 * seen. Otherwise it succeeds when {@link #stop()} is called or its timeout
 * elapses.
 */
public final class AbsenceHandle {

    private final CompletableFuture<Void> result;
    private final Runnable stopper;

    AbsenceHandle(final CompletableFuture<Void> result, final Runnable stopper) {
        this.result = result;
        this.stopper = stopper;
    }

    /**
     * Ends the check. Safe to call more than once.
     *
     * @return completes normally if the event was not seen, exceptionally with
     *         {@link UnexpectedEventError} if it was
     */
    public CompletableFuture<Void> stop() {
        stopper.run();
        return result;
    }

    public CompletableFuture<Void> result() {
        return result;
    }
}
