// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.error;

/**
 * Base runtime exception for all Vigil failures.
 *
 * <p>
 * This sealed class forms the root of Vigil's exception hierarchy so callers
 * can branch on timeout vs. hard failure by type.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * VigilException
 * ├── {@link ConnectionException} - chain connection or head subscription failed
 * ├── {@link RpcException} - a single JSON-RPC request failed
 * ├── {@link WatchTimeoutException} - a watch ran out of time (carries partial matches)
 * └── {@link WatchFailedException} - a failure confined to one watch
 * </pre>
 *
 * <p>
 * An aborted watch is not an error and never raises one of these.
 *
 * <pre>{@code
 * try {
 *     observer.watchEvent("swapping:SwapExecuted", options).result().join();
 * } catch (CompletionException e) {
 *     if (e.getCause() instanceof WatchTimeoutException timeout) {
 *         // nothing matched in time
 *     } else if (e.getCause() instanceof ConnectionException lost) {
 *         // the shared subscription died
 *     }
 * }
 * }</pre>
 */
public sealed class VigilException extends RuntimeException
        permits ConnectionException,
        RpcException,
        WatchTimeoutException,
        WatchFailedException {

    public VigilException(final String message) {
        super(message);
    }

    public VigilException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
