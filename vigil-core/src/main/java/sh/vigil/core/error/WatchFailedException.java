// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.error;

import java.time.Duration;

/**
 * Thrown when a single watch fails for a reason that does not affect the
 * shared subscription, e.g. a block could not be fetched during the
 * historical walk or the caller's predicate threw.
 */
public final class WatchFailedException extends VigilException {

    private final String pattern;

    public WatchFailedException(final String pattern, final Duration elapsed, final Throwable cause) {
        super("Watch for " + pattern + " failed after " + elapsed.toMillis() + "ms: " + cause.getMessage(), cause);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
