// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.error;

import java.time.Duration;
import java.util.List;

import sh.vigil.core.model.ChainEvent;

/**
 * Thrown when a watch reaches its configured timeout before its stop
 * condition was met.
 *
 * <p>
 * Multi-match watches expose whatever they collected so far through
 * {@link #partialMatches()}; single-match watches always report an empty list.
 */
public final class WatchTimeoutException extends VigilException {

    private final String pattern;
    private final Duration elapsed;
    private final List<ChainEvent> partialMatches;

    public WatchTimeoutException(final String pattern, final Duration elapsed, final List<ChainEvent> partialMatches) {
        super("Timed out after " + elapsed.toMillis() + "ms waiting for " + pattern
                + " (" + partialMatches.size() + " partial match" + (partialMatches.size() == 1 ? "" : "es") + ")");
        this.pattern = pattern;
        this.elapsed = elapsed;
        this.partialMatches = List.copyOf(partialMatches);
    }

    public String pattern() {
        return pattern;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public List<ChainEvent> partialMatches() {
        return partialMatches;
    }
}
