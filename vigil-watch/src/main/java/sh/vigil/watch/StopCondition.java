// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import sh.vigil.core.model.ChainEvent;

/**
 * Decides when a multi-match watch has collected enough.
 *
 * <p>
 * Evaluated once after each match is added, with all matches so far in the
 * order they were found.
 */
@FunctionalInterface
public interface StopCondition {

    /**
     * @param matches every match collected so far, including {@code latest}
     * @param latest  the match just added
     * @return true to finish the watch
     */
    boolean isMet(List<ChainEvent> matches, ChainEvent latest);

    /** Stops at the first match. */
    static StopCondition first() {
        return count(1);
    }

    /** Stops once {@code n} matches were collected. */
    static StopCondition count(final int n) {
        if (n < 1) {
            throw new IllegalArgumentException("count must be at least 1, got: " + n);
        }
        return (matches, latest) -> matches.size() >= n;
    }

    /** Stops on the first match for which {@code predicate} holds; that match is included. */
    static StopCondition when(final Predicate<ChainEvent> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return (matches, latest) -> predicate.test(latest);
    }

    /** Never stops; the watch ends only by timeout or abort. */
    static StopCondition never() {
        return (matches, latest) -> false;
    }
}
