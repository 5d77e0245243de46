// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.Objects;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;

import sh.vigil.core.model.ChainEvent;

/**
 * Options of a single watch.
 *
 * <p>
 * <strong>Defaults:</strong>
 * <ul>
 * <li>chain: the configured default chain</li>
 * <li>finalized: false (follow best heads)</li>
 * <li>historicalCheckBlocks: 0</li>
 * <li>timeoutSeconds: 0 (no timeout)</li>
 * <li>stopAfter: {@link StopCondition#first()}</li>
 * <li>abortable: false</li>
 * <li>predicate: accepts every event</li>
 * <li>matchMode: {@link MatchMode#SUBSTRING}</li>
 * </ul>
 *
 * @param chain                 chain id, or null for the default chain
 * @param finalized             follow finalized instead of best heads
 * @param historicalCheckBlocks ancestors of the first head to search
 * @param timeoutSeconds        seconds before the watch fails, 0 for none
 * @param stopAfter             when a multi-match watch finishes
 * @param abortable             whether {@link WatchHandle#stop()} is allowed
 * @param predicate             extra filter on name-matched events
 * @param matchMode             how names are compared with the pattern
 */
public record WatchOptions(
        @Nullable String chain,
        boolean finalized,
        int historicalCheckBlocks,
        long timeoutSeconds,
        StopCondition stopAfter,
        boolean abortable,
        Predicate<ChainEvent> predicate,
        MatchMode matchMode) {

    private static final Predicate<ChainEvent> ANY = event -> true;

    public WatchOptions {
        if (historicalCheckBlocks < 0) {
            throw new IllegalArgumentException("historicalCheckBlocks must not be negative");
        }
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must not be negative");
        }
        Objects.requireNonNull(stopAfter, "stopAfter");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(matchMode, "matchMode");
    }

    public static WatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasTimeout() {
        return timeoutSeconds > 0;
    }

    /**
     * Builder for {@link WatchOptions}.
     */
    public static final class Builder {
        private @Nullable String chain;
        private boolean finalized;
        private int historicalCheckBlocks;
        private long timeoutSeconds;
        private StopCondition stopAfter = StopCondition.first();
        private boolean abortable;
        private Predicate<ChainEvent> predicate = ANY;
        private MatchMode matchMode = MatchMode.SUBSTRING;

        private Builder() {
        }

        public Builder chain(final @Nullable String chain) {
            this.chain = chain;
            return this;
        }

        public Builder finalized(final boolean finalized) {
            this.finalized = finalized;
            return this;
        }

        public Builder historicalCheckBlocks(final int historicalCheckBlocks) {
            this.historicalCheckBlocks = historicalCheckBlocks;
            return this;
        }

        public Builder timeoutSeconds(final long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder stopAfter(final StopCondition stopAfter) {
            this.stopAfter = stopAfter;
            return this;
        }

        /** Shorthand for {@code stopAfter(StopCondition.count(n))}. */
        public Builder stopAfter(final int n) {
            this.stopAfter = StopCondition.count(n);
            return this;
        }

        public Builder abortable(final boolean abortable) {
            this.abortable = abortable;
            return this;
        }

        public Builder predicate(final Predicate<ChainEvent> predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder matchMode(final MatchMode matchMode) {
            this.matchMode = matchMode;
            return this;
        }

        public WatchOptions build() {
            return new WatchOptions(chain, finalized, historicalCheckBlocks, timeoutSeconds, stopAfter,
                    abortable, predicate, matchMode);
        }
    }
}
