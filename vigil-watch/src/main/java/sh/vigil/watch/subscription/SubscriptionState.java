// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.subscription;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import sh.vigil.core.model.BlockHeader;

/**
 * Per (chain, finalized) pair: the best header seen on the stream and the
 * number of attached listeners.
 */
public final class SubscriptionState {

    private final AtomicReference<BlockHeader> latest = new AtomicReference<>();
    private final AtomicInteger listeners = new AtomicInteger();

    public Optional<BlockHeader> latest() {
        return Optional.ofNullable(latest.get());
    }

    public int listenerCount() {
        return listeners.get();
    }

    /**
     * Moves the pointer to {@code header} if it is higher than the current
     * one.
     *
     * @return whether the pointer moved
     */
    boolean advance(final BlockHeader header) {
        while (true) {
            final BlockHeader current = latest.get();
            if (current != null && header.number() <= current.number()) {
                return false;
            }
            if (latest.compareAndSet(current, header)) {
                return true;
            }
        }
    }

    void listenerAdded() {
        listeners.incrementAndGet();
    }

    void listenersRemoved(final int count) {
        listeners.addAndGet(-count);
    }
}
