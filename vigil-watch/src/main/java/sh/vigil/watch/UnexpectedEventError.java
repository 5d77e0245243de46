// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import sh.vigil.core.model.ChainEvent;
import sh.vigil.core.types.Hash;

/**
 * An event that must not occur was observed by
 * {@link EventObserver#watchAbsence}.
 */
public final class UnexpectedEventError extends AssertionError {

    private static final long serialVersionUID = 1L;

    private final String pattern;
    private final transient ChainEvent event;

    public UnexpectedEventError(final String pattern, final ChainEvent event) {
        super("Unexpected event " + event.name() + " in block #" + event.blockNumber()
                + " (" + event.blockHash().abbreviated() + ", index " + event.eventIndex()
                + ") while expecting no " + pattern);
        this.pattern = pattern;
        this.event = event;
    }

    public String pattern() {
        return pattern;
    }

    public ChainEvent event() {
        return event;
    }

    public long blockNumber() {
        return event.blockNumber();
    }

    public Hash blockHash() {
        return event.blockHash();
    }
}
