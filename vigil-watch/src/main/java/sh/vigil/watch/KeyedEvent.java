// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.Objects;

import sh.vigil.core.model.ChainEvent;

/**
 * Result of {@link EventObserver#watchOneOf}: the event and the key of the
 * pattern it matched.
 *
 * @param key   the caller's key for the matched pattern
 * @param event the event
 */
public record KeyedEvent(String key, ChainEvent event) {

    public KeyedEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(event, "event");
    }
}
