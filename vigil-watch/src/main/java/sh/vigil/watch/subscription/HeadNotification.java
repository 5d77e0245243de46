// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.subscription;

import java.util.List;
import java.util.Objects;

import sh.vigil.core.model.BlockHeader;
import sh.vigil.core.model.ChainEvent;

/**
 * A new head together with the events decoded from it.
 *
 * @param header the head
 * @param events events of the head block, in block order
 */
public record HeadNotification(BlockHeader header, List<ChainEvent> events) {

    public HeadNotification {
        Objects.requireNonNull(header, "header");
        events = events == null ? List.of() : List.copyOf(events);
    }
}
