// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.model;

import java.util.List;
import java.util.Objects;

import sh.vigil.core.types.Hash;

/**
 * A block header together with every event decoded from that block.
 *
 * @param header the block header
 * @param events events in block order
 */
public record CacheEntry(BlockHeader header, List<ChainEvent> events) {

    public CacheEntry {
        Objects.requireNonNull(header, "header");
        events = events == null ? List.of() : List.copyOf(events);
    }

    public Hash hash() {
        return header.hash();
    }

    public long number() {
        return header.number();
    }
}
