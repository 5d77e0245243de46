// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import sh.vigil.core.model.BlockHeader;
import sh.vigil.core.model.ChainEvent;

/**
 * Chain-specific adapter turning raw event records into {@link ChainEvent}s.
 *
 * <p>
 * Implementations must be deterministic for a given block: the same header
 * and record always decode to an equal event. Decoded events are cached per
 * block hash and never re-decoded.
 */
@FunctionalInterface
public interface EventDecoder {

    /**
     * Decodes a single raw record.
     *
     * @param header the block the record was emitted in
     * @param record the raw record
     * @return the decoded event
     */
    ChainEvent decode(BlockHeader header, RawEventRecord record);
}
