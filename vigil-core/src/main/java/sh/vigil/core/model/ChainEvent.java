// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.model;

import java.util.Comparator;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import sh.vigil.core.types.Hash;

/**
 * A decoded runtime event emitted in a block.
 *
 * <p>
 * Events are identified by {@code sectionName:methodName} (pallet and event
 * variant on Substrate chains, e.g. {@code swapping:SwapExecuted}). The
 * payload is kept as an immutable JSON tree produced by the chain's decoder.
 *
 * @param sectionName the emitting module
 * @param methodName  the event variant
 * @param data        decoded event payload
 * @param blockNumber number of the block the event was emitted in
 * @param blockHash   hash of the block the event was emitted in
 * @param eventIndex  position of the event within its block
 */
public record ChainEvent(
        String sectionName,
        String methodName,
        JsonNode data,
        long blockNumber,
        Hash blockHash,
        int eventIndex) {

    /** Orders events by block number, then by position within the block. */
    public static final Comparator<ChainEvent> CHAIN_ORDER =
            Comparator.comparingLong(ChainEvent::blockNumber).thenComparingInt(ChainEvent::eventIndex);

    public ChainEvent {
        Objects.requireNonNull(sectionName, "sectionName");
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(blockHash, "blockHash");
        data = data == null ? NullNode.getInstance() : data.deepCopy();
    }

    /**
     * Returns the qualified event name, e.g. {@code swapping:SwapExecuted}.
     */
    public String name() {
        return sectionName + ":" + methodName;
    }

    @Override
    public String toString() {
        return name() + "@" + blockNumber + "#" + eventIndex;
    }
}
