// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An undecoded event record as returned by a chain node for one block.
 *
 * <p>
 * The payload shape is chain-specific (a SCALE blob as hex string, a JSON
 * object from an indexer, ...). Turning it into a {@link sh.vigil.core.model.ChainEvent}
 * is the job of the chain's {@link EventDecoder}.
 *
 * @param index   position of the record within its block
 * @param payload raw payload
 */
public record RawEventRecord(int index, JsonNode payload) {

    public RawEventRecord {
        Objects.requireNonNull(payload, "payload");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
    }
}
