// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.model;

import java.util.Objects;

import sh.vigil.core.types.Hash;

/**
 * Represents a block header as seen by a chain client.
 *
 * @param hash       the block hash
 * @param number     the block number (height)
 * @param parentHash the hash of the parent block
 */
public record BlockHeader(Hash hash, long number, Hash parentHash) {

    public BlockHeader {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(parentHash, "parentHash");
        if (number < 0) {
            throw new IllegalArgumentException("number must be >= 0, got: " + number);
        }
    }

    public boolean isGenesis() {
        return number == 0;
    }
}
