// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import sh.vigil.core.types.Hash;

/**
 * The JSON-RPC call that returns a block's raw event records.
 *
 * <p>
 * An array result yields one {@link RawEventRecord} per element; a scalar
 * result (typically the SCALE-encoded event vector as hex) yields a single
 * record at index 0; {@code null} yields no records.
 *
 * @param method the JSON-RPC method
 * @param params builds the positional parameters for a block hash
 */
public record EventsQuery(String method, Function<Hash, List<?>> params) {

    /** Storage key of {@code System.Events}: {@code twox128("System") ++ twox128("Events")}. */
    public static final String SYSTEM_EVENTS_KEY =
            "0x26aa394eea5630e07c48ae0c9558cef780d41e5e16056765bc8461851072c9d7";

    public EventsQuery {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
    }

    /**
     * {@code state_getStorage(System.Events, blockHash)}.
     */
    public static EventsQuery systemEvents() {
        return storage(SYSTEM_EVENTS_KEY);
    }

    /**
     * {@code state_getStorage(key, blockHash)} for an arbitrary storage key.
     */
    public static EventsQuery storage(String storageKey) {
        Objects.requireNonNull(storageKey, "storageKey");
        return new EventsQuery("state_getStorage", hash -> List.of(storageKey, hash.value()));
    }

    /**
     * A custom method taking the block hash as its only parameter.
     */
    public static EventsQuery byBlockHash(String method) {
        return new EventsQuery(method, hash -> List.of(hash.value()));
    }

    List<?> paramsFor(Hash hash) {
        return params.apply(hash);
    }
}
