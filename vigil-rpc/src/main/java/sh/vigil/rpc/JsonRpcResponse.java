// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import static sh.vigil.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.jspecify.annotations.Nullable;

/**
 * Represents a JSON-RPC 2.0 response from a chain node.
 * <p>
 * Holds either a successful result or an error. Use {@link #hasError()} to
 * check which is present.
 *
 * @param jsonrpc the JSON-RPC version (always "2.0")
 * @param result the result tree if successful, or {@code null} if error
 * @param error the error object if failed, or {@code null} if successful
 * @param id the request ID that this response corresponds to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable JsonNode result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    public boolean hasError() {
        return error != null;
    }

    /**
     * Returns the result as a String, or {@code null} for a missing or JSON
     * {@code null} result.
     */
    public @Nullable String resultAsString() {
        if (result == null || result.isNull()) {
            return null;
        }
        return result.isTextual() ? result.asText() : result.toString();
    }

    /**
     * Returns the result tree, substituting a {@link NullNode} for a missing
     * result.
     */
    public JsonNode resultNode() {
        return result != null ? result : NullNode.getInstance();
    }

    /**
     * Converts the result to the specified type using Jackson.
     *
     * @param type the target class type
     * @param <T> the target type
     * @return the converted result, or {@code null} if result is null
     * @throws IllegalArgumentException if the result cannot be converted
     */
    public <T> @Nullable T resultAs(Class<T> type) {
        if (result == null || result.isNull()) {
            return null;
        }
        return MAPPER.convertValue(result, type);
    }
}
