// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc.internal;

import java.lang.reflect.Array;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import sh.vigil.core.error.RpcException;
import sh.vigil.rpc.JsonRpcError;

/**
 * Internal utility methods for RPC data decoding and error handling.
 *
 * <p>
 * This class consolidates common RPC-related operations used across the RPC
 * layer:
 * <ul>
 * <li>Hex quantity decoding ("0x..." strings to numbers)</li>
 * <li>JSON-RPC error data extraction</li>
 * <li>Endpoint URL validation</li>
 * <li>Shared ObjectMapper instance</li>
 * </ul>
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 *
 * @see RpcException
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance for JSON-RPC frames and the
     * debug journal.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** URL schemes accepted for WebSocket endpoints. */
    public static final Set<String> WS_SCHEMES = Set.of("ws", "wss");

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Recursively extracts error data from nested JSON-RPC error payloads.
     *
     * <p>
     * Nodes often return {@code {data: {data: "..."}}}; this flattens to the
     * innermost string.
     *
     * @param dataValue the error data object from a JSON-RPC response
     * @return extracted error data string, or null if dataValue is null
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof JsonNode node) {
            return extractFromNode(node);
        }
        if (dataValue instanceof Map<?, ?> map) {
            return map.values().stream()
                    .map(RpcUtils::extractErrorData)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElseGet(dataValue::toString);
        }
        if (dataValue.getClass().isArray()) {
            return extractFromArray(dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            for (final Object item : iterable) {
                final String extracted = extractErrorData(item);
                if (extracted != null) {
                    return extracted;
                }
            }
        }
        return dataValue.toString();
    }

    private static @Nullable String extractFromNode(final JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        for (final JsonNode child : node) {
            final String extracted = extractFromNode(child);
            if (extracted != null) {
                return extracted;
            }
        }
        return node.toString();
    }

    private static String extractFromArray(final Object array) {
        final int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            final String extracted = extractErrorData(Array.get(array, i));
            if (extracted != null) {
                return extracted;
            }
        }
        return array.toString();
    }

    /**
     * Converts a JSON-RPC error object into an {@link RpcException}.
     */
    public static RpcException toRpcException(final JsonRpcError error, final @Nullable Long requestId) {
        return new RpcException(
                error.code(),
                error.message() != null ? error.message() : "JSON-RPC error " + error.code(),
                extractErrorData(error.data()),
                requestId,
                null);
    }

    /**
     * Decodes a hex quantity string such as {@code "0x1a"} to a long.
     *
     * @throws IllegalArgumentException if the value is not a hex quantity
     */
    public static long decodeHexLong(final String value) {
        Objects.requireNonNull(value, "value");
        final String normalized = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
        if (normalized.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseUnsignedLong(normalized, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid hex quantity: " + value, e);
        }
    }

    /**
     * Decodes a block number field that may be a hex quantity string or a
     * plain JSON number.
     */
    public static long decodeNumber(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("missing block number");
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        return decodeHexLong(node.asText());
    }

    /**
     * Safely converts object to string, returning null for null inputs.
     */
    public static @Nullable String stringValue(final @Nullable Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Validates that {@code url} is an absolute URI with one of the given
     * schemes.
     *
     * @throws IllegalArgumentException if the URL is missing, malformed, or
     *                                  has a disallowed scheme
     */
    public static void validateUrl(final @Nullable String url, final Set<String> schemes) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url is not a valid URI: " + e.getReason(), e);
        }
        final String scheme = uri.getScheme();
        if (scheme == null || !schemes.contains(scheme.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "url must use " + String.join(" or ", new TreeSet<>(schemes)) + " scheme, got: " + scheme);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("url must have a valid host");
        }
    }
}
