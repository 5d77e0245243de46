// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.error;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a JSON-RPC request to a chain node fails.
 *
 * <p>
 * <strong>Common Standard Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32600</strong>: Invalid JSON-RPC request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid method parameters</li>
 * <li><strong>-32603</strong>: Internal JSON-RPC error</li>
 * <li><strong>-32000 to -32099</strong>: Server/implementation-specific
 * errors</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends VigilException {

    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data) {
        this(code, message, data, null, null);
    }

    public RpcException(final int code, final String message, final @Nullable String data,
            final @Nullable Throwable cause) {
        this(code, message, data, null, cause);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    /**
     * Whether the node reported that it does not know the requested block,
     * typically because it has been pruned or not yet imported.
     */
    public boolean isUnknownBlock() {
        return mentionsUnknownBlock(getMessage()) || mentionsUnknownBlock(data);
    }

    private static boolean mentionsUnknownBlock(final @Nullable String text) {
        if (text == null) {
            return false;
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("unknown block") || lower.contains("unknownblock");
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
