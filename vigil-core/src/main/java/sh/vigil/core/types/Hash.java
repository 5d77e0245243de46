// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.types;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Hex-encoded 32-byte hash.
 * <p>
 * Used for block hashes and parent links.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes)</li>
 * </ul>
 * Values are normalized to lower case so that hashes received from different
 * endpoints compare equal.
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]{" + (BYTE_LENGTH * 2) + "}$");

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash("0x" + HexFormat.of().formatHex(bytes));
    }

    /**
     * Short form used in log lines, e.g. {@code 0x1a2b…9f0e}.
     */
    public String abbreviated() {
        return value.substring(0, 6) + "…" + value.substring(value.length() - 4);
    }

    @Override
    public String toString() {
        return value;
    }
}
