// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

/**
 * How the parts of an {@link EventPattern} are compared with an event's
 * section and method names. An empty pattern part matches any name in both
 * modes.
 */
public enum MatchMode {

    /** The name contains the pattern part. {@code Transfer} also matches {@code TransferAll}. */
    SUBSTRING {
        @Override
        boolean matches(final String name, final String part) {
            return name.contains(part);
        }
    },

    /** The name equals the pattern part. */
    EXACT {
        @Override
        boolean matches(final String name, final String part) {
            return name.equals(part);
        }
    };

    abstract boolean matches(String name, String part);
}
