// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core;

/**
 * Global toggle for enabling verbose debug logging across Vigil modules.
 *
 * <p>Thread safety: The individual boolean fields are volatile. The compound
 * check in {@link #isEnabled()} is not atomic; a brief inconsistency between
 * flags only affects which debug lines are printed.
 */
public final class VigilDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean watchLogging = false;

    private VigilDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either RPC or watch logging is enabled
     */
    public static boolean isEnabled() {
        return rpcLogging || watchLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        watchLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setWatchLogging(final boolean enabled) {
        watchLogging = enabled;
    }

    public static boolean isWatchLoggingEnabled() {
        return watchLogging;
    }
}
