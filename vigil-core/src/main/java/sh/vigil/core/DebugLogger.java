// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core;

import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in trace output for Vigil, written at INFO to the {@code sh.vigil.debug}
 * logger.
 *
 * <p>
 * Each method belongs to a channel switched on through {@link VigilDebug}:
 * {@link #logRpc} for JSON-RPC frames and subscription routing,
 * {@link #logWatch} for watcher phases, matches and dispatched heads, and
 * {@link #log} for pool and cache bookkeeping. Messages use
 * {@link String#formatted} placeholders and pass through
 * {@link LogSanitizer} before they are written.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.vigil.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        write(VigilDebug::isRpcLoggingEnabled, message, args);
    }

    public static void logWatch(final String message, final Object... args) {
        write(VigilDebug::isWatchLoggingEnabled, message, args);
    }

    /** Pool and cache bookkeeping; on whenever any channel is. */
    public static void log(final String message, final Object... args) {
        write(VigilDebug::isEnabled, message, args);
    }

    private static void write(final BooleanSupplier channel, final String message, final Object... args) {
        if (!channel.getAsBoolean()) {
            return;
        }
        final String line = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(line));
    }
}
