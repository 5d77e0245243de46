// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.Objects;

import sh.vigil.core.model.ChainEvent;

/**
 * A {@code section:method} selector such as {@code swapping:SwapExecuted}.
 *
 * <p>
 * Either side may be empty to match any name: {@code :SwapExecuted} selects
 * the method in every section, {@code swapping} or {@code swapping:} every
 * event of the section.
 *
 * @param section pattern for {@link ChainEvent#sectionName()}
 * @param method  pattern for {@link ChainEvent#methodName()}
 */
public record EventPattern(String section, String method) {

    public EventPattern {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(method, "method");
    }

    /**
     * Parses {@code section:method}. The split is at the first colon.
     *
     * @throws IllegalArgumentException if {@code pattern} is blank
     */
    public static EventPattern parse(final String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("event pattern must not be blank");
        }
        final int colon = pattern.indexOf(':');
        if (colon < 0) {
            return new EventPattern(pattern.trim(), "");
        }
        return new EventPattern(pattern.substring(0, colon).trim(), pattern.substring(colon + 1).trim());
    }

    public boolean matches(final ChainEvent event, final MatchMode mode) {
        return (section.isEmpty() || mode.matches(event.sectionName(), section))
                && (method.isEmpty() || mode.matches(event.methodName(), method));
    }

    @Override
    public String toString() {
        return section + ":" + method;
    }
}
