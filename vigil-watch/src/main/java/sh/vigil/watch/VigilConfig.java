// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Engine-wide settings.
 *
 * <p>
 * <strong>Defaults:</strong>
 * <ul>
 * <li>ageLimit: 100 blocks kept behind the best block in each cache</li>
 * <li>gracePeriod: 5 seconds before an unused connection is closed</li>
 * <li>journalPath: none (journal disabled)</li>
 * <li>defaultChain: the only configured chain, if there is exactly one</li>
 * </ul>
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * VigilConfig config = VigilConfig.builder()
 *     .chain(ChainProfile.of("localnet", "ws://127.0.0.1:9944", decoder))
 *     .ageLimit(50)
 *     .journalPath(Path.of("target/vigil-journal.jsonl"))
 *     .build();
 * }</pre>
 *
 * @param ageLimit     blocks kept behind the best block; also the maximum
 *                     historical depth
 * @param gracePeriod  delay before an unreferenced connection is closed
 * @param journalPath  JSON-lines journal file, or null to disable it
 * @param defaultChain chain used when a watch names none
 * @param chains       configured chains by id
 */
public record VigilConfig(
        int ageLimit,
        Duration gracePeriod,
        @Nullable Path journalPath,
        @Nullable String defaultChain,
        Map<String, ChainProfile> chains) {

    public static final int DEFAULT_AGE_LIMIT = 100;
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);

    public VigilConfig {
        if (ageLimit <= 0) {
            throw new IllegalArgumentException("ageLimit must be positive, got: " + ageLimit);
        }
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
        chains = Map.copyOf(Objects.requireNonNull(chains, "chains"));
        if (defaultChain == null && chains.size() == 1) {
            defaultChain = chains.keySet().iterator().next();
        }
        if (defaultChain != null && !chains.containsKey(defaultChain)) {
            throw new IllegalArgumentException("defaultChain '" + defaultChain + "' is not configured");
        }
    }

    /**
     * Returns the profile for {@code chainId}.
     *
     * @throws IllegalArgumentException if the chain is not configured
     */
    public ChainProfile profile(final String chainId) {
        final ChainProfile profile = chains.get(chainId);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown chain '" + chainId + "', configured: " + chains.keySet());
        }
        return profile;
    }

    /**
     * Resolves the chain a watch runs on.
     *
     * @throws IllegalArgumentException if {@code chainId} is null and there is
     *                                  no default chain
     */
    public String resolveChain(final @Nullable String chainId) {
        if (chainId != null) {
            return profile(chainId).chainId();
        }
        if (defaultChain == null) {
            throw new IllegalArgumentException("No chain given and no default chain configured");
        }
        return defaultChain;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link VigilConfig}.
     */
    public static final class Builder {
        private int ageLimit = DEFAULT_AGE_LIMIT;
        private Duration gracePeriod = DEFAULT_GRACE_PERIOD;
        private @Nullable Path journalPath;
        private @Nullable String defaultChain;
        private final Map<String, ChainProfile> chains = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder ageLimit(final int ageLimit) {
            this.ageLimit = ageLimit;
            return this;
        }

        public Builder gracePeriod(final Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
            return this;
        }

        public Builder journalPath(final @Nullable Path journalPath) {
            this.journalPath = journalPath;
            return this;
        }

        public Builder defaultChain(final @Nullable String defaultChain) {
            this.defaultChain = defaultChain;
            return this;
        }

        /**
         * Adds a chain. A later profile with the same id replaces the earlier
         * one.
         */
        public Builder chain(final ChainProfile profile) {
            Objects.requireNonNull(profile, "profile");
            chains.put(profile.chainId(), profile);
            return this;
        }

        public VigilConfig build() {
            return new VigilConfig(ageLimit, gracePeriod, journalPath, defaultChain, chains);
        }
    }
}
