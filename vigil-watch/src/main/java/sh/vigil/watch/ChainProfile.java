// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.vigil.rpc.EventDecoder;
import sh.vigil.rpc.internal.RpcUtils;

/**
 * Connection and decoding settings for one chain.
 *
 * @param chainId identifier used in watch options and logs
 * @param decoder decodes the chain's raw event records
 * @param url     WebSocket endpoint, or null when clients are supplied by a
 *                custom factory
 */
public record ChainProfile(String chainId, EventDecoder decoder, @Nullable String url) {

    public ChainProfile {
        Objects.requireNonNull(chainId, "chainId");
        Objects.requireNonNull(decoder, "decoder");
        if (chainId.isBlank()) {
            throw new IllegalArgumentException("chainId must not be blank");
        }
        if (url != null) {
            RpcUtils.validateUrl(url, RpcUtils.WS_SCHEMES);
        }
    }

    public static ChainProfile of(final String chainId, final EventDecoder decoder) {
        return new ChainProfile(chainId, decoder, null);
    }

    public static ChainProfile of(final String chainId, final String url, final EventDecoder decoder) {
        return new ChainProfile(chainId, decoder, url);
    }
}
