// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;

class VigilConfigTest {

    private static final ChainProfile LOCALNET = ChainProfile.of("localnet", "ws://127.0.0.1:9944", MockChain.DECODER);
    private static final ChainProfile DEVNET = ChainProfile.of("devnet", MockChain.DECODER);

    @Test
    void defaults() {
        VigilConfig config = VigilConfig.builder().chain(LOCALNET).build();

        assertEquals(100, config.ageLimit());
        assertEquals(Duration.ofSeconds(5), config.gracePeriod());
        assertNull(config.journalPath());
        assertEquals("localnet", config.defaultChain());
    }

    @Test
    void noImplicitDefaultWithSeveralChains() {
        VigilConfig config = VigilConfig.builder().chain(LOCALNET).chain(DEVNET).build();

        assertNull(config.defaultChain());
        assertEquals("devnet", config.resolveChain("devnet"));
        assertThrows(IllegalArgumentException.class, () -> config.resolveChain(null));
    }

    @Test
    void explicitDefaultChain() {
        VigilConfig config = VigilConfig.builder()
                .chain(LOCALNET)
                .chain(DEVNET)
                .defaultChain("devnet")
                .journalPath(Path.of("target/journal.jsonl"))
                .build();

        assertEquals("devnet", config.resolveChain(null));
        assertEquals(Path.of("target/journal.jsonl"), config.journalPath());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> VigilConfig.builder().ageLimit(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> VigilConfig.builder().gracePeriod(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> VigilConfig.builder().chain(LOCALNET).defaultChain("mainnet").build());
        assertThrows(IllegalArgumentException.class, () -> VigilConfig.builder().build().profile("localnet"));
    }

    @Test
    void profileRejectsNonWebSocketUrl() {
        assertThrows(IllegalArgumentException.class,
                () -> ChainProfile.of("localnet", "http://127.0.0.1:9944", MockChain.DECODER));
        assertThrows(IllegalArgumentException.class, () -> ChainProfile.of(" ", MockChain.DECODER));
    }
}
