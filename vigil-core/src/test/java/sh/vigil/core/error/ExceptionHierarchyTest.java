// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.core.error;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.vigil.core.model.ChainEvent;
import sh.vigil.core.types.Hash;

class ExceptionHierarchyTest {

    @Test
    void rpcExceptionCapturesRequestIdInMessage() {
        RpcException ex = new RpcException(-32000, "test", null, 42L, null);

        assertEquals(42L, ex.requestId());
        assertTrue(ex.getMessage().contains("[requestId=42]"));
        assertEquals(-32000, ex.code());
    }

    @Test
    void rpcExceptionDetectsUnknownBlock() {
        RpcException ex = new RpcException(4003, "Client error: UnknownBlock: State already discarded", null);
        assertTrue(ex.isUnknownBlock());

        RpcException inData = new RpcException(-32000, "Server error", "unknown Block 0x12");
        assertTrue(inData.isUnknownBlock());

        assertFalse(new RpcException(-32601, "Method not found", null).isUnknownBlock());
    }

    @Test
    void connectionExceptionNamesChain() {
        ConnectionException ex = new ConnectionException("chainflip", "subscription dropped");

        assertEquals("chainflip", ex.chainId());
        assertEquals("[chainflip] subscription dropped", ex.getMessage());
    }

    @Test
    void timeoutCarriesImmutablePartialMatches() {
        List<ChainEvent> partial = new ArrayList<>();
        partial.add(new ChainEvent("p", "A", null, 1, new Hash("0x" + "1".repeat(64)), 0));

        WatchTimeoutException ex = new WatchTimeoutException("p:A", Duration.ofSeconds(3), partial);
        partial.clear();

        assertEquals(1, ex.partialMatches().size());
        assertEquals("p:A", ex.pattern());
        assertTrue(ex.getMessage().contains("3000ms"));
        assertTrue(ex.getMessage().contains("1 partial match)"));
        assertThrows(UnsupportedOperationException.class, () -> ex.partialMatches().clear());
    }

    @Test
    void allFailuresShareTheVigilRoot() {
        VigilException failed = new WatchFailedException("p:A", Duration.ZERO, new IllegalStateException("boom"));

        assertInstanceOf(WatchFailedException.class, failed);
        assertTrue(failed.getMessage().contains("boom"));
        assertInstanceOf(IllegalStateException.class, failed.getCause());
    }
}
