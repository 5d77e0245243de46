// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import sh.vigil.core.error.RpcException;
import sh.vigil.rpc.exception.RetryExhaustedException;

class RpcRetryTest {

    private static final RpcRetryConfig FAST = RpcRetryConfig.builder()
            .maxAttempts(3)
            .backoffBaseMs(1)
            .backoffMaxMs(5)
            .build();

    @Test
    void retriesUnknownBlock() {
        final AtomicInteger calls = new AtomicInteger();
        String result = RpcRetry.run(() -> {
            if (calls.getAndIncrement() == 0) {
                throw new RpcException(4003, "Client error: UnknownBlock: State already discarded", null);
            }
            return "ok";
        }, FAST);

        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    void retriesIoErrors() {
        final AtomicInteger calls = new AtomicInteger();
        String result = RpcRetry.run(() -> {
            if (calls.getAndIncrement() == 0) {
                throw new UncheckedIOException(new IOException("connection reset"));
            }
            return "done";
        }, FAST);

        assertEquals("done", result);
        assertEquals(2, calls.get());
    }

    @Test
    void doesNotRetryMethodNotFound() {
        final AtomicInteger calls = new AtomicInteger();
        RpcException ex = assertThrows(RpcException.class, () -> RpcRetry.run(() -> {
            calls.incrementAndGet();
            throw new RpcException(-32601, "Method not found", null);
        }, FAST));

        assertEquals(-32601, ex.code());
        assertEquals(1, calls.get());
    }

    @Test
    void doesNotRetryUnrelatedRuntimeExceptions() {
        final AtomicInteger calls = new AtomicInteger();
        IllegalStateException boom = new IllegalStateException("decoder bug");
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> RpcRetry.run(() -> {
            calls.incrementAndGet();
            throw boom;
        }, FAST));

        assertSame(boom, thrown);
        assertEquals(1, calls.get());
    }

    @Test
    void exhaustionCarriesEveryAttempt() {
        final AtomicInteger calls = new AtomicInteger();
        RetryExhaustedException ex = assertThrows(RetryExhaustedException.class, () -> RpcRetry.run(() -> {
            throw new RpcException(-32603, "Internal error #" + calls.incrementAndGet(), null);
        }, FAST));

        assertEquals(3, calls.get());
        assertEquals(3, ex.getAttemptCount());
        assertEquals(-32603, ex.getRpcErrorCode());
        assertInstanceOf(RpcException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("#3"));
        assertEquals(2, ex.getSuppressed().length);
        assertTrue(ex.getSuppressed()[0].getMessage().contains("#1"));
    }

    @Test
    void singleAttemptConfigNeverRetries() {
        final AtomicInteger calls = new AtomicInteger();
        assertThrows(RetryExhaustedException.class, () -> RpcRetry.run(() -> {
            calls.incrementAndGet();
            throw new RpcException(-32000, "Request timed out after 10ms", null);
        }, RpcRetryConfig.noRetry()));

        assertEquals(1, calls.get());
    }

    @Test
    void classifiesTransientMessages() {
        assertTrue(RpcRetry.isRetryableRpcError(new RpcException(-32000, "Too Many Requests", null)));
        assertTrue(RpcRetry.isRetryableRpcError(new RpcException(-32000, "server busy", null)));
        assertTrue(RpcRetry.isRetryableRpcError(new RpcException(-32603, "boom", null)));
        assertFalse(RpcRetry.isRetryableRpcError(new RpcException(-32602, "Invalid params", null)));
    }

    @Test
    void backoffIsCappedWithJitter() {
        RpcRetryConfig config = RpcRetryConfig.builder().backoffBaseMs(100).backoffMaxMs(300).build();

        long first = RpcRetry.backoff(1, config);
        long capped = RpcRetry.backoff(10, config);

        assertTrue(first >= 110 && first <= 125, "first delay was " + first);
        assertTrue(capped >= 330 && capped <= 375, "capped delay was " + capped);
    }

    @Test
    void configRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RpcRetryConfig.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RpcRetryConfig.builder().backoffBaseMs(100).backoffMaxMs(50).build());
        assertThrows(IllegalArgumentException.class,
                () -> RpcRetryConfig.builder().jitterMin(0.3).jitterMax(0.2).build());
    }
}
