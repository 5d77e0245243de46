// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.subscription;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.vigil.core.error.ConnectionException;
import sh.vigil.core.model.BlockHeader;
import sh.vigil.watch.MockChain;

@ExtendWith(MockitoExtension.class)
class NotificationStreamTest {

    @Mock
    private HeadSubscriptionMultiplexer multiplexer;

    private NotificationStream stream;

    @BeforeEach
    void setUp() {
        stream = NotificationStream.open(multiplexer);
    }

    private static HeadNotification head(long number) {
        return new HeadNotification(
                new BlockHeader(MockChain.hashOf(number), number, MockChain.hashOf(number - 1)), List.of());
    }

    @Test
    void openAttachesToMultiplexer() {
        verify(multiplexer).attach(stream);
    }

    @Test
    void takeReturnsNotificationsInOrder() throws Exception {
        stream.onHead(head(1));
        stream.onHead(head(2));

        assertEquals(2, stream.pending());
        assertEquals(1, stream.take().header().number());
        assertEquals(2, stream.take().header().number());
    }

    @Test
    void cancelWakesBlockedTakeAndDetachesOnce() throws Exception {
        CompletableFuture<HeadNotification> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);

        stream.cancel();
        stream.cancel();
        stream.close();

        assertNull(taken.get(5, TimeUnit.SECONDS));
        assertTrue(stream.isCancelled());
        verify(multiplexer, times(1)).detach(stream);
    }

    @Test
    void wakeReleasesBlockedTakeWithoutDetaching() throws Exception {
        CompletableFuture<HeadNotification> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);

        stream.wake();

        assertNull(taken.get(5, TimeUnit.SECONDS));
        assertNull(stream.take());
        verify(multiplexer, never()).detach(stream);

        stream.cancel();
        stream.cancel();
        verify(multiplexer, times(1)).detach(stream);
    }

    @Test
    void cancelledStreamIgnoresBufferedAndNewHeads() throws Exception {
        stream.onHead(head(1));

        stream.cancel();
        stream.onHead(head(2));

        assertNull(stream.take());
        assertNull(stream.take());
    }

    @Test
    void errorIsTerminal() throws Exception {
        ConnectionException failure = new ConnectionException("mock", "Best head subscription failed");
        stream.onHead(head(1));
        stream.onError(failure);

        assertEquals(1, stream.take().header().number());
        assertSame(failure, assertThrows(ConnectionException.class, stream::take));
        assertSame(failure, assertThrows(ConnectionException.class, stream::take));
    }
}
