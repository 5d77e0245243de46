// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.pool;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.vigil.core.error.ConnectionException;
import sh.vigil.core.error.RpcException;
import sh.vigil.rpc.ChainClient;
import sh.vigil.watch.MockChain;
import sh.vigil.watch.VigilExecutors;

@ExtendWith(MockitoExtension.class)
class ChainConnectionPoolTest {

    private static final String CHAIN = "localnet";

    @Mock
    private ChainClientFactory factory;

    @Mock
    private ChainClient client;

    @Mock
    private ChainClient freshClient;

    private ScheduledExecutorService scheduler;
    private ChainConnectionPool pool;

    @BeforeEach
    void setUp() {
        scheduler = VigilExecutors.newScheduler();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
        scheduler.shutdownNow();
    }

    @Test
    void acquireCreatesClientOnceAndCountsReferences() {
        when(factory.create(CHAIN)).thenReturn(client);
        pool = new ChainConnectionPool(factory, Duration.ofSeconds(5), scheduler, Runnable::run);

        ChainHandle first = pool.acquire(CHAIN);
        ChainHandle second = pool.acquire(CHAIN);

        assertSame(client, first.client());
        assertSame(client, second.client());
        assertEquals(2, pool.refCount(CHAIN));
        verify(factory, times(1)).create(CHAIN);
    }

    @Test
    void releaseIsIdempotentPerHandle() {
        when(factory.create(CHAIN)).thenReturn(client);
        pool = new ChainConnectionPool(factory, Duration.ofSeconds(5), scheduler, Runnable::run);
        ChainHandle first = pool.acquire(CHAIN);
        pool.acquire(CHAIN);

        first.close();
        first.close();
        pool.release(first);

        assertTrue(first.isReleased());
        assertEquals(1, pool.refCount(CHAIN));
    }

    @Test
    void clientIsClosedAfterGracePeriod() throws Exception {
        when(factory.create(CHAIN)).thenReturn(client);
        pool = new ChainConnectionPool(factory, Duration.ofMillis(50), scheduler, Runnable::run);

        try (ChainHandle handle = pool.acquire(CHAIN)) {
            assertEquals(1, pool.refCount(CHAIN));
        }

        verify(client, timeout(2000)).close();
        assertFalse(pool.isPooled(CHAIN));
        assertEquals(0, pool.refCount(CHAIN));
    }

    @Test
    void clientPastGracePeriodIsClosedOnCloserExecutor() throws Exception {
        when(factory.create(CHAIN)).thenReturn(client);
        List<Runnable> closes = new CopyOnWriteArrayList<>();
        pool = new ChainConnectionPool(factory, Duration.ofMillis(50), scheduler, closes::add);

        pool.acquire(CHAIN).close();

        assertTrue(MockChain.waitUntil(() -> closes.size() == 1, Duration.ofSeconds(2)));
        assertFalse(pool.isPooled(CHAIN));
        verify(client, never()).close();

        closes.get(0).run();
        verify(client).close();
    }

    @Test
    void reacquireWithinGracePeriodReusesClient() throws Exception {
        when(factory.create(CHAIN)).thenReturn(client);
        pool = new ChainConnectionPool(factory, Duration.ofMillis(300), scheduler, Runnable::run);

        pool.acquire(CHAIN).close();
        ChainHandle again = pool.acquire(CHAIN);
        Thread.sleep(500);

        assertSame(client, again.client());
        assertEquals(1, pool.refCount(CHAIN));
        verify(factory, times(1)).create(CHAIN);
        verify(client, never()).close();
    }

    @Test
    void concurrentAcquiresShareOneCreation() throws Exception {
        CountDownLatch creating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(factory.create(CHAIN)).thenAnswer(invocation -> {
            creating.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return client;
        });
        pool = new ChainConnectionPool(factory, Duration.ofSeconds(5), scheduler, Runnable::run);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ChainHandle> first = executor.submit(() -> pool.acquire(CHAIN));
            assertTrue(creating.await(5, TimeUnit.SECONDS));
            Future<ChainHandle> second = executor.submit(() -> pool.acquire(CHAIN));
            Thread.sleep(50);
            assertFalse(second.isDone());

            release.countDown();

            assertSame(client, first.get(5, TimeUnit.SECONDS).client());
            assertSame(client, second.get(5, TimeUnit.SECONDS).client());
            assertEquals(2, pool.refCount(CHAIN));
            verify(factory, times(1)).create(CHAIN);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void failedCreationLeavesNoEntryBehind() {
        when(factory.create(CHAIN))
                .thenThrow(new RpcException(-32000, "Failed to connect to ws://127.0.0.1:9944", null))
                .thenReturn(client);
        pool = new ChainConnectionPool(factory, Duration.ofSeconds(5), scheduler, Runnable::run);

        ConnectionException ex = assertThrows(ConnectionException.class, () -> pool.acquire(CHAIN));

        assertEquals(CHAIN, ex.chainId());
        assertInstanceOf(RpcException.class, ex.getCause());
        assertFalse(pool.isPooled(CHAIN));
        assertSame(client, pool.acquire(CHAIN).client());
    }

    @Test
    void failedCreationDropsEveryWaitersReference() throws Exception {
        CountDownLatch creating = new CountDownLatch(1);
        CountDownLatch fail = new CountDownLatch(1);
        when(factory.create(CHAIN))
                .thenAnswer(invocation -> {
                    creating.countDown();
                    assertTrue(fail.await(5, TimeUnit.SECONDS));
                    throw new RpcException(-32000, "Connection refused", null);
                })
                .thenReturn(client);
        pool = new ChainConnectionPool(factory, Duration.ofSeconds(5), scheduler, Runnable::run);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ChainHandle> first = executor.submit(() -> pool.acquire(CHAIN));
            assertTrue(creating.await(5, TimeUnit.SECONDS));
            Future<ChainHandle> second = executor.submit(() -> pool.acquire(CHAIN));
            assertTrue(MockChain.waitUntil(() -> pool.refCount(CHAIN) == 2, Duration.ofSeconds(2)));

            fail.countDown();

            for (Future<ChainHandle> waiter : List.of(first, second)) {
                ExecutionException ex = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
                assertInstanceOf(ConnectionException.class, ex.getCause());
            }
            assertFalse(pool.isPooled(CHAIN));
            assertEquals(0, pool.refCount(CHAIN));

            ChainHandle retry = pool.acquire(CHAIN);
            assertSame(client, retry.client());
            assertEquals(1, pool.refCount(CHAIN));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void invalidatedClientIsReplacedAndClosedOnLastRelease() {
        when(factory.create(CHAIN)).thenReturn(client, freshClient);
        pool = new ChainConnectionPool(factory, Duration.ofSeconds(5), scheduler, Runnable::run);
        ChainHandle broken = pool.acquire(CHAIN);
        ChainHandle otherHolder = pool.acquire(CHAIN);

        pool.invalidate(broken);
        ChainHandle replacement = pool.acquire(CHAIN);

        assertSame(freshClient, replacement.client());
        assertEquals(1, pool.refCount(CHAIN));

        broken.close();
        verify(client, never()).close();
        otherHolder.close();
        verify(client).close();
        verify(freshClient, never()).close();
    }

    @Test
    void closeClosesClientsAndRejectsAcquire() {
        when(factory.create(CHAIN)).thenReturn(client);
        pool = new ChainConnectionPool(factory, Duration.ofSeconds(5), scheduler, Runnable::run);
        ChainHandle handle = pool.acquire(CHAIN);

        pool.close();
        handle.close();

        verify(client, times(1)).close();
        assertThrows(IllegalStateException.class, () -> pool.acquire(CHAIN));
    }

    @Test
    void rejectsNegativeGracePeriod() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChainConnectionPool(factory, Duration.ofMillis(-1), scheduler, Runnable::run));
    }
}
