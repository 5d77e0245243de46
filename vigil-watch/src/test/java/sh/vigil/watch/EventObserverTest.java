// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import static org.junit.jupiter.api.Assertions.*;
import static sh.vigil.watch.MockChain.event;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.vigil.core.error.ConnectionException;
import sh.vigil.core.error.RpcException;
import sh.vigil.core.error.WatchFailedException;
import sh.vigil.core.error.WatchTimeoutException;
import sh.vigil.core.model.ChainEvent;

/**
 * End-to-end watch behavior against a {@link MockChain}.
 */
class EventObserverTest {

    private static final String CHAIN = "mock";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private MockChain chain;
    private SubscriptionRegistry registry;
    private EventObserver observer;

    @BeforeEach
    void setUp() {
        chain = new MockChain();
        VigilConfig config = VigilConfig.builder()
                .chain(ChainProfile.of(CHAIN, MockChain.DECODER))
                .build();
        registry = new SubscriptionRegistry(config, id -> chain);
        observer = new EventObserver(registry);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private void awaitListeners(int count) throws InterruptedException {
        awaitListeners(count, false);
    }

    private void awaitListeners(int count, boolean finalized) throws InterruptedException {
        assertTrue(MockChain.waitUntil(() -> registry.state(CHAIN, finalized).listenerCount() == count
                && chain.activeSubscriptions() > 0, WAIT), "expected " + count + " listener(s)");
    }

    private static <T> T result(WatchHandle<T> handle) throws Exception {
        return handle.result().get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Throwable failure(CompletableFuture<?> future) throws Exception {
        Throwable error = future.handle((value, e) -> e).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertNotNull(error, "expected the watch to fail");
        return error instanceof CompletionException ? error.getCause() : error;
    }

    private static long id(ChainEvent event) {
        return event.data().path("id").asLong();
    }

    // ==================== Scenarios ====================

    @Test
    void predicateSelectsMatchingEventFromStream() throws Exception {
        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .predicate(e -> id(e) == 5)
                .build());
        awaitListeners(1);

        chain.mine(event("Pallet", "Created", 3));
        chain.mine(event("Pallet", "Created", 5));
        chain.mine(event("Pallet", "Created", 7));

        ChainEvent found = result(handle);
        assertEquals(5, id(found));
        assertEquals(2, found.blockNumber());
    }

    @Test
    void historicalBackfillFindsEventFromRecentBlock() throws Exception {
        chain.mine(event("Pallet", "Created", 1));
        chain.mine();
        chain.mine();

        ChainEvent found = result(observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .historicalCheckBlocks(3)
                .build()));

        assertEquals(1, found.blockNumber());
        assertEquals(1, id(found));
    }

    @Test
    void stopAfterCountReturnsFirstMatchesInOrder() throws Exception {
        WatchHandle<List<ChainEvent>> handle = observer.watchEvents("Pallet:Created", WatchOptions.builder()
                .stopAfter(2)
                .build());
        awaitListeners(1);

        chain.mine(event("Pallet", "Created", 1));
        chain.mine(event("Pallet", "Created", 2));
        chain.mine(event("Pallet", "Created", 3));

        List<ChainEvent> events = result(handle);
        assertEquals(List.of(1L, 2L), events.stream().map(EventObserverTest::id).collect(Collectors.toList()));
        assertEquals(0, registry.state(CHAIN, false).listenerCount());
        assertTrue(MockChain.waitUntil(() -> chain.activeSubscriptions() == 0, WAIT));
    }

    @Test
    void absenceFailsWithOffendingEvent() throws Exception {
        AbsenceHandle handle = observer.watchAbsence("Pallet:Refunded", WatchOptions.defaults());
        awaitListeners(1);

        chain.mine(event("Pallet", "Created", 1));
        MockChain.Block offending = chain.mine(event("Pallet", "Refunded", 9));
        assertTrue(MockChain.waitUntil(() -> handle.result().isDone(), WAIT));

        Throwable error = failure(handle.stop());
        UnexpectedEventError unexpected = assertInstanceOf(UnexpectedEventError.class, error);
        assertEquals(offending.number(), unexpected.blockNumber());
        assertEquals(offending.hash(), unexpected.blockHash());
        assertEquals("Pallet:Refunded", unexpected.event().name());
        assertTrue(unexpected.getMessage().contains("#" + offending.number()));
    }

    // ==================== Absence ====================

    @Test
    void absenceSucceedsWhenStoppedWithoutMatch() throws Exception {
        AbsenceHandle handle = observer.watchAbsence("Pallet:Refunded", WatchOptions.defaults());
        awaitListeners(1);
        chain.mine(event("Pallet", "Created", 1));

        assertNull(handle.stop().get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertSame(handle.result(), handle.stop());
        assertEquals(0, registry.state(CHAIN, false).listenerCount());
    }

    @Test
    void absenceTimeoutCountsAsSuccess() throws Exception {
        AbsenceHandle handle = observer.watchAbsence("Pallet:Refunded", WatchOptions.builder()
                .timeoutSeconds(1)
                .build());

        assertNull(handle.result().get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Test
    void absenceChecksHistoricalWindow() throws Exception {
        chain.mine(event("Pallet", "Refunded", 1));
        chain.mine();

        AbsenceHandle handle = observer.watchAbsence("Pallet:Refunded", WatchOptions.builder()
                .historicalCheckBlocks(2)
                .build());

        assertInstanceOf(UnexpectedEventError.class, failure(handle.result()));
    }

    // ==================== No-miss, dedup, ordering ====================

    @Test
    void eventInBestBlockIsFoundDespiteDelayedSubscription() throws Exception {
        chain.mine(event("Pallet", "Created", 42));
        chain.closeSubscribeGate();

        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .historicalCheckBlocks(5)
                .build());
        assertTrue(chain.awaitSubscribeEntered(WAIT));
        chain.mine();
        chain.mine();
        chain.openSubscribeGate();

        ChainEvent found = result(handle);
        assertEquals(42, id(found));
        assertEquals(1, found.blockNumber());
    }

    @Test
    void windowedWatchReportsEachEventOnceInChainOrder() throws Exception {
        for (int i = 1; i <= 4; i++) {
            chain.mine(event("Pallet", "Created", i), event("Other", "Ignored", i));
        }

        WatchHandle<List<ChainEvent>> handle = observer.watchEvents("Pallet:Created", WatchOptions.builder()
                .historicalCheckBlocks(3)
                .stopAfter(StopCondition.never())
                .timeoutSeconds(1)
                .build());
        awaitListeners(1);
        chain.mine(event("Pallet", "Created", 5));

        WatchTimeoutException timeout = assertInstanceOf(WatchTimeoutException.class, failure(handle.result()));
        List<ChainEvent> matches = timeout.partialMatches();
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), matches.stream().map(EventObserverTest::id).collect(Collectors.toList()));
        for (int i = 1; i < matches.size(); i++) {
            assertTrue(matches.get(i - 1).blockNumber() <= matches.get(i).blockNumber());
        }
    }

    @Test
    void matchesWithinOneBlockKeepEventOrder() throws Exception {
        chain.mine(event("Pallet", "Created", 1), event("Pallet", "Created", 2));

        List<ChainEvent> events = result(observer.watchEvents("Pallet:Created", WatchOptions.builder()
                .stopAfter(2)
                .build()));

        assertEquals(0, events.get(0).eventIndex());
        assertEquals(1, events.get(1).eventIndex());
    }

    // ==================== Timeout / abort ====================

    @Test
    void timeoutFailsAndReleasesSubscription() throws Exception {
        long start = System.nanoTime();
        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Never", WatchOptions.builder()
                .timeoutSeconds(1)
                .build());

        WatchTimeoutException timeout = assertInstanceOf(WatchTimeoutException.class, failure(handle.result()));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsedMs >= 900 && elapsedMs < 3000, "resolved after " + elapsedMs + "ms");
        assertTrue(timeout.partialMatches().isEmpty());
        assertEquals("Pallet:Never", timeout.pattern());
        assertEquals(0, registry.state(CHAIN, false).listenerCount());
        assertFalse(registry.multiplexer(CHAIN, false).isActive());
        assertTrue(MockChain.waitUntil(() -> registry.pool().refCount(CHAIN) == 0, WAIT));
    }

    @Test
    void stopResolvesWithNullAndRestoresRefCounts() throws Exception {
        WatchHandle<ChainEvent> background = observer.watchEvent("Pallet:Background", WatchOptions.builder()
                .abortable(true)
                .build());
        awaitListeners(1);
        assertTrue(MockChain.waitUntil(() -> registry.pool().refCount(CHAIN) == 1, WAIT));

        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .abortable(true)
                .build());
        awaitListeners(2);
        handle.stop();

        assertNull(result(handle));
        assertEquals(1, registry.state(CHAIN, false).listenerCount());
        assertEquals(1, registry.pool().refCount(CHAIN));
        assertEquals(1, chain.subscribeCalls());

        background.stop();
        assertNull(result(background));
    }

    @Test
    void stoppedMultiMatchWatchResolvesWithEmptyList() throws Exception {
        WatchHandle<List<ChainEvent>> handle = observer.watchEvents("Pallet:Created", WatchOptions.builder()
                .stopAfter(3)
                .abortable(true)
                .build());
        awaitListeners(1);
        chain.mine(event("Pallet", "Created", 1));

        handle.stop();

        assertEquals(List.of(), result(handle));
    }

    @Test
    void stopOnNonAbortableWatchIsRejected() throws Exception {
        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .timeoutSeconds(1)
                .build());

        assertFalse(handle.isAbortable());
        assertThrows(IllegalStateException.class, handle::stop);
        assertInstanceOf(WatchTimeoutException.class, failure(handle.result()));
    }

    // ==================== Interrupts away from a blocked take ====================

    @Test
    void timeoutFiresWhileSubscribeIsBlocked() throws Exception {
        chain.closeSubscribeGate();
        long start = System.nanoTime();
        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .timeoutSeconds(1)
                .build());
        assertTrue(chain.awaitSubscribeEntered(WAIT));

        Throwable error;
        try {
            error = failure(handle.result());
        } finally {
            chain.openSubscribeGate();
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertInstanceOf(WatchTimeoutException.class, error);
        assertTrue(elapsedMs < 3000, "resolved after " + elapsedMs + "ms");
        assertEquals(0, registry.state(CHAIN, false).listenerCount());
        assertTrue(MockChain.waitUntil(() -> chain.unsubscribeCalls() == 1, WAIT));
        assertTrue(MockChain.waitUntil(() -> registry.pool().refCount(CHAIN) == 0, WAIT));
        assertEquals(0, chain.activeSubscriptions());
    }

    @Test
    void stopResolvesEveryWatchWhileSubscribeIsBlocked() throws Exception {
        chain.closeSubscribeGate();
        WatchHandle<ChainEvent> first = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .abortable(true)
                .build());
        WatchHandle<List<ChainEvent>> second = observer.watchEvents("Pallet:Created", WatchOptions.builder()
                .stopAfter(2)
                .abortable(true)
                .build());
        assertTrue(chain.awaitSubscribeEntered(WAIT));
        assertTrue(MockChain.waitUntil(() -> registry.state(CHAIN, false).listenerCount() == 2, WAIT));

        long start = System.nanoTime();
        try {
            first.stop();
            second.stop();
            assertNull(first.result().get(2, TimeUnit.SECONDS));
            assertEquals(List.of(), second.result().get(2, TimeUnit.SECONDS));
        } finally {
            chain.openSubscribeGate();
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsedMs < 2000, "stopped after " + elapsedMs + "ms");
        assertTrue(MockChain.waitUntil(() -> registry.pool().refCount(CHAIN) == 0, WAIT));
        assertEquals(0, chain.activeSubscriptions());
        assertEquals(1, chain.subscribeCalls());
    }

    @Test
    void timeoutInterruptsBlockedHistoricalFetch() throws Exception {
        chain.mine(event("Pallet", "Created", 1));
        chain.mine();
        chain.mine();
        registry.cache(CHAIN).load(chain.best().header()).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        CountDownLatch gate = chain.gateQueries();

        long start = System.nanoTime();
        WatchHandle<List<ChainEvent>> handle = observer.watchEvents("Pallet:Created", WatchOptions.builder()
                .historicalCheckBlocks(3)
                .stopAfter(StopCondition.never())
                .timeoutSeconds(1)
                .build());

        Throwable error;
        try {
            error = failure(handle.result());
        } finally {
            gate.countDown();
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        WatchTimeoutException timeout = assertInstanceOf(WatchTimeoutException.class, error);
        assertTrue(timeout.partialMatches().isEmpty());
        assertTrue(elapsedMs < 3000, "resolved after " + elapsedMs + "ms");
        assertEquals(0, registry.state(CHAIN, false).listenerCount());
    }

    @Test
    void slowUnsubscribeOnOneChainDoesNotDelayOtherTimeouts() throws Exception {
        MockChain slow = new MockChain();
        MockChain other = new MockChain();
        slow.delayUnsubscribe(Duration.ofSeconds(4));
        VigilConfig config = VigilConfig.builder()
                .chain(ChainProfile.of("slow", MockChain.DECODER))
                .chain(ChainProfile.of("other", MockChain.DECODER))
                .build();
        try (SubscriptionRegistry twoChains = new SubscriptionRegistry(config, id -> "slow".equals(id) ? slow : other)) {
            EventObserver watcher = new EventObserver(twoChains);

            long start = System.nanoTime();
            WatchHandle<ChainEvent> onSlow = watcher.watchEvent("Pallet:Never", WatchOptions.builder()
                    .chain("slow")
                    .timeoutSeconds(1)
                    .build());
            WatchHandle<ChainEvent> onOther = watcher.watchEvent("Pallet:Never", WatchOptions.builder()
                    .chain("other")
                    .timeoutSeconds(2)
                    .build());

            assertInstanceOf(WatchTimeoutException.class, failure(onSlow.result()));
            assertInstanceOf(WatchTimeoutException.class, failure(onOther.result()));

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(elapsedMs < 3000, "second timeout resolved after " + elapsedMs + "ms");
        }
    }

    // ==================== Sharing and failures ====================

    @Test
    void concurrentWatchesShareOneSubscription() throws Exception {
        WatchHandle<ChainEvent> first = observer.watchEvent("Pallet:Created");
        WatchHandle<ChainEvent> second = observer.watchEvent(":Created");
        awaitListeners(2);

        chain.mine(event("Pallet", "Created", 1));

        assertEquals(1, id(result(first)));
        assertEquals(1, id(result(second)));
        assertEquals(1, chain.subscribeCalls());
    }

    @Test
    void subscriptionFailureFailsEveryWatchAndAllowsResubscribe() throws Exception {
        WatchHandle<ChainEvent> single = observer.watchEvent("Pallet:Created");
        WatchHandle<List<ChainEvent>> multi = observer.watchEvents("Pallet:Created", WatchOptions.builder()
                .stopAfter(5)
                .build());
        awaitListeners(2);

        chain.failSubscriptions(new RpcException(-32000, "WebSocket connection lost", null));

        assertInstanceOf(ConnectionException.class, failure(single.result()));
        assertInstanceOf(ConnectionException.class, failure(multi.result()));
        assertTrue(MockChain.waitUntil(() -> chain.closeCalls() == 1, WAIT));

        WatchHandle<ChainEvent> retry = observer.watchEvent("Pallet:Created");
        awaitListeners(1);
        chain.mine(event("Pallet", "Created", 1));
        assertEquals(1, id(result(retry)));
        assertEquals(2, chain.subscribeCalls());
    }

    @Test
    void throwingPredicateFailsOnlyThatWatch() throws Exception {
        WatchHandle<ChainEvent> broken = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .predicate(e -> {
                    throw new IllegalStateException("bad predicate");
                })
                .build());
        WatchHandle<ChainEvent> healthy = observer.watchEvent("Pallet:Created");
        awaitListeners(2);

        chain.mine(event("Pallet", "Created", 1));

        WatchFailedException failed = assertInstanceOf(WatchFailedException.class, failure(broken.result()));
        assertInstanceOf(IllegalStateException.class, failed.getCause());
        assertEquals(1, id(result(healthy)));
    }

    @Test
    void awaitRethrowsFailureUnwrapped() {
        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Never", WatchOptions.builder()
                .timeoutSeconds(1)
                .build());

        assertThrows(WatchTimeoutException.class, handle::await);
    }

    // ==================== Matching options ====================

    @Test
    void exactModeDoesNotMatchLongerNames() throws Exception {
        WatchHandle<ChainEvent> substring = observer.watchEvent("Balances:Transfer");
        WatchHandle<ChainEvent> exact = observer.watchEvent("Balances:Transfer", WatchOptions.builder()
                .matchMode(MatchMode.EXACT)
                .build());
        awaitListeners(2);

        chain.mine(event("Balances", "TransferAll", 1));
        chain.mine(event("Balances", "Transfer", 2));

        assertEquals("TransferAll", result(substring).methodName());
        assertEquals("Transfer", result(exact).methodName());
    }

    @Test
    void oneOfResolvesWithKeyOfMatchedPattern() throws Exception {
        Map<String, String> patterns = new LinkedHashMap<>();
        patterns.put("executed", "Swapping:SwapExecuted");
        patterns.put("refunded", "Swapping:Refunded");
        WatchHandle<KeyedEvent> handle = observer.watchOneOf(patterns, WatchOptions.defaults());
        awaitListeners(1);

        chain.mine(event("Balances", "Transfer", 1));
        chain.mine(event("Swapping", "Refunded", 2));

        KeyedEvent found = result(handle);
        assertEquals("refunded", found.key());
        assertEquals(2, id(found.event()));
    }

    @Test
    void oneOfRejectsEmptyPatterns() {
        assertThrows(IllegalArgumentException.class, () -> observer.watchOneOf(Map.of(), WatchOptions.defaults()));
    }

    @Test
    void finalizedWatchFollowsFinalizedHeads() throws Exception {
        WatchHandle<ChainEvent> handle = observer.watchEvent("Pallet:Created", WatchOptions.builder()
                .finalized(true)
                .build());
        awaitListeners(1, true);

        chain.mine(event("Pallet", "Created", 1));
        Thread.sleep(100);
        assertFalse(handle.result().isDone());

        chain.finalizeUpTo(1);

        assertEquals(1, result(handle).blockNumber());
    }

    @Test
    void unknownChainIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> observer.watchEvent("Pallet:Created",
                WatchOptions.builder().chain("elsewhere").build()));
    }
}
