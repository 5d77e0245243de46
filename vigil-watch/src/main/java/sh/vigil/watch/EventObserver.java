// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.error.WatchTimeoutException;
import sh.vigil.core.model.ChainEvent;
import sh.vigil.watch.EventWatcher.Interrupt;
import sh.vigil.watch.EventWatcher.Outcome;

/**
 * Entry point for waiting on chain events.
 *
 * <p>
 * Every call starts one independent watch on the registry's I/O executor and
 * returns immediately. Watches on the same chain and head stream share one
 * subscription.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * EventObserver observer = new EventObserver(registry);
 *
 * ChainEvent swap = observer.watchEvent("swapping:SwapExecuted", WatchOptions.builder()
 *         .historicalCheckBlocks(5)
 *         .timeoutSeconds(60)
 *         .predicate(e -> e.data().path("swapId").asLong() == swapId)
 *         .build())
 *     .await();
 *
 * AbsenceHandle noRefund = observer.watchAbsence("swapping:RefundEgressScheduled", WatchOptions.defaults());
 * ...
 * noRefund.stop().join();
 * }</pre>
 */
public final class EventObserver {

    private static final Logger log = LoggerFactory.getLogger(EventObserver.class);

    private final SubscriptionRegistry registry;

    public EventObserver(final SubscriptionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public WatchHandle<ChainEvent> watchEvent(final String namePattern) {
        return watchEvent(namePattern, WatchOptions.defaults());
    }

    /**
     * Waits for the first event matching {@code namePattern} and the options'
     * predicate. {@code stopAfter} is ignored.
     */
    public WatchHandle<ChainEvent> watchEvent(final String namePattern, final WatchOptions options) {
        final EventPattern pattern = EventPattern.parse(namePattern);
        final Started<ChainEvent> started = start(pattern.toString(), matcher(pattern, options),
                StopCondition.first(), options, watcher -> firstOrNull(watcher.run()));
        return handle(pattern.toString(), started, options.abortable());
    }

    public WatchHandle<List<ChainEvent>> watchEvents(final String namePattern) {
        return watchEvents(namePattern, WatchOptions.defaults());
    }

    /**
     * Collects events matching {@code namePattern} until the options'
     * {@code stopAfter} condition is met. The list is in chain order.
     */
    public WatchHandle<List<ChainEvent>> watchEvents(final String namePattern, final WatchOptions options) {
        final EventPattern pattern = EventPattern.parse(namePattern);
        final Started<List<ChainEvent>> started = start(pattern.toString(), matcher(pattern, options),
                options.stopAfter(), options, watcher -> watcher.run().matches());
        return handle(pattern.toString(), started, options.abortable());
    }

    /**
     * Checks that no event matching {@code namePattern} occurs until the
     * returned handle is stopped or the timeout elapses. The check is always
     * abortable.
     */
    public AbsenceHandle watchAbsence(final String namePattern, final WatchOptions options) {
        final EventPattern pattern = EventPattern.parse(namePattern);
        final String description = pattern.toString();
        final Started<Void> started = start(description, matcher(pattern, options), StopCondition.first(), options,
                watcher -> {
                    final Outcome outcome;
                    try {
                        outcome = watcher.run();
                    } catch (WatchTimeoutException e) {
                        log.debug("Absence window for {} elapsed without a match", description);
                        return null;
                    }
                    if (!outcome.matches().isEmpty()) {
                        throw new UnexpectedEventError(description, outcome.matches().get(0));
                    }
                    return null;
                });
        return new AbsenceHandle(started.result(), () -> started.interrupt().complete(Interrupt.ABORT));
    }

    /**
     * Waits for the first event matching any of {@code namedPatterns}, keyed
     * by the caller's name for the pattern. When an event matches several
     * patterns, the first in map iteration order wins.
     */
    public WatchHandle<KeyedEvent> watchOneOf(final Map<String, String> namedPatterns, final WatchOptions options) {
        Objects.requireNonNull(namedPatterns, "namedPatterns");
        if (namedPatterns.isEmpty()) {
            throw new IllegalArgumentException("namedPatterns must not be empty");
        }
        final Map<String, EventPattern> patterns = new LinkedHashMap<>();
        namedPatterns.forEach((key, value) -> patterns.put(key, EventPattern.parse(value)));
        final String description = "oneOf" + patterns;

        final Predicate<ChainEvent> matcher = event -> keyOf(patterns, event, options.matchMode()) != null
                && options.predicate().test(event);
        final Started<KeyedEvent> started = start(description, matcher, StopCondition.first(), options, watcher -> {
            final ChainEvent event = firstOrNull(watcher.run());
            if (event == null) {
                return null;
            }
            return new KeyedEvent(Objects.requireNonNull(keyOf(patterns, event, options.matchMode())), event);
        });
        return handle(description, started, options.abortable());
    }

    private <T> Started<T> start(
            final String description,
            final Predicate<ChainEvent> matcher,
            final StopCondition stopAfter,
            final WatchOptions options,
            final Function<EventWatcher, T> body) {
        final String chainId = registry.config().resolveChain(options.chain());
        final CompletableFuture<Interrupt> interrupt = new CompletableFuture<>();
        final EventWatcher watcher = new EventWatcher(
                description,
                registry.multiplexer(chainId, options.finalized()),
                registry.cache(chainId),
                matcher,
                stopAfter,
                options.historicalCheckBlocks(),
                interrupt);
        final CompletableFuture<T> result = new CompletableFuture<>();
        log.debug("Watching {} on {} ({} heads, history={}, timeout={}s)", description, chainId,
                options.finalized() ? "finalized" : "best", options.historicalCheckBlocks(), options.timeoutSeconds());

        try {
            if (options.hasTimeout()) {
                final ScheduledFuture<?> timer = registry.scheduler().schedule(
                        () -> interrupt.complete(Interrupt.TIMEOUT), options.timeoutSeconds(), TimeUnit.SECONDS);
                result.whenComplete((value, error) -> timer.cancel(false));
            }
            registry.ioExecutor().execute(() -> {
                try {
                    result.complete(body.apply(watcher));
                } catch (RuntimeException | AssertionError e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            interrupt.complete(Interrupt.ABORT);
            result.completeExceptionally(new IllegalStateException("SubscriptionRegistry is closed", e));
        }
        return new Started<>(result, interrupt);
    }

    private static <T> WatchHandle<T> handle(
            final String description, final Started<T> started, final boolean abortable) {
        final Runnable stopper = abortable ? () -> started.interrupt().complete(Interrupt.ABORT) : null;
        return new WatchHandle<>(description, started.result(), stopper);
    }

    private static Predicate<ChainEvent> matcher(final EventPattern pattern, final WatchOptions options) {
        final MatchMode mode = options.matchMode();
        final Predicate<ChainEvent> predicate = options.predicate();
        return event -> pattern.matches(event, mode) && predicate.test(event);
    }

    private static @Nullable String keyOf(
            final Map<String, EventPattern> patterns, final ChainEvent event, final MatchMode mode) {
        for (Map.Entry<String, EventPattern> entry : patterns.entrySet()) {
            if (entry.getValue().matches(event, mode)) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static @Nullable ChainEvent firstOrNull(final Outcome outcome) {
        return outcome.matches().isEmpty() ? null : outcome.matches().get(0);
    }

    private record Started<T>(CompletableFuture<T> result, CompletableFuture<Interrupt> interrupt) {
    }
}
