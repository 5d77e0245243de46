// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.DebugLogger;
import sh.vigil.core.error.ConnectionException;
import sh.vigil.core.error.WatchFailedException;
import sh.vigil.core.error.WatchTimeoutException;
import sh.vigil.core.model.CacheEntry;
import sh.vigil.core.model.ChainEvent;
import sh.vigil.core.types.Hash;
import sh.vigil.watch.cache.EventCache;
import sh.vigil.watch.subscription.HeadNotification;
import sh.vigil.watch.subscription.HeadSubscriptionMultiplexer;
import sh.vigil.watch.subscription.NotificationStream;

/**
 * One "wait for matching events" request, run to completion on a single
 * thread.
 *
 * <p>
 * Phases:
 * <ol>
 * <li>{@code AWAIT_FIRST_NOTIFICATION}: attach to the multiplexer and take
 * the first head, which is the best block at attach time</li>
 * <li>{@code CHECK_CURRENT_BATCH}: match that block's events</li>
 * <li>{@code CHECK_HISTORICAL_BATCH}: match up to
 * {@code historicalCheckBlocks} ancestors, oldest first</li>
 * <li>{@code SUBSCRIBE_LOOP}: match every following head</li>
 * </ol>
 * Each block hash is checked at most once. The stop condition is evaluated
 * after every match; the collected matches are returned in chain order.
 *
 * <p>
 * Completing the interrupt future ends the watch at its next suspension
 * point: {@link Interrupt#TIMEOUT} fails it with
 * {@link WatchTimeoutException}, {@link Interrupt#ABORT} returns an aborted
 * outcome. Completing it only wakes this watcher; the listener is detached
 * by the watcher's own thread before {@link #run()} returns.
 */
final class EventWatcher {

    private static final Logger log = LoggerFactory.getLogger(EventWatcher.class);

    enum Phase {
        INIT,
        AWAIT_FIRST_NOTIFICATION,
        CHECK_CURRENT_BATCH,
        CHECK_HISTORICAL_BATCH,
        SUBSCRIBE_LOOP,
        DONE
    }

    enum Interrupt {
        ABORT,
        TIMEOUT
    }

    /**
     * @param matches collected matches in chain order, empty when aborted
     * @param aborted whether the watch was stopped by its owner
     */
    record Outcome(List<ChainEvent> matches, boolean aborted) {
    }

    private final String description;
    private final HeadSubscriptionMultiplexer multiplexer;
    private final EventCache cache;
    private final Predicate<ChainEvent> matcher;
    private final StopCondition stopAfter;
    private final int historicalCheckBlocks;
    private final CompletableFuture<Interrupt> interrupt;
    private final Set<Hash> checkedBlocks = new HashSet<>();
    private final List<ChainEvent> matches = new ArrayList<>();
    private volatile Phase phase = Phase.INIT;
    private long startNanos;

    EventWatcher(
            final String description,
            final HeadSubscriptionMultiplexer multiplexer,
            final EventCache cache,
            final Predicate<ChainEvent> matcher,
            final StopCondition stopAfter,
            final int historicalCheckBlocks,
            final CompletableFuture<Interrupt> interrupt) {
        this.description = Objects.requireNonNull(description, "description");
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.stopAfter = Objects.requireNonNull(stopAfter, "stopAfter");
        this.historicalCheckBlocks = historicalCheckBlocks;
        this.interrupt = Objects.requireNonNull(interrupt, "interrupt");
    }

    Phase phase() {
        return phase;
    }

    /**
     * Runs the watch on the calling thread.
     *
     * @return the outcome once the stop condition is met or the watch is
     *         aborted
     * @throws WatchTimeoutException if the timeout fired first
     * @throws ConnectionException   if the head subscription failed
     * @throws WatchFailedException  for any other failure of this watch
     */
    Outcome run() {
        startNanos = System.nanoTime();
        if (interrupt.isDone()) {
            return interrupted();
        }
        final NotificationStream stream = NotificationStream.open(multiplexer);
        try {
            interrupt.whenComplete((reason, error) -> stream.wake());

            enter(Phase.AWAIT_FIRST_NOTIFICATION);
            final HeadNotification first = stream.take();
            if (first == null) {
                return interrupted();
            }

            enter(Phase.CHECK_CURRENT_BATCH);
            if (check(first.header().hash(), first.events())) {
                return finished();
            }

            if (historicalCheckBlocks > 0) {
                enter(Phase.CHECK_HISTORICAL_BATCH);
                for (CacheEntry ancestor : cache.walkBack(first.header().hash(), historicalCheckBlocks, interrupt)) {
                    if (check(ancestor.hash(), ancestor.events())) {
                        return finished();
                    }
                }
            }

            enter(Phase.SUBSCRIBE_LOOP);
            while (true) {
                final HeadNotification next = stream.take();
                if (next == null) {
                    return interrupted();
                }
                if (check(next.header().hash(), next.events())) {
                    return finished();
                }
            }
        } catch (CancellationException e) {
            if (interrupt.isDone()) {
                return interrupted();
            }
            throw failed(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed(e);
        } catch (ConnectionException | WatchTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failed(e);
        } finally {
            stream.cancel();
            enter(Phase.DONE);
        }
    }

    /** Returns true when the stop condition is met. */
    private boolean check(final Hash blockHash, final List<ChainEvent> events) {
        if (!checkedBlocks.add(blockHash)) {
            return false;
        }
        for (ChainEvent event : events) {
            if (!matcher.test(event)) {
                continue;
            }
            matches.add(event);
            DebugLogger.logWatch("[MATCH] %s -> %s in %s", description, event, phase);
            if (stopAfter.isMet(Collections.unmodifiableList(matches), event)) {
                return true;
            }
        }
        return false;
    }

    private Outcome finished() {
        matches.sort(ChainEvent.CHAIN_ORDER);
        log.debug("Watch for {} finished with {} match(es) after {}ms", description, matches.size(),
                elapsed().toMillis());
        return new Outcome(List.copyOf(matches), false);
    }

    private Outcome interrupted() {
        final Interrupt reason = interrupt.getNow(Interrupt.ABORT);
        if (reason == Interrupt.TIMEOUT) {
            matches.sort(ChainEvent.CHAIN_ORDER);
            throw new WatchTimeoutException(description, elapsed(), matches);
        }
        log.debug("Watch for {} aborted in {}", description, phase);
        return new Outcome(List.of(), true);
    }

    private WatchFailedException failed(final Exception cause) {
        log.warn("Watch for {} failed in {}: {}", description, phase, cause.getMessage());
        return new WatchFailedException(description, elapsed(), cause);
    }

    private void enter(final Phase next) {
        DebugLogger.logWatch("[WATCH] %s %s -> %s", description, phase, next);
        phase = next;
    }

    private Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
