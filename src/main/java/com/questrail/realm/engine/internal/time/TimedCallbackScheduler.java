package com.questrail.realm.engine.internal.time;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * TimedCallbackScheduler
 * =============================================================================
 * Min-priority queue of timed callbacks keyed by monotonic target timestamp.
 *
 * <h2>Ordering</h2>
 * A binary heap ordered by {@code executeAt}; ties are broken by insertion
 * order, so callbacks due at the same instant run FIFO. A recurring series keeps
 * the insertion position of its first scheduling for every later firing.
 *
 * <h2>Cancellation</h2>
 * Cancellation is lazy: {@link #cancel(CallbackId)} flags the entry and
 * {@link #popReady(long)} discards it when it reaches the head of the heap.
 * Memory held by cancelled entries is bounded by the number of outstanding
 * schedules.
 *
 * <h2>Recurrence</h2>
 * Fixed-schedule: the n-th firing of a series anchored at {@code t0} with
 * interval {@code I} targets {@code t0 + n*I}. The successor is enqueued as soon
 * as the current firing is popped, before its action runs, so slow handlers
 * never push later ticks back.
 *
 * <h2>Threading</h2>
 * Not thread-safe. The scheduler belongs to the engine loop; every call comes
 * from a unit of work running on that loop.
 */
public final class TimedCallbackScheduler
{
    private final MonotonicClock clock;
    private final PriorityQueue<TimedCallback> heap = new PriorityQueue<>();

    // Current live entry per handle, so cancel() is O(1) and recurring series
    // can be cancelled through the handle returned by the first schedule.
    private final Map<CallbackId, TimedCallback> live = new HashMap<>();

    private long nextId = 1;
    private long nextSequence = 0;

    public TimedCallbackScheduler(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Schedules a one-shot callback {@code delay} from now.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    public CallbackId schedule(Duration delay, Runnable action) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(action, "action");
        requireNonNegative(delay);

        return enqueue(clock.nowNanos() + delay.toNanos(), action, 0L);
    }

    /**
     * Schedules a recurring callback whose first firing is {@code delay} from
     * now and whose later firings follow every {@code interval}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative or
     *                                  {@code interval} is not positive
     */
    public CallbackId scheduleRecurring(Duration delay, Duration interval, Runnable action) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(action, "action");
        requireNonNegative(delay);
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }

        return enqueue(clock.nowNanos() + delay.toNanos(), action, interval.toNanos());
    }

    /**
     * Cancels an outstanding callback.
     *
     * <p>Idempotent. Unknown handles and handles that already fired are ignored.</p>
     *
     * @return {@code true} if an outstanding callback was cancelled by this call
     */
    public boolean cancel(CallbackId id) {
        if (id == null) {
            return false;
        }
        TimedCallback entry = live.remove(id);
        if (entry == null || entry.cancelled()) {
            return false;
        }
        entry.markCancelled();
        return true;
    }

    /**
     * Returns {@code true} if the handle refers to a callback that has neither
     * fired (for one-shots) nor been cancelled.
     */
    public boolean isPending(CallbackId id) {
        return id != null && live.containsKey(id);
    }

    /**
     * Pops the next live callback due at or before {@code nowNanos}.
     *
     * <p>Cancelled entries met on the way are discarded. If the popped callback
     * is recurring, its successor is enqueued before this method returns.</p>
     *
     * @return the callback to run, or empty if the earliest live entry is in the future
     */
    public Optional<TimedCallback> popReady(long nowNanos) {
        purgeCancelledHead();

        TimedCallback head = heap.peek();
        if (head == null || head.executeAtNanos() > nowNanos) {
            return Optional.empty();
        }

        heap.poll();
        if (head.recurring()) {
            TimedCallback next = head.successor();
            heap.add(next);
            live.put(next.id(), next);
        }
        else {
            live.remove(head.id());
        }
        return Optional.of(head);
    }

    /**
     * Time until the earliest live callback is due.
     *
     * @return {@link Duration#ZERO} if overdue, or empty when nothing is scheduled
     */
    public Optional<Duration> timeUntilNext(long nowNanos) {
        purgeCancelledHead();

        TimedCallback head = heap.peek();
        if (head == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0L, head.executeAtNanos() - nowNanos)));
    }

    /**
     * Number of live (not cancelled) outstanding callbacks.
     */
    public int outstanding() {
        return live.size();
    }

    private CallbackId enqueue(long executeAtNanos, Runnable action, long intervalNanos) {
        CallbackId id = new CallbackId(nextId++);
        TimedCallback entry = new TimedCallback(id, executeAtNanos, nextSequence++, action, intervalNanos);
        heap.add(entry);
        live.put(id, entry);
        return id;
    }

    private void purgeCancelledHead() {
        while (!heap.isEmpty() && heap.peek().cancelled()) {
            heap.poll();
        }
    }

    private static void requireNonNegative(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
    }
}
