package com.questrail.realm.engine.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every correctness decision made by the engine.
 *
 * <h2>Binding invariant</h2>
 * Callback deadlines, combat phase timing, effect durations and loop sleeps
 * MUST use a monotonic time source. Wall-clock time (e.g. {@code Instant.now()})
 * is permitted only for observability.
 *
 * <p>
 * Implementations should be backed by {@link System#nanoTime()} in production
 * and by a manually advanced clock in tests.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
