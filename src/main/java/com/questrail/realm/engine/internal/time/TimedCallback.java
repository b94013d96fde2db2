package com.questrail.realm.engine.internal.time;

import java.util.Objects;

/**
 * TimedCallback
 * -----------------------------------------------------------------------------
 * One entry in the {@link TimedCallbackScheduler} heap.
 *
 * <p>Entries are ordered by {@code executeAtNanos}; simultaneous entries keep
 * insertion order through {@code sequence}. The {@code cancelled} flag is only
 * consulted when the entry reaches the head of the heap (lazy cancellation).</p>
 *
 * <p>Instances are owned by the scheduler until popped and are touched only by
 * the engine loop thread, so no field is synchronized.</p>
 */
public final class TimedCallback implements Comparable<TimedCallback>
{
    private final CallbackId id;
    private final long executeAtNanos;
    private final long sequence;
    private final Runnable action;
    private final long intervalNanos;
    private boolean cancelled;

    TimedCallback(CallbackId id,
                  long executeAtNanos,
                  long sequence,
                  Runnable action,
                  long intervalNanos)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.action = Objects.requireNonNull(action, "action");
        this.executeAtNanos = executeAtNanos;
        this.sequence = sequence;
        this.intervalNanos = intervalNanos;
    }

    public CallbackId id() {
        return id;
    }

    public long executeAtNanos() {
        return executeAtNanos;
    }

    public boolean recurring() {
        return intervalNanos > 0;
    }

    public long intervalNanos() {
        return intervalNanos;
    }

    public boolean cancelled() {
        return cancelled;
    }

    /**
     * Runs the callback action on the calling thread.
     */
    public void run() {
        action.run();
    }

    void markCancelled() {
        cancelled = true;
    }

    long sequence() {
        return sequence;
    }

    /**
     * Successor for a recurring series: anchored on this entry's target time,
     * never on the time it actually fired.
     */
    TimedCallback successor() {
        return new TimedCallback(id, executeAtNanos + intervalNanos, sequence, action, intervalNanos);
    }

    @Override
    public int compareTo(TimedCallback o) {
        int byTime = Long.compare(this.executeAtNanos, o.executeAtNanos);
        return byTime != 0 ? byTime : Long.compare(this.sequence, o.sequence);
    }

    @Override
    public String toString() {
        return "TimedCallback{" + id + ", executeAtNanos=" + executeAtNanos
                + (recurring() ? ", intervalNanos=" + intervalNanos : "")
                + (cancelled ? ", cancelled" : "") + '}';
    }
}
