package com.questrail.realm.engine.internal.command;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CommandQueue
 * =============================================================================
 * Multi-producer, single-consumer FIFO between transport threads and the engine
 * loop.
 *
 * <h2>Ordering</h2>
 * The sequence number is assigned under the same lock that appends the command,
 * so queue order and sequence order are the same thing.
 *
 * <h2>Waiting</h2>
 * {@link #poll(Duration)} blocks the consumer until a command arrives, the
 * timeout elapses, or {@link #wakeUp()} is called. Producers never block.
 *
 * <h2>Closing</h2>
 * After {@link #close()} every enqueue is refused. Commands already queued stay
 * available to the consumer.
 */
public final class CommandQueue
{
    private final MonotonicClock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signal = lock.newCondition();
    private final ArrayDeque<Command> queue = new ArrayDeque<>();

    private long nextSequence = 1;
    private boolean closed;
    private boolean woken;

    public CommandQueue(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a raw input line.
     *
     * @return the queued command, or empty once the queue is closed
     */
    public Optional<Command> enqueue(EntityId sourceId, String text) {
        Objects.requireNonNull(text, "text");
        return offer(sourceId, Command.Kind.INPUT, text);
    }

    public Optional<Command> enqueueConnect(EntityId sourceId) {
        return offer(sourceId, Command.Kind.CONNECT, "");
    }

    public Optional<Command> enqueueDisconnect(EntityId sourceId) {
        return offer(sourceId, Command.Kind.DISCONNECT, "");
    }

    /**
     * Removes the oldest command without waiting.
     */
    public Optional<Command> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest command, waiting up to {@code timeout} for one to
     * arrive. Returns early and empty when {@link #wakeUp()} is called.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Optional<Command> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        long remaining = Math.max(0L, timeout.toNanos());
        lock.lock();
        try {
            while (queue.isEmpty() && !woken && remaining > 0L) {
                remaining = signal.awaitNanos(remaining);
            }
            woken = false;
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a consumer blocked in {@link #poll(Duration)}.
     */
    public void wakeUp() {
        lock.lock();
        try {
            woken = true;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuses all later commands and wakes the consumer.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            woken = true;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private Optional<Command> offer(EntityId sourceId, Command.Kind kind, String text) {
        Objects.requireNonNull(sourceId, "sourceId");
        lock.lock();
        try {
            if (closed) {
                return Optional.empty();
            }
            Command command = new Command(nextSequence++, sourceId, kind, text, clock.nowNanos());
            queue.addLast(command);
            signal.signal();
            return Optional.of(command);
        } finally {
            lock.unlock();
        }
    }
}
