package com.questrail.realm.engine.internal.exec;

import com.questrail.realm.api.EngineStatus;
import com.questrail.realm.engine.internal.command.Command;
import com.questrail.realm.engine.internal.command.CommandProcessor;
import com.questrail.realm.engine.internal.command.CommandQueue;
import com.questrail.realm.engine.internal.time.TimedCallback;
import com.questrail.realm.engine.observability.EngineErrorEvent;
import com.questrail.realm.engine.observability.EngineLifecycleEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * EngineLoop
 * =============================================================================
 * The single worker that owns the world. Every mutation happens inside one unit
 * of work (one command or one timer callback) run to completion on this loop.
 *
 * <h2>Iteration</h2>
 * <pre>
 *   command queued?     → process exactly one command
 *   else callback due?  → run exactly one callback
 *   else                → wait for a command, at most until the next callback
 *                         is due (capped by maxPollInterval)
 *   after each unit     → flush that unit's events
 * </pre>
 * A command and a callback that are ready at the same instant resolve in favor
 * of the command.
 *
 * <h2>Faults</h2>
 * An exception escaping a unit is caught here. The unit's unflushed events are
 * discarded, the fault is reported to the observability sink with the unit's
 * identity, and the loop moves on.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()            → runs {@link #run()} on a dedicated thread
 *   loop.requestShutdown()  → queue closed; loop finishes its unit and exits
 *   loop.stop()             → requestShutdown() and join
 * </pre>
 * Before exiting, the loop hands every entity marked dirty to the persistence
 * collaborator.
 *
 * <p>Tests drive the loop without a thread through {@link #step()} and
 * {@link #runUntilIdle()}.</p>
 */
public final class EngineLoop
{
    private final EngineContext ctx;
    private final CommandQueue commands;
    private final CommandProcessor processor;
    private final Duration maxPollInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean drained = new AtomicBoolean(false);

    // Separate from the monitor held by stop() while it joins the loop thread.
    private final Object statusLock = new Object();
    private volatile EngineStatus status = EngineStatus.NEW;
    private volatile Thread loopThread;

    public EngineLoop(EngineContext ctx,
                      CommandQueue commands,
                      CommandProcessor processor,
                      Duration maxPollInterval)
    {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.maxPollInterval = Objects.requireNonNull(maxPollInterval, "maxPollInterval");
        if (maxPollInterval.isNegative() || maxPollInterval.isZero()) {
            throw new IllegalArgumentException("maxPollInterval must be > 0");
        }
    }

    public EngineStatus status() {
        return status;
    }

    /**
     * Starts the loop thread. The status is {@link EngineStatus#RUNNING} when
     * this method returns.
     * Idempotent: calling start() multiple times has no effect after the first
     * call, and start() after shutdown was requested does nothing.
     */
    public synchronized void start() {
        if (shutdownRequested.get() || !running.compareAndSet(false, true)) {
            return;
        }
        transition(EngineStatus.RUNNING);
        loopThread = new Thread(this::run, "realm-engine-loop");
        loopThread.start();
    }

    /**
     * {@code true} once {@link #start()} launched the loop thread.
     */
    public boolean isStarted() {
        return running.get();
    }

    /**
     * Requests shutdown and blocks until the loop thread terminates.
     */
    public synchronized void stop() {
        requestShutdown();
        Thread t = loopThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Sets the shutdown flag and closes the command queue. Safe from any thread.
     */
    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            commands.close();
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /**
     * Runs until shutdown is requested, then performs the shutdown drain.
     */
    public void run() {
        if (!shutdownRequested.get()) {
            transition(EngineStatus.RUNNING);
        }
        while (!shutdownRequested.get()) {
            if (step()) {
                continue;
            }
            Duration wait = ctx.scheduler().timeUntilNext(ctx.nowNanos())
                    .map(d -> d.compareTo(maxPollInterval) < 0 ? d : maxPollInterval)
                    .orElse(maxPollInterval);
            if (wait.isZero()) {
                continue;
            }
            try {
                commands.poll(wait).ifPresent(this::runCommand);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                requestShutdown();
            }
        }
        completeShutdown();
    }

    /**
     * Processes at most one unit of work without blocking.
     *
     * @return {@code true} if a unit was processed
     */
    public boolean step() {
        Optional<Command> command = commands.poll();
        if (command.isPresent()) {
            runCommand(command.get());
            return true;
        }
        Optional<TimedCallback> callback = ctx.scheduler().popReady(ctx.nowNanos());
        if (callback.isPresent()) {
            runCallback(callback.get());
            return true;
        }
        return false;
    }

    /**
     * Repeats {@link #step()} until nothing is ready at the current time.
     *
     * @return number of units processed
     */
    public int runUntilIdle() {
        int units = 0;
        while (step()) {
            units++;
        }
        return units;
    }

    /**
     * Shutdown drain: flushes dirty entities to the persistence collaborator and
     * marks the engine stopped. Runs once; later calls do nothing.
     */
    public void completeShutdown() {
        if (!drained.compareAndSet(false, true)) {
            return;
        }
        requestShutdown();
        transition(EngineStatus.DRAINING);
        try {
            ctx.dirty().flushOnShutdown();
        } catch (RuntimeException e) {
            reportFault("Shutdown flush failed", "shutdown-drain", e);
        }
        transition(EngineStatus.STOPPED);
    }

    private void runCommand(Command command) {
        try {
            processor.process(command);
            ctx.dispatcher().flush();
        } catch (RuntimeException e) {
            ctx.dispatcher().discardPending();
            reportFault("Command processing failed", command.toString(), e);
        }
    }

    private void runCallback(TimedCallback callback) {
        try {
            callback.run();
            ctx.dispatcher().flush();
        } catch (RuntimeException e) {
            ctx.dispatcher().discardPending();
            reportFault("Timer callback failed", callback.toString(), e);
        }
    }

    private void reportFault(String message, String context, Throwable cause) {
        ctx.sink().onError(new EngineErrorEvent(ctx.wallNow(), message, context, cause));
    }

    private void transition(EngineStatus next) {
        EngineStatus previous;
        synchronized (statusLock) {
            previous = status;
            if (previous == next) {
                return;
            }
            status = next;
        }
        ctx.sink().onLifecycle(new EngineLifecycleEvent(ctx.wallNow(), previous, next));
    }
}
