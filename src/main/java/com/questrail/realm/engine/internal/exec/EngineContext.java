package com.questrail.realm.engine.internal.exec;

import com.questrail.realm.engine.internal.dispatch.EventDispatcher;
import com.questrail.realm.engine.internal.time.MonotonicClock;
import com.questrail.realm.engine.internal.time.TimedCallbackScheduler;
import com.questrail.realm.engine.internal.time.WallClock;
import com.questrail.realm.engine.internal.world.World;
import com.questrail.realm.engine.observability.EngineObservabilitySink;

import java.time.Instant;
import java.util.Objects;

/**
 * EngineContext
 * -----------------------------------------------------------------------------
 * The loop-owned collaborators every system needs, passed explicitly instead of
 * reached through static state. One instance per engine.
 *
 * <p>{@code clock} drives every correctness decision; {@code wallClock} only
 * stamps observability events.</p>
 */
public record EngineContext(MonotonicClock clock,
                            WallClock wallClock,
                            TimedCallbackScheduler scheduler,
                            World world,
                            EventDispatcher dispatcher,
                            DirtyTracker dirty,
                            EngineObservabilitySink sink)
{
    public EngineContext {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(world, "world");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(dirty, "dirty");
        Objects.requireNonNull(sink, "sink");
    }

    public long nowNanos() {
        return clock.nowNanos();
    }

    public Instant wallNow() {
        return wallClock.now();
    }
}
