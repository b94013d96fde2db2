package com.questrail.realm.engine.internal.effects;

import com.questrail.realm.engine.internal.dispatch.OutboundEvent;
import com.questrail.realm.engine.internal.exec.EngineContext;
import com.questrail.realm.engine.internal.time.CallbackId;
import com.questrail.realm.engine.internal.world.Entity;

import java.util.Objects;

/**
 * RegenerationSystem
 * =============================================================================
 * World-wide recurring tick that restores health to resting entities.
 *
 * <h2>Who regenerates</h2>
 * An entity heals on a tick when it is alive, placed in a room, below maximum
 * health and not in combat. Slain NPCs waiting to respawn are not placed and
 * are skipped.
 *
 * <h2>Scheduling</h2>
 * One recurring series on the engine scheduler, fixed-schedule like every other
 * series, so ticks land at {@code start + n * interval}. A policy with zero
 * health per tick never schedules.
 */
public final class RegenerationSystem
{
    private final EngineContext ctx;
    private final RegenerationPolicy policy;

    private CallbackId series;

    public RegenerationSystem(EngineContext ctx, RegenerationPolicy policy) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public RegenerationPolicy policy() {
        return policy;
    }

    /**
     * Schedules the tick series. Idempotent.
     *
     * @return {@code true} if this call scheduled it
     */
    public boolean start() {
        if (series != null || policy.healthPerTick() == 0) {
            return false;
        }
        series = ctx.scheduler().scheduleRecurring(policy.interval(), policy.interval(), this::tick);
        return true;
    }

    public void stop() {
        if (series != null) {
            ctx.scheduler().cancel(series);
            series = null;
        }
    }

    public boolean isRunning() {
        return series != null && ctx.scheduler().isPending(series);
    }

    void tick() {
        for (Entity entity : ctx.world().entities()) {
            if (!entity.isAlive()
                    || entity.room().isEmpty()
                    || entity.combat().inCombat()
                    || entity.currentHealth() >= entity.maxHealth()) {
                continue;
            }
            entity.heal(policy.healthPerTick());
            ctx.dispatcher().publish(OutboundEvent.statUpdate(entity));
            ctx.dirty().markDirty(entity.id());
        }
    }
}
