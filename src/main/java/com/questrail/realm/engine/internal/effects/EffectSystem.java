package com.questrail.realm.engine.internal.effects;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.internal.dispatch.EventDispatcher;
import com.questrail.realm.engine.internal.dispatch.EventKind;
import com.questrail.realm.engine.internal.dispatch.OutboundEvent;
import com.questrail.realm.engine.internal.exec.EngineContext;
import com.questrail.realm.engine.internal.time.CallbackId;
import com.questrail.realm.engine.internal.time.TimedCallbackScheduler;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.internal.world.Stat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * EffectSystem
 * =============================================================================
 * Applies timed effects and drives their periodic ticks and expiration through
 * the scheduler.
 *
 * <h2>Lifecycle of an effect</h2>
 * <pre>
 *   apply  → stored on the entity
 *          → periodic tick scheduled (DOT / HOT only, recurring)
 *          → expiration scheduled
 *   expire → periodic tick cancelled, effect removed exactly once
 * </pre>
 *
 * <p>The periodic tick is scheduled before the expiration, so when both fall
 * due at the same instant the final tick lands before the effect is removed.</p>
 *
 * <h2>Stale callbacks</h2>
 * Callbacks capture ids only. If the entity or effect is gone when a callback
 * fires, it does nothing.
 *
 * <p>Loop thread only.</p>
 */
public final class EffectSystem
{
    private final EngineContext ctx;
    private long nextId = 1;

    public EffectSystem(EngineContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Applies {@code spec} to a living entity.
     *
     * @return the new effect's id, or empty if the entity is unknown or dead
     */
    public Optional<EffectId> apply(EntityId entityId, EffectSpec spec) {
        Objects.requireNonNull(spec, "spec");
        Optional<Entity> found = ctx.world().entity(entityId).filter(Entity::isAlive);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Entity entity = found.get();
        TimedCallbackScheduler scheduler = ctx.scheduler();

        EffectId effectId = new EffectId(nextId++);
        Effect effect = new Effect(effectId, spec, ctx.nowNanos());
        entity.addEffect(effect);

        CallbackId periodic = null;
        if (spec.type().periodic()) {
            periodic = scheduler.scheduleRecurring(spec.interval(), spec.interval(),
                    () -> tick(entityId, effectId));
            effect.periodicHandle(periodic);
        }
        CallbackId series = periodic;
        effect.expirationHandle(scheduler.schedule(spec.duration(), () -> expire(entityId, effectId, series)));

        EventDispatcher out = ctx.dispatcher();
        out.publish(OutboundEvent.toParticipant(entityId, EventKind.EFFECT, appliedText(spec),
                Map.of("effect", spec.name(), "effect_id", effectId.toString(), "state", "applied")));
        out.publish(OutboundEvent.statUpdate(entity));
        ctx.dirty().markDirty(entityId);
        return Optional.of(effectId);
    }

    /**
     * Removes an effect early, cancelling both of its scheduled callbacks.
     *
     * @return {@code true} if the effect was active
     */
    public boolean remove(EntityId entityId, EffectId effectId) {
        Optional<Entity> entity = ctx.world().entity(entityId);
        Optional<Effect> removed = entity.flatMap(e -> e.removeEffect(effectId));
        if (removed.isEmpty()) {
            return false;
        }
        cancelHandles(removed.get());
        ctx.dispatcher().publish(OutboundEvent.toParticipant(entityId, EventKind.EFFECT,
                removed.get().name() + " is removed.",
                Map.of("effect", removed.get().name(), "effect_id", effectId.toString(), "state", "removed")));
        ctx.dispatcher().publish(OutboundEvent.statUpdate(entity.get()));
        ctx.dirty().markDirty(entityId);
        return true;
    }

    /**
     * Cancels only the expiration of an active effect. Its modifiers stay in
     * force until {@link #remove} is called; periodic ticks continue.
     *
     * @return {@code true} if an outstanding expiration was cancelled
     */
    public boolean cancelExpiration(EntityId entityId, EffectId effectId) {
        Optional<Effect> effect = ctx.world().entity(entityId).flatMap(e -> e.effect(effectId));
        if (effect.isEmpty()) {
            return false;
        }
        boolean cancelled = effect.get().expirationHandle().map(ctx.scheduler()::cancel).orElse(false);
        effect.get().expirationHandle(null);
        return cancelled;
    }

    /**
     * Silently drops every effect on {@code entity}. Used on death.
     */
    public void clearAll(Entity entity) {
        for (Effect effect : new ArrayList<>(entity.effects())) {
            entity.removeEffect(effect.id());
            cancelHandles(effect);
        }
    }

    /**
     * Human-readable listing of active effects.
     */
    public String summary(Entity entity) {
        if (entity.effects().isEmpty()) {
            return "You have no active effects.";
        }
        long now = ctx.nowNanos();
        List<String> lines = new ArrayList<>();
        lines.add("Active effects:");
        for (Effect effect : entity.effects()) {
            EffectSpec spec = effect.spec();
            StringBuilder line = new StringBuilder();
            line.append("  ").append(spec.name())
                .append(" (").append(spec.type().name().toLowerCase(Locale.ROOT)).append(")");
            if (effect.expirationHandle().isPresent()) {
                line.append(String.format(Locale.ROOT, ", %.1fs remaining", effect.remainingNanos(now) / 1e9));
            }
            for (Map.Entry<Stat, Integer> m : spec.modifiers().entrySet()) {
                line.append(String.format(Locale.ROOT, ", %s %+d",
                        m.getKey().name().toLowerCase(Locale.ROOT), m.getValue()));
            }
            if (spec.type().periodic()) {
                line.append(String.format(Locale.ROOT, ", %+d HP every %.1fs",
                        spec.type() == EffectType.DOT ? -spec.magnitude() : spec.magnitude(),
                        spec.interval().toMillis() / 1000.0));
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    void tick(EntityId entityId, EffectId effectId) {
        Optional<Entity> found = ctx.world().entity(entityId);
        Optional<Effect> effect = found.flatMap(e -> e.effect(effectId));
        if (effect.isEmpty()) {
            return;
        }
        Entity entity = found.get();
        EffectSpec spec = effect.get().spec();

        String text;
        if (spec.type() == EffectType.DOT) {
            int lost = entity.damage(spec.magnitude(), 1);
            text = "You take " + lost + " " + spec.name().toLowerCase(Locale.ROOT) + " damage.";
        }
        else {
            int gained = entity.heal(spec.magnitude());
            text = "You heal for " + gained + " health.";
        }
        ctx.dispatcher().publish(OutboundEvent.toParticipant(entityId, EventKind.EFFECT, text,
                Map.of("effect", spec.name(), "effect_id", effectId.toString(), "state", "tick")));
        ctx.dispatcher().publish(OutboundEvent.statUpdate(entity));
        ctx.dirty().markDirty(entityId);
    }

    // The tick series is cancelled by handle even when the entity is gone, so a
    // stale series never outlives its expiration.
    void expire(EntityId entityId, EffectId effectId, CallbackId periodic) {
        ctx.scheduler().cancel(periodic);
        Optional<Entity> found = ctx.world().entity(entityId);
        Optional<Effect> removed = found.flatMap(e -> e.removeEffect(effectId));
        if (removed.isEmpty()) {
            return;
        }
        removed.get().expirationHandle(null);
        removed.get().periodicHandle(null);

        ctx.dispatcher().publish(OutboundEvent.toParticipant(entityId, EventKind.EFFECT,
                removed.get().name() + " wears off.",
                Map.of("effect", removed.get().name(), "effect_id", effectId.toString(), "state", "expired")));
        ctx.dispatcher().publish(OutboundEvent.statUpdate(found.get()));
        ctx.dirty().markDirty(entityId);
    }

    private void cancelHandles(Effect effect) {
        effect.expirationHandle().ifPresent(ctx.scheduler()::cancel);
        effect.periodicHandle().ifPresent(ctx.scheduler()::cancel);
        effect.expirationHandle(null);
        effect.periodicHandle(null);
    }

    private static String appliedText(EffectSpec spec) {
        long seconds = spec.duration().toSeconds();
        switch (spec.type()) {
            case DOT:
                return String.format(Locale.ROOT, "You are afflicted by %s. (%d damage every %.1fs for %ds)",
                        spec.name(), spec.magnitude(), spec.interval().toMillis() / 1000.0, seconds);
            case HOT:
                return String.format(Locale.ROOT, "You are soothed by %s. (%d health every %.1fs for %ds)",
                        spec.name(), spec.magnitude(), spec.interval().toMillis() / 1000.0, seconds);
            default:
                return "You feel the effect of " + spec.name() + ". (" + seconds + "s)";
        }
    }
}
