package com.questrail.realm.engine.internal.combat;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RoomId;
import com.questrail.realm.engine.internal.dispatch.EventDispatcher;
import com.questrail.realm.engine.internal.dispatch.EventKind;
import com.questrail.realm.engine.internal.dispatch.OutboundEvent;
import com.questrail.realm.engine.internal.effects.EffectSystem;
import com.questrail.realm.engine.internal.exec.EngineContext;
import com.questrail.realm.engine.internal.world.Direction;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.internal.world.Room;
import com.questrail.realm.engine.internal.world.Stat;
import com.questrail.realm.engine.internal.world.World;
import com.questrail.realm.engine.observability.CombatTransitionEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CombatSystem
 * =============================================================================
 * Drives the per-entity combat state machine on the engine loop.
 *
 * <h2>Phases</h2>
 * <pre>
 *   IDLE ──engage──▶ WINDUP ──swing timer──▶ SWING ──resolve──▶ RECOVERY
 *                      ▲                                           │
 *                      └──────────── recovery timer ───────────────┘
 *   any ──death / disengage / flee / move / disconnect / removal──▶ IDLE
 * </pre>
 *
 * <h2>Validation at every transition</h2>
 * Both timer callbacks start by resolving attacker and target through the
 * {@link World} and re-checking that each is alive and that they share a room.
 * A callback that captured an older {@code generation} than the state now holds
 * is stale and does nothing.
 *
 * <h2>Weapon snapshot</h2>
 * The attacker's weapon is copied into a {@link WeaponSnapshot} on every WINDUP
 * entry and nowhere else. Swapping weapons mid-swing affects only the next
 * windup.
 *
 * <h2>Damage</h2>
 * <pre>
 *   roll [min, max] + floor((str - 10) / 2)   at least 1
 *   minus target armor class / 5              at least 1
 *   critical: x multiplier, truncated
 * </pre>
 */
public final class CombatSystem
{
    private final EngineContext ctx;
    private final CombatPolicy policy;
    private final CombatDice dice;
    private final EffectSystem effects;

    public CombatSystem(EngineContext ctx, CombatPolicy policy, CombatDice dice, EffectSystem effects) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.dice = Objects.requireNonNull(dice, "dice");
        this.effects = Objects.requireNonNull(effects, "effects");
    }

    public CombatPolicy policy() {
        return policy;
    }

    // ---------------------------------------------------------------------
    // Engage / disengage
    // ---------------------------------------------------------------------

    /**
     * Reason {@code attacker} may not engage {@code target}, or empty if the
     * engagement is valid.
     */
    public Optional<String> engageRefusal(Entity attacker, Entity target) {
        if (!attacker.isAlive()) {
            return Optional.of("You can't attack while dead.");
        }
        if (attacker.combat().inCombat()) {
            String current = attacker.combat().target()
                    .flatMap(ctx.world()::entity)
                    .map(Entity::name)
                    .orElse("something");
            return Optional.of("You're already attacking " + current + "! Use 'stop' to disengage first.");
        }
        if (attacker.id().equals(target.id())) {
            return Optional.of("You can't attack yourself!");
        }
        if (!target.isAlive()) {
            return Optional.of(target.name() + " is already dead.");
        }
        if (!ctx.world().coLocated(attacker, target)) {
            return Optional.of("Your target cannot be found.");
        }
        return Optional.empty();
    }

    /**
     * IDLE to WINDUP.
     *
     * @throws IllegalStateException if {@link #engageRefusal} would refuse
     */
    public void engage(Entity attacker, Entity target) {
        Optional<String> refusal = engageRefusal(attacker, target);
        if (refusal.isPresent()) {
            throw new IllegalStateException(refusal.get());
        }
        WeaponSnapshot snapshot = startWindup(attacker, target.id());

        EventDispatcher out = ctx.dispatcher();
        out.publish(OutboundEvent.toParticipant(attacker.id(), EventKind.COMBAT,
                String.format(Locale.ROOT, "You begin attacking %s with your %s... (%.1fs)",
                        target.name(), snapshot.name(), seconds(snapshot.swingInterval().toNanos()))));
        out.publish(OutboundEvent.toParticipant(target.id(), EventKind.COMBAT,
                attacker.name() + " attacks you!"));
        attacker.room().ifPresent(r -> out.publish(OutboundEvent.toRoom(r, EventKind.COMBAT,
                attacker.name() + " attacks " + target.name() + "!", attacker.id(), target.id())));
    }

    /**
     * Voluntary stop. No-op when not in combat.
     */
    public void disengage(Entity entity) {
        if (!entity.combat().inCombat()) {
            return;
        }
        Optional<Entity> target = entity.combat().target().flatMap(ctx.world()::entity);
        reset(entity);
        ctx.dispatcher().publish(OutboundEvent.toParticipant(entity.id(), EventKind.COMBAT,
                target.map(t -> "You stop attacking " + t.name() + ".").orElse("You disengage from combat.")));
    }

    /**
     * Any phase to IDLE, cancelling the pending callback first. Silent.
     */
    public void reset(Entity entity) {
        CombatState state = entity.combat();
        if (!state.inCombat() && state.pendingEventId().isEmpty()) {
            return;
        }
        CombatPhase from = state.reset(ctx.scheduler());
        reportTransition(entity, from, CombatPhase.IDLE, null);
    }

    // ---------------------------------------------------------------------
    // Removal
    // ---------------------------------------------------------------------

    /**
     * Deletes an entity from the world.
     *
     * <p>Its pending swing and effect callbacks are cancelled, everyone attacking
     * it drops to IDLE, and its delivery queue closes. A callback that still
     * carries the id finds nothing when it fires and does nothing.</p>
     *
     * @return {@code true} if the entity existed
     */
    public boolean removeEntity(EntityId entityId) {
        Optional<Entity> found = ctx.world().entity(entityId);
        if (found.isEmpty()) {
            return false;
        }
        Entity entity = found.get();
        EventDispatcher out = ctx.dispatcher();

        for (Entity other : ctx.world().entities()) {
            if (!other.id().equals(entityId) && other.combat().target().filter(entityId::equals).isPresent()) {
                endCombat(other, entity.name() + " is gone. Combat ended.");
            }
        }
        reset(entity);
        effects.clearAll(entity);

        entity.room().ifPresent(r -> out.publish(OutboundEvent.toRoom(r, EventKind.MESSAGE,
                entity.name() + " vanishes.", entityId)));
        ctx.world().remove(entityId);
        out.unregister(entityId);
        return true;
    }

    // ---------------------------------------------------------------------
    // Flee
    // ---------------------------------------------------------------------

    /**
     * Difficulty of fleeing: 15 at full health, easier as health drops, never
     * below 5.
     */
    public int fleeDifficulty(Entity entity) {
        double missing = 1.0 - (double) entity.currentHealth() / entity.maxHealth();
        return Math.max(5, 15 - (int) (10 * missing));
    }

    /**
     * Dexterity check against {@link #fleeDifficulty}. On success the entity
     * leaves through a random exit and combat ends; on failure it stays engaged.
     *
     * @return {@code true} if the entity escaped
     */
    public boolean flee(Entity entity) {
        Room room = entity.room().flatMap(ctx.world()::room)
                .orElseThrow(() -> new IllegalStateException("entity is not placed: " + entity.id()));
        int dc = fleeDifficulty(entity);
        int roll = dice.d20();
        int dexMod = Math.floorDiv(entity.effectiveStat(Stat.DEXTERITY) - 10, 2);
        int total = roll + dexMod;
        String detail = String.format(Locale.ROOT, "(Roll: %d %+d DEX = %d vs DC %d)", roll, dexMod, total, dc);

        EventDispatcher out = ctx.dispatcher();
        if (total < dc || room.exits().isEmpty()) {
            out.publish(OutboundEvent.toParticipant(entity.id(), EventKind.COMBAT,
                    "You fail to escape! " + detail));
            return false;
        }

        List<Direction> exits = new ArrayList<>(room.exits().keySet());
        Direction direction = dice.pick(exits);
        RoomId destination = room.exits().get(direction);

        reset(entity);
        ctx.world().move(entity, destination);
        ctx.dirty().markDirty(entity.id());

        out.publish(OutboundEvent.toRoom(room.id(), EventKind.MESSAGE,
                entity.name() + " flees " + direction.label() + "!"));
        out.publish(OutboundEvent.toRoom(destination, EventKind.MESSAGE,
                entity.name() + " arrives in a hurry.", entity.id()));
        out.publish(OutboundEvent.toParticipant(entity.id(), EventKind.COMBAT,
                "You flee " + direction.label() + "! " + detail));
        return true;
    }

    // ---------------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------------

    public String status(Entity entity) {
        CombatState state = entity.combat();
        if (!state.inCombat()) {
            return "You are not in combat.";
        }
        long now = ctx.nowNanos();
        List<String> lines = new ArrayList<>();
        lines.add("Combat status");
        Optional<Entity> target = state.target().flatMap(ctx.world()::entity);
        lines.add("Target: " + target
                .map(t -> String.format(Locale.ROOT, "%s (%.0f%% health)",
                        t.name(), 100.0 * t.currentHealth() / t.maxHealth()))
                .orElse("none"));
        lines.add(String.format(Locale.ROOT, "Phase: %s (%.1fs remaining)",
                state.phase().name().toLowerCase(Locale.ROOT), seconds(state.remainingNanos(now))));
        state.snapshot().ifPresent(w -> lines.add(String.format(Locale.ROOT,
                "Weapon: %s, %d-%d %s damage, %.1fs speed",
                w.name(), w.damageMin(), w.damageMax(), w.damageType(), seconds(w.swingInterval().toNanos()))));
        return String.join("\n", lines);
    }

    // ---------------------------------------------------------------------
    // Respawn
    // ---------------------------------------------------------------------

    /**
     * Brings a dead participant back at its home room with full health.
     *
     * @throws IllegalStateException if the entity is alive
     */
    public void respawn(Entity entity) {
        if (entity.isAlive()) {
            throw new IllegalStateException("entity is alive: " + entity.id());
        }
        Optional<RoomId> previous = entity.room();
        entity.restoreFullHealth();
        ctx.world().move(entity, entity.homeRoom());
        ctx.dirty().markDirty(entity.id());

        EventDispatcher out = ctx.dispatcher();
        previous.filter(r -> !r.equals(entity.homeRoom())).ifPresent(r ->
                out.publish(OutboundEvent.toRoom(r, EventKind.MESSAGE, entity.name() + "'s body fades away.")));
        out.publish(OutboundEvent.toRoom(entity.homeRoom(), EventKind.MESSAGE,
                entity.name() + " appears in a flash of light.", entity.id()));
        out.publish(OutboundEvent.message(entity.id(), "You return to the living."));
        out.publish(OutboundEvent.statUpdate(entity));
    }

    // ---------------------------------------------------------------------
    // Timer callbacks
    // ---------------------------------------------------------------------

    void onWindupComplete(EntityId attackerId, long generation) {
        World world = ctx.world();
        Optional<Entity> found = world.entity(attackerId);
        if (found.isEmpty()) {
            return;
        }
        Entity attacker = found.get();
        CombatState state = attacker.combat();
        if (state.generation() != generation || state.phase() != CombatPhase.WINDUP) {
            return;
        }
        if (!attacker.isAlive()) {
            reset(attacker);
            return;
        }

        Optional<Entity> target = state.target().flatMap(world::entity);
        if (target.isEmpty() || !world.coLocated(attacker, target.get())) {
            endCombat(attacker, "Your target is no longer here.");
            return;
        }
        if (!target.get().isAlive()) {
            endCombat(attacker, target.get().name() + " is already dead!");
            return;
        }

        enterTimed(attacker, CombatPhase.SWING, 0L);
        resolveSwing(attacker, target.get(), state.snapshot().orElseThrow());
    }

    void onRecoveryComplete(EntityId attackerId, long generation) {
        World world = ctx.world();
        Optional<Entity> found = world.entity(attackerId);
        if (found.isEmpty()) {
            return;
        }
        Entity attacker = found.get();
        CombatState state = attacker.combat();
        if (state.generation() != generation || state.phase() != CombatPhase.RECOVERY) {
            return;
        }
        if (!attacker.isAlive()) {
            reset(attacker);
            return;
        }

        Optional<Entity> target = state.target().flatMap(world::entity);
        if (target.isEmpty() || !target.get().isAlive() || !world.coLocated(attacker, target.get())) {
            endCombat(attacker, "Combat ended.");
            return;
        }
        startWindup(attacker, target.get().id());
    }

    void respawnNpc(EntityId npcId) {
        Optional<Entity> found = ctx.world().entity(npcId);
        if (found.isEmpty() || found.get().room().isPresent()) {
            return;
        }
        Entity npc = found.get();
        npc.restoreFullHealth();
        ctx.world().move(npc, npc.homeRoom());
        ctx.dirty().markDirty(npcId);
        ctx.dispatcher().publish(OutboundEvent.toRoom(npc.homeRoom(), EventKind.MESSAGE,
                npc.name() + " appears."));
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private WeaponSnapshot startWindup(Entity attacker, EntityId targetId) {
        CombatState state = attacker.combat();
        WeaponSnapshot snapshot = WeaponSnapshot.of(attacker.weapon());
        state.engage(targetId);
        state.captureSnapshot(snapshot);

        long interval = snapshot.swingInterval().toNanos();
        long generation = enterTimed(attacker, CombatPhase.WINDUP, interval);
        EntityId attackerId = attacker.id();
        state.pending(ctx.scheduler().schedule(snapshot.swingInterval(),
                () -> onWindupComplete(attackerId, generation)));
        return snapshot;
    }

    private void resolveSwing(Entity attacker, Entity target, WeaponSnapshot weapon) {
        int damage = Math.max(1, dice.roll(weapon.damageMin(), weapon.damageMax())
                + Math.floorDiv(attacker.effectiveStat(Stat.STRENGTH) - 10, 2));
        damage = Math.max(1, damage - target.effectiveStat(Stat.ARMOR_CLASS) / 5);
        boolean critical = dice.chance(policy.criticalChance());
        if (critical) {
            damage = (int) (damage * policy.criticalMultiplier());
        }
        int dealt = target.damage(damage, 0);
        String crit = critical ? " CRITICAL!" : "";

        EventDispatcher out = ctx.dispatcher();
        Map<String, Object> payload = Map.of(
                "attacker", attacker.id().value(),
                "target", target.id().value(),
                "damage", dealt,
                "critical", critical,
                "damage_type", weapon.damageType());
        out.publish(OutboundEvent.toParticipant(attacker.id(), EventKind.COMBAT,
                "You hit " + target.name() + " for " + dealt + " damage!" + crit, payload));
        out.publish(OutboundEvent.toParticipant(target.id(), EventKind.COMBAT,
                attacker.name() + " hits you for " + dealt + " damage!" + crit, payload));
        out.publish(OutboundEvent.statUpdate(target));
        attacker.room().ifPresent(r -> out.publish(OutboundEvent.toRoom(r, EventKind.COMBAT,
                attacker.name() + " hits " + target.name() + "!" + crit, attacker.id(), target.id())));
        ctx.dirty().markDirty(target.id());

        if (!target.isAlive()) {
            handleDeath(target, attacker);
            return;
        }

        if (!target.combat().inCombat()) {
            startWindup(target, attacker.id());
            out.publish(OutboundEvent.toParticipant(target.id(), EventKind.COMBAT,
                    "You fight back against " + attacker.name() + "!"));
        }

        long recovery = policy.recoveryDelay().toNanos();
        long generation = enterTimed(attacker, CombatPhase.RECOVERY, recovery);
        EntityId attackerId = attacker.id();
        attacker.combat().pending(ctx.scheduler().schedule(policy.recoveryDelay(),
                () -> onRecoveryComplete(attackerId, generation)));
    }

    private void handleDeath(Entity victim, Entity killer) {
        World world = ctx.world();
        EventDispatcher out = ctx.dispatcher();
        Optional<RoomId> room = victim.room();

        room.ifPresent(r -> out.publish(OutboundEvent.toRoom(r, EventKind.DEATH,
                victim.name() + " has been slain by " + killer.name() + "!")));

        for (Entity other : world.entities()) {
            if (other.combat().target().filter(victim.id()::equals).isPresent()) {
                reset(other);
            }
        }
        reset(victim);
        effects.clearAll(victim);
        ctx.dirty().markDirty(victim.id());
        ctx.dirty().markDirty(killer.id());

        if (victim.isParticipant()) {
            out.publish(OutboundEvent.toParticipant(victim.id(), EventKind.DEATH,
                    "You have been slain! (Use 'respawn' to return)"));
            return;
        }

        awardExperience(killer, victim);
        world.takeOut(victim);
        EntityId victimId = victim.id();
        ctx.scheduler().schedule(policy.npcRespawnDelay(), () -> respawnNpc(victimId));
    }

    private void awardExperience(Entity killer, Entity npc) {
        int reward = npc.experienceReward();
        if (!killer.isParticipant() || reward <= 0) {
            return;
        }
        killer.gainExperience(reward);
        ctx.dispatcher().publish(OutboundEvent.toParticipant(killer.id(), EventKind.MESSAGE,
                "You gain " + reward + " experience!",
                Map.of("experience", killer.experience(), "gained", reward)));
    }

    private void endCombat(Entity attacker, String reason) {
        reset(attacker);
        ctx.dispatcher().publish(OutboundEvent.toParticipant(attacker.id(), EventKind.COMBAT, reason));
    }

    private long enterTimed(Entity entity, CombatPhase next, long durationNanos) {
        CombatState state = entity.combat();
        CombatPhase from = state.phase();
        long generation = state.enter(next, ctx.nowNanos(), durationNanos);
        reportTransition(entity, from, next, state.target().orElse(null));
        return generation;
    }

    private void reportTransition(Entity entity, CombatPhase from, CombatPhase to, EntityId target) {
        ctx.sink().onCombatTransition(new CombatTransitionEvent(ctx.wallNow(), entity.id(), from, to, target));
    }

    private static double seconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
