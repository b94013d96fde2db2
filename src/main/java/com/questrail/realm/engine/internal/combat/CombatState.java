package com.questrail.realm.engine.internal.combat;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.internal.time.CallbackId;
import com.questrail.realm.engine.internal.time.TimedCallbackScheduler;

import java.util.Objects;
import java.util.Optional;

/**
 * CombatState
 * -----------------------------------------------------------------------------
 * Per-entity combat bookkeeping.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one pending callback ({@code pendingEventId}) at a time</li>
 *   <li>{@link #reset(TimedCallbackScheduler)} cancels that callback before any
 *       field is cleared</li>
 *   <li>{@code generation} increases on every transition; a callback that
 *       captured an older generation is stale and must do nothing</li>
 * </ul>
 *
 * Mutated only by {@link CombatSystem} on the engine loop.
 */
public final class CombatState
{
    private final EntityId entityId;

    private EntityId targetId;
    private CombatPhase phase = CombatPhase.IDLE;
    private long phaseStartedAtNanos;
    private long phaseDurationNanos;
    private CallbackId pendingEventId;
    private WeaponSnapshot snapshot;
    private long generation;

    public CombatState(EntityId entityId) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
    }

    public EntityId entityId() {
        return entityId;
    }

    public CombatPhase phase() {
        return phase;
    }

    public boolean inCombat() {
        return phase != CombatPhase.IDLE;
    }

    public Optional<EntityId> target() {
        return Optional.ofNullable(targetId);
    }

    public Optional<CallbackId> pendingEventId() {
        return Optional.ofNullable(pendingEventId);
    }

    public Optional<WeaponSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    public long phaseStartedAtNanos() {
        return phaseStartedAtNanos;
    }

    public long phaseDurationNanos() {
        return phaseDurationNanos;
    }

    long generation() {
        return generation;
    }

    /**
     * Nanoseconds left in the current timed phase, never negative.
     */
    public long remainingNanos(long nowNanos) {
        return Math.max(0L, phaseStartedAtNanos + phaseDurationNanos - nowNanos);
    }

    void engage(EntityId target) {
        this.targetId = Objects.requireNonNull(target, "target");
    }

    void captureSnapshot(WeaponSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    /**
     * Enters {@code next}. The previous pending callback must already have fired
     * or been cancelled.
     */
    long enter(CombatPhase next, long nowNanos, long durationNanos) {
        this.phase = next;
        this.phaseStartedAtNanos = nowNanos;
        this.phaseDurationNanos = durationNanos;
        this.pendingEventId = null;
        return ++generation;
    }

    void pending(CallbackId id) {
        this.pendingEventId = id;
    }

    /**
     * Returns to IDLE. Cancels the pending callback first.
     *
     * @return the phase that was left
     */
    CombatPhase reset(TimedCallbackScheduler scheduler) {
        if (pendingEventId != null) {
            scheduler.cancel(pendingEventId);
        }
        CombatPhase previous = phase;
        pendingEventId = null;
        targetId = null;
        snapshot = null;
        phase = CombatPhase.IDLE;
        phaseStartedAtNanos = 0L;
        phaseDurationNanos = 0L;
        generation++;
        return previous;
    }

    @Override
    public String toString() {
        return "CombatState{" + entityId + ", " + phase
                + (targetId != null ? " -> " + targetId : "")
                + (pendingEventId != null ? ", pending=" + pendingEventId : "") + '}';
    }
}
