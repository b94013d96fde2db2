package com.questrail.realm.engine.internal.effects;

import com.questrail.realm.engine.internal.time.CallbackId;
import com.questrail.realm.engine.internal.world.Stat;

import java.util.Objects;
import java.util.Optional;

/**
 * An effect applied to one entity, with the scheduler handles that drive it.
 */
public final class Effect
{
    private final EffectId id;
    private final EffectSpec spec;
    private final long appliedAtNanos;

    private CallbackId expirationHandle;
    private CallbackId periodicHandle;

    Effect(EffectId id, EffectSpec spec, long appliedAtNanos) {
        this.id = Objects.requireNonNull(id, "id");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.appliedAtNanos = appliedAtNanos;
    }

    public EffectId id() {
        return id;
    }

    public EffectSpec spec() {
        return spec;
    }

    public String name() {
        return spec.name();
    }

    public int modifier(Stat stat) {
        return spec.modifiers().getOrDefault(stat, 0);
    }

    public long remainingNanos(long nowNanos) {
        return Math.max(0L, appliedAtNanos + spec.duration().toNanos() - nowNanos);
    }

    public Optional<CallbackId> expirationHandle() {
        return Optional.ofNullable(expirationHandle);
    }

    public Optional<CallbackId> periodicHandle() {
        return Optional.ofNullable(periodicHandle);
    }

    void expirationHandle(CallbackId handle) {
        this.expirationHandle = handle;
    }

    void periodicHandle(CallbackId handle) {
        this.periodicHandle = handle;
    }
}
