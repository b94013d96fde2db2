package com.questrail.realm.engine.internal.effects;

/**
 * Opaque handle for an applied effect, unique for the engine's lifetime.
 */
public record EffectId(long value) {

    @Override
    public String toString() {
        return "fx-" + value;
    }
}
