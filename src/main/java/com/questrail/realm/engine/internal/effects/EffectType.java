package com.questrail.realm.engine.internal.effects;

/**
 * Effect categories. Only {@link #DOT} and {@link #HOT} tick periodically.
 */
public enum EffectType
{
    BUFF,
    DEBUFF,
    DOT,
    HOT;

    public boolean periodic() {
        return this == DOT || this == HOT;
    }
}
