package com.questrail.realm.engine.internal.combat;

/**
 * Combat sub-phases. A fight cycles WINDUP, SWING, RECOVERY until it returns to
 * IDLE.
 */
public enum CombatPhase
{
    IDLE,
    WINDUP,
    SWING,
    RECOVERY
}
