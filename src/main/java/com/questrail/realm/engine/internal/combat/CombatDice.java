package com.questrail.realm.engine.internal.combat;

import java.util.List;

/**
 * Source of randomness for combat. Injected so tests can fix every roll.
 */
public interface CombatDice
{
    /** Uniform roll in {@code [min, max]}, both inclusive. */
    int roll(int min, int max);

    /** {@code true} with probability {@code chance}. */
    boolean chance(double chance);

    default int d20() {
        return roll(1, 20);
    }

    /** Picks one element of a non-empty list. */
    default <T> T pick(List<T> options) {
        return options.get(roll(0, options.size() - 1));
    }
}
