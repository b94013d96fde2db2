package com.questrail.realm.engine.internal.combat;

import java.util.Objects;
import java.util.Random;

/**
 * {@link CombatDice} backed by {@link Random}.
 */
public final class RandomCombatDice implements CombatDice
{
    private final Random random;

    public RandomCombatDice() {
        this(new Random());
    }

    public RandomCombatDice(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public int roll(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max < min");
        }
        return min + random.nextInt(max - min + 1);
    }

    @Override
    public boolean chance(double chance) {
        return random.nextDouble() < chance;
    }
}
