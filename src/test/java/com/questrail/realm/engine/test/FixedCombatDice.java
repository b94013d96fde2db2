package com.questrail.realm.engine.test;

import com.questrail.realm.engine.internal.combat.CombatDice;

import java.util.List;

/**
 * Deterministic dice for tests.
 *
 * <p>Damage rolls return {@code value} clamped into the requested range, the
 * d20 returns {@code d20}, critical checks return {@code critical}, and
 * {@link #pick(List)} returns the first option.</p>
 */
public final class FixedCombatDice implements CombatDice {

    private volatile int value;
    private volatile int d20 = 10;
    private volatile boolean critical;

    public FixedCombatDice(int value) {
        this.value = value;
    }

    public FixedCombatDice value(int value) {
        this.value = value;
        return this;
    }

    public FixedCombatDice d20(int d20) {
        this.d20 = d20;
        return this;
    }

    public FixedCombatDice critical(boolean critical) {
        this.critical = critical;
        return this;
    }

    @Override
    public int roll(int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public boolean chance(double chance) {
        return critical;
    }

    @Override
    public int d20() {
        return d20;
    }

    @Override
    public <T> T pick(List<T> options) {
        return options.get(0);
    }
}
