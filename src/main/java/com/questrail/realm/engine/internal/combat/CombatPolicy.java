package com.questrail.realm.engine.internal.combat;

import java.time.Duration;
import java.util.Objects;

/**
 * CombatPolicy
 * =============================================================================
 * Immutable combat tuning.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>Critical chance: 10%</li>
 *   <li>Critical multiplier: 1.5</li>
 *   <li>Recovery between swings: 500 ms</li>
 *   <li>NPC respawn delay: 300 s</li>
 * </ul>
 */
public record CombatPolicy(double criticalChance,
                           double criticalMultiplier,
                           Duration recoveryDelay,
                           Duration npcRespawnDelay)
{
    public CombatPolicy {
        Objects.requireNonNull(recoveryDelay, "recoveryDelay");
        Objects.requireNonNull(npcRespawnDelay, "npcRespawnDelay");

        if (criticalChance < 0.0 || criticalChance > 1.0) {
            throw new IllegalArgumentException("criticalChance must be within [0, 1]");
        }
        if (criticalMultiplier < 1.0) {
            throw new IllegalArgumentException("criticalMultiplier must be >= 1");
        }
        if (recoveryDelay.isNegative()) {
            throw new IllegalArgumentException("recoveryDelay must be >= 0");
        }
        if (npcRespawnDelay.isNegative()) {
            throw new IllegalArgumentException("npcRespawnDelay must be >= 0");
        }
    }

    public static CombatPolicy defaults() {
        return new CombatPolicy(0.10, 1.5, Duration.ofMillis(500), Duration.ofSeconds(300));
    }

    public CombatPolicy withCriticalChance(double value) {
        return new CombatPolicy(value, criticalMultiplier, recoveryDelay, npcRespawnDelay);
    }

    public CombatPolicy withCriticalMultiplier(double value) {
        return new CombatPolicy(criticalChance, value, recoveryDelay, npcRespawnDelay);
    }

    public CombatPolicy withRecoveryDelay(Duration value) {
        return new CombatPolicy(criticalChance, criticalMultiplier, value, npcRespawnDelay);
    }

    public CombatPolicy withNpcRespawnDelay(Duration value) {
        return new CombatPolicy(criticalChance, criticalMultiplier, recoveryDelay, value);
    }
}
