package com.questrail.realm.engine.config;

import com.questrail.realm.engine.internal.combat.CombatPolicy;
import com.questrail.realm.engine.internal.effects.RegenerationPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the engine runtime.
 *
 * @param maxPollInterval longest the idle loop waits before re-checking timers
 * @param combatPolicy    combat tuning
 * @param regeneration    resting health regeneration, started with the loop
 */
public record EngineConfig(
    Duration maxPollInterval,
    CombatPolicy combatPolicy,
    RegenerationPolicy regeneration
) {
    public EngineConfig {
        Objects.requireNonNull(maxPollInterval, "maxPollInterval");
        Objects.requireNonNull(combatPolicy, "combatPolicy");
        Objects.requireNonNull(regeneration, "regeneration");
        if (maxPollInterval.isNegative() || maxPollInterval.isZero()) {
            throw new IllegalArgumentException("maxPollInterval must be > 0");
        }
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration maxPollInterval = Duration.ofMillis(500);
        private CombatPolicy combatPolicy = CombatPolicy.defaults();
        private RegenerationPolicy regeneration = RegenerationPolicy.defaults();

        public Builder withMaxPollInterval(Duration maxPollInterval) {
            this.maxPollInterval = maxPollInterval;
            return this;
        }

        public Builder withCombatPolicy(CombatPolicy combatPolicy) {
            this.combatPolicy = combatPolicy;
            return this;
        }

        public Builder withRegeneration(RegenerationPolicy regeneration) {
            this.regeneration = regeneration;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(maxPollInterval, combatPolicy, regeneration);
        }
    }
}
