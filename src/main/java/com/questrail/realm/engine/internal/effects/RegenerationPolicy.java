package com.questrail.realm.engine.internal.effects;

import java.time.Duration;
import java.util.Objects;

/**
 * RegenerationPolicy
 * -----------------------------------------------------------------------------
 * Out-of-combat health regeneration tuning.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>Tick interval: 10 s</li>
 *   <li>Health per tick: 2</li>
 * </ul>
 */
public record RegenerationPolicy(Duration interval, int healthPerTick)
{
    public RegenerationPolicy {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (healthPerTick < 0) {
            throw new IllegalArgumentException("healthPerTick must be >= 0");
        }
    }

    public static RegenerationPolicy defaults() {
        return new RegenerationPolicy(Duration.ofSeconds(10), 2);
    }

    public RegenerationPolicy withInterval(Duration value) {
        return new RegenerationPolicy(value, healthPerTick);
    }

    public RegenerationPolicy withHealthPerTick(int value) {
        return new RegenerationPolicy(interval, value);
    }
}
