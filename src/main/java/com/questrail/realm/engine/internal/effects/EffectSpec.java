package com.questrail.realm.engine.internal.effects;

import com.questrail.realm.engine.internal.world.Stat;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * EffectSpec
 * -----------------------------------------------------------------------------
 * What an effect does, independent of who it is applied to.
 *
 * @param name      display name
 * @param type      category; DOT and HOT require a positive {@code interval}
 * @param modifiers additive stat modifiers active while the effect lasts
 * @param duration  time until expiration
 * @param magnitude health lost (DOT) or gained (HOT) per tick
 * @param interval  tick interval; {@link Duration#ZERO} for non-periodic effects
 */
public record EffectSpec(String name,
                         EffectType type,
                         Map<Stat, Integer> modifiers,
                         Duration duration,
                         int magnitude,
                         Duration interval)
{
    public EffectSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(duration, "duration");
        modifiers = Map.copyOf(Objects.requireNonNullElse(modifiers, Map.of()));
        interval = Objects.requireNonNullElse(interval, Duration.ZERO);

        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be > 0");
        }
        if (type.periodic()) {
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException(type + " requires interval > 0");
            }
            if (magnitude <= 0) {
                throw new IllegalArgumentException(type + " requires magnitude > 0");
            }
        }
    }

    /**
     * +5 armor class for 30 seconds.
     */
    public static EffectSpec blessing() {
        return statBuff("Blessing", Stat.ARMOR_CLASS, 5, Duration.ofSeconds(30));
    }

    /**
     * 5 damage every 3 seconds for 15 seconds.
     */
    public static EffectSpec poison() {
        return damageOverTime("Poison", 5, Duration.ofSeconds(3), Duration.ofSeconds(15));
    }

    public static EffectSpec statBuff(String name, Stat stat, int amount, Duration duration) {
        Map<Stat, Integer> mods = new EnumMap<>(Stat.class);
        mods.put(stat, amount);
        return new EffectSpec(name, amount >= 0 ? EffectType.BUFF : EffectType.DEBUFF, mods, duration, 0, Duration.ZERO);
    }

    public static EffectSpec damageOverTime(String name, int damage, Duration interval, Duration duration) {
        return new EffectSpec(name, EffectType.DOT, Map.of(), duration, damage, interval);
    }

    public static EffectSpec healOverTime(String name, int heal, Duration interval, Duration duration) {
        return new EffectSpec(name, EffectType.HOT, Map.of(), duration, heal, interval);
    }
}
