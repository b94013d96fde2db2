package com.questrail.realm.engine.internal.world;

import java.time.Duration;
import java.util.Objects;

/**
 * WeaponStats
 * -----------------------------------------------------------------------------
 * Already-resolved weapon record supplied by the content collaborator.
 *
 * <p>Combat never reads this record while a swing is in flight; it copies it
 * into a {@code WeaponSnapshot} when a windup starts.</p>
 *
 * @param name          display name ("fists" for natural attacks)
 * @param damageMin     inclusive lower damage bound
 * @param damageMax     inclusive upper damage bound
 * @param swingInterval time from windup start to the swing landing
 * @param damageType    free-form damage category (physical, fire, ...)
 */
public record WeaponStats(String name,
                          int damageMin,
                          int damageMax,
                          Duration swingInterval,
                          String damageType)
{
    public WeaponStats {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(swingInterval, "swingInterval");
        Objects.requireNonNull(damageType, "damageType");

        if (damageMin < 0) {
            throw new IllegalArgumentException("damageMin must be >= 0");
        }
        if (damageMax < damageMin) {
            throw new IllegalArgumentException("damageMax must be >= damageMin");
        }
        if (swingInterval.isNegative() || swingInterval.isZero()) {
            throw new IllegalArgumentException("swingInterval must be > 0");
        }
    }

    /**
     * Natural attack: 1-4 physical damage every two seconds.
     */
    public static WeaponStats unarmed() {
        return new WeaponStats("fists", 1, 4, Duration.ofSeconds(2), "physical");
    }

    public static WeaponStats physical(String name, int damageMin, int damageMax, Duration swingInterval) {
        return new WeaponStats(name, damageMin, damageMax, swingInterval, "physical");
    }
}
