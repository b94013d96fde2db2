package com.questrail.realm.engine.internal.combat;

import com.questrail.realm.engine.internal.world.WeaponStats;

import java.time.Duration;
import java.util.Objects;

/**
 * Weapon stats frozen at WINDUP entry. Equipment changes made afterwards are not
 * visible until the next windup takes a new snapshot.
 */
public record WeaponSnapshot(String name,
                             int damageMin,
                             int damageMax,
                             Duration swingInterval,
                             String damageType)
{
    public WeaponSnapshot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(swingInterval, "swingInterval");
        Objects.requireNonNull(damageType, "damageType");
    }

    public static WeaponSnapshot of(WeaponStats weapon) {
        Objects.requireNonNull(weapon, "weapon");
        return new WeaponSnapshot(weapon.name(),
                weapon.damageMin(),
                weapon.damageMax(),
                weapon.swingInterval(),
                weapon.damageType());
    }
}
