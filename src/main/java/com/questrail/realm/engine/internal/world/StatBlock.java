package com.questrail.realm.engine.internal.world;

/**
 * StatBlock
 * -----------------------------------------------------------------------------
 * Base (unmodified) stats supplied by the content collaborator.
 *
 * <p>Effective values are computed by {@link Entity#effectiveStat(Stat)} as the
 * base value plus the modifiers of every active effect.</p>
 */
public record StatBlock(int maxHealth,
                        int armorClass,
                        int strength,
                        int dexterity)
{
    public StatBlock {
        if (maxHealth <= 0) {
            throw new IllegalArgumentException("maxHealth must be > 0");
        }
        if (armorClass < 0) {
            throw new IllegalArgumentException("armorClass must be >= 0");
        }
    }

    /**
     * Defaults for a fresh creature: 100 HP, AC 10, all attributes 10.
     */
    public static StatBlock defaults() {
        return new StatBlock(100, 10, 10, 10);
    }

    public StatBlock withMaxHealth(int value) {
        return new StatBlock(value, armorClass, strength, dexterity);
    }

    public StatBlock withArmorClass(int value) {
        return new StatBlock(maxHealth, value, strength, dexterity);
    }

    public StatBlock withStrength(int value) {
        return new StatBlock(maxHealth, armorClass, value, dexterity);
    }

    public StatBlock withDexterity(int value) {
        return new StatBlock(maxHealth, armorClass, strength, value);
    }

    int base(Stat stat) {
        return switch (stat) {
            case ARMOR_CLASS -> armorClass;
            case STRENGTH -> strength;
            case DEXTERITY -> dexterity;
        };
    }
}
