package com.questrail.realm.engine.internal.world;

/**
 * Stats that temporary effects may modify.
 */
public enum Stat
{
    ARMOR_CLASS,
    STRENGTH,
    DEXTERITY
}
