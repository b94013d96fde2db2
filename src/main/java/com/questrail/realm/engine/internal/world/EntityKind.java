package com.questrail.realm.engine.internal.world;

/**
 * Participants are driven by connected users; NPCs by the world itself.
 */
public enum EntityKind
{
    PARTICIPANT,
    NPC
}
