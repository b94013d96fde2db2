package com.questrail.realm.engine.internal.dispatch;

/**
 * Routing scope of an {@link OutboundEvent}.
 */
public enum EventScope
{
    /** Delivered to each listed target. */
    PARTICIPANT,

    /** Delivered to every registered participant in one room, minus exclusions. */
    ROOM,

    /** Delivered to every registered participant, minus exclusions. */
    BROADCAST
}
