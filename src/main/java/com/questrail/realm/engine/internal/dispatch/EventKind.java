package com.questrail.realm.engine.internal.dispatch;

import java.util.Locale;

/**
 * Notification categories understood by clients.
 */
public enum EventKind
{
    MESSAGE,
    STAT_UPDATE,
    COMBAT,
    DEATH,
    EFFECT,
    ERROR;

    /** Lower-case name used on the wire, e.g. {@code stat_update}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
