package com.questrail.realm.api;

/**
 * EngineStatus
 * -----------------------------------------------------------------------------
 * Coarse lifecycle status of a {@link RealmEngine}.
 *
 * <p>This is intentionally small. It reports whether the engine accepts work,
 * not why it stopped; faults inside individual units of work never change the
 * status.</p>
 */
public enum EngineStatus
{
    /** Constructed but not started. */
    NEW,

    /** Loop thread running and accepting commands. */
    RUNNING,

    /** Shutdown requested; finishing the in-flight unit and flushing saves. */
    DRAINING,

    /** Loop thread has exited. */
    STOPPED
}
