package com.questrail.realm.engine.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <h2>Warning</h2>
 * <p><strong>Do not use for operational correctness.</strong> Engine timing
 * must use {@link MonotonicClock} exclusively. This clock exists for
 * observability sinks that need human-readable timestamps.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
