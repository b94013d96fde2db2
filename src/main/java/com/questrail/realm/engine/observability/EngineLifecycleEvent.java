package com.questrail.realm.engine.observability;

import com.questrail.realm.api.EngineStatus;

import java.time.Instant;

/**
 * Record representing an engine lifecycle change.
 */
public record EngineLifecycleEvent(
    Instant timestamp,
    EngineStatus from,
    EngineStatus to
) {
}
