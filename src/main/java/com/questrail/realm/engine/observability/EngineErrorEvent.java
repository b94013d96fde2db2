package com.questrail.realm.engine.observability;

import java.time.Instant;

/**
 * Record representing a fault inside the engine.
 *
 * @param context unit-of-work description (kind, source, sequence or callback id)
 */
public record EngineErrorEvent(
    Instant timestamp,
    String message,
    String context,
    Throwable cause
) {
}
