package com.questrail.realm.engine.observability;

import com.questrail.realm.api.EntityId;

import java.time.Instant;

/**
 * Record representing a command refused before it changed anything.
 */
public record CommandRejectedEvent(
    Instant timestamp,
    EntityId sourceId,
    String text,
    String reason
) {
}
