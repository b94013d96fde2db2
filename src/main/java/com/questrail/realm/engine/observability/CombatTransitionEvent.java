package com.questrail.realm.engine.observability;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.internal.combat.CombatPhase;

import java.time.Instant;

/**
 * Record representing a combat phase change for one entity.
 *
 * @param targetId the entity being attacked; {@code null} once combat has ended
 */
public record CombatTransitionEvent(
    Instant timestamp,
    EntityId entityId,
    CombatPhase from,
    CombatPhase to,
    EntityId targetId
) {
}
