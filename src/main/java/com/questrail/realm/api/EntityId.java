package com.questrail.realm.api;

import java.util.Objects;

/**
 * EntityId
 * -----------------------------------------------------------------------------
 * Stable identifier of a world entity (participant or NPC).
 *
 * <p>All cross-entity relationships in the engine are expressed as identifiers
 * resolved against the current world at the moment they are used. Timers and
 * commands never hold entity references, only ids.</p>
 */
public record EntityId(String value)
{
    public EntityId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("EntityId must not be blank");
        }
    }

    public static EntityId of(String value) {
        return new EntityId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
