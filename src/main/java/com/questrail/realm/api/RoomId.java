package com.questrail.realm.api;

import java.util.Objects;

/**
 * Stable identifier of a room in the world graph.
 */
public record RoomId(String value)
{
    public RoomId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("RoomId must not be blank");
        }
    }

    public static RoomId of(String value) {
        return new RoomId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
