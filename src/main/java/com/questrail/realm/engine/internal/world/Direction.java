package com.questrail.realm.engine.internal.world;

import java.util.Locale;
import java.util.Optional;

/**
 * Exit directions between rooms.
 */
public enum Direction
{
    NORTH("n"),
    SOUTH("s"),
    EAST("e"),
    WEST("w"),
    UP("u"),
    DOWN("d");

    private final String alias;

    Direction(String alias) {
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a full name or one-letter alias, case-insensitively.
     */
    public static Optional<Direction> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String t = token.trim().toLowerCase(Locale.ROOT);
        for (Direction d : values()) {
            if (d.alias.equals(t) || d.label().equals(t)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
