package com.questrail.realm.engine.internal.world;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RoomId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Room
 * -----------------------------------------------------------------------------
 * A node in the world graph. Holds occupant ids and exit ids, never references.
 *
 * <p>Occupancy is maintained by {@link World}; callers outside this package see
 * a read-only view.</p>
 */
public final class Room
{
    private final RoomId id;
    private final String name;
    private final String description;
    private final Map<Direction, RoomId> exits = new EnumMap<>(Direction.class);
    private final Set<EntityId> occupants = new LinkedHashSet<>();

    public Room(RoomId id, String name, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNullElse(description, "");
    }

    public RoomId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Room exit(Direction direction, RoomId target) {
        exits.put(Objects.requireNonNull(direction, "direction"), Objects.requireNonNull(target, "target"));
        return this;
    }

    public Optional<RoomId> exitTo(Direction direction) {
        return Optional.ofNullable(exits.get(direction));
    }

    public Map<Direction, RoomId> exits() {
        return Collections.unmodifiableMap(exits);
    }

    public Set<EntityId> occupants() {
        return Collections.unmodifiableSet(occupants);
    }

    void addOccupant(EntityId entityId) {
        occupants.add(entityId);
    }

    void removeOccupant(EntityId entityId) {
        occupants.remove(entityId);
    }
}
