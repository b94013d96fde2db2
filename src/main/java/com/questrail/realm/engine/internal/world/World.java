package com.questrail.realm.engine.internal.world;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RoomId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * World
 * =============================================================================
 * Flat arena of rooms and entities.
 *
 * <h2>Identity, not references</h2>
 * Rooms hold entity ids and entities hold a room id. Every cross-reference is
 * resolved through this arena at the moment it is used, so a callback or command
 * that outlives its subject resolves to {@link Optional#empty()} instead of a
 * dangling object.
 *
 * <h2>Threading</h2>
 * Owned by the engine loop. Transport threads never see this type.
 */
public final class World
{
    private final Map<RoomId, Room> rooms = new LinkedHashMap<>();
    private final Map<EntityId, Entity> entities = new LinkedHashMap<>();

    public World addRoom(Room room) {
        Objects.requireNonNull(room, "room");
        if (rooms.putIfAbsent(room.id(), room) != null) {
            throw new IllegalArgumentException("duplicate room: " + room.id());
        }
        return this;
    }

    /**
     * Adds an entity and places it in its home room.
     *
     * @throws IllegalArgumentException if the id is taken or the room is unknown
     */
    public World addEntity(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        Room home = rooms.get(entity.homeRoom());
        if (home == null) {
            throw new IllegalArgumentException("unknown room: " + entity.homeRoom());
        }
        if (entities.putIfAbsent(entity.id(), entity) != null) {
            throw new IllegalArgumentException("duplicate entity: " + entity.id());
        }
        home.addOccupant(entity.id());
        entity.placeIn(home.id());
        return this;
    }

    public Optional<Room> room(RoomId id) {
        return id == null ? Optional.empty() : Optional.ofNullable(rooms.get(id));
    }

    public Optional<Entity> entity(EntityId id) {
        return id == null ? Optional.empty() : Optional.ofNullable(entities.get(id));
    }

    public Collection<Entity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    /**
     * Moves an entity into {@code target}, keeping both rooms' occupancy in step.
     */
    public void move(Entity entity, RoomId target) {
        Room to = rooms.get(target);
        if (to == null) {
            throw new IllegalArgumentException("unknown room: " + target);
        }
        takeOut(entity);
        to.addOccupant(entity.id());
        entity.placeIn(to.id());
    }

    /**
     * Removes an entity from its room without forgetting it. Used for slain NPCs
     * waiting to respawn.
     */
    public void takeOut(Entity entity) {
        entity.room().flatMap(this::room).ifPresent(r -> r.removeOccupant(entity.id()));
        entity.placeIn(null);
    }

    /**
     * Forgets an entity entirely. Ids held by timers or commands resolve to
     * empty from now on.
     *
     * @return the removed entity, or empty if the id was unknown
     */
    public Optional<Entity> remove(EntityId id) {
        Entity entity = id == null ? null : entities.get(id);
        if (entity == null) {
            return Optional.empty();
        }
        takeOut(entity);
        entities.remove(id);
        return Optional.of(entity);
    }

    /**
     * Entities currently in {@code roomId}, in arrival order.
     */
    public List<Entity> occupants(RoomId roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return List.of();
        }
        List<Entity> result = new ArrayList<>(room.occupants().size());
        for (EntityId id : room.occupants()) {
            Entity e = entities.get(id);
            if (e != null) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * First entity in {@code roomId} other than {@code self} whose name or
     * keyword matches {@code search}.
     */
    public Optional<Entity> findInRoom(RoomId roomId, String search, EntityId self) {
        for (Entity e : occupants(roomId)) {
            if (!e.id().equals(self) && e.matches(search)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * {@code true} when both entities are placed and share a room.
     */
    public boolean coLocated(Entity a, Entity b) {
        return a.room().isPresent() && a.room().equals(b.room());
    }
}
