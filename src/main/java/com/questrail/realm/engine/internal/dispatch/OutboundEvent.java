package com.questrail.realm.engine.internal.dispatch;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RoomId;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.internal.world.Stat;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * OutboundEvent
 * -----------------------------------------------------------------------------
 * A notification produced by a unit of work and routed by the
 * {@link EventDispatcher}.
 *
 * @param scope    how targets are resolved
 * @param targets  explicit targets; used by {@link EventScope#PARTICIPANT}
 * @param roomId   room for {@link EventScope#ROOM}; {@code null} otherwise
 * @param excluded ids never delivered to (ROOM and BROADCAST)
 * @param kind     notification category
 * @param text     human-readable text; empty for data-only events
 * @param payload  structured data; immutable
 */
public record OutboundEvent(EventScope scope,
                            Set<EntityId> targets,
                            RoomId roomId,
                            Set<EntityId> excluded,
                            EventKind kind,
                            String text,
                            Map<String, Object> payload)
{
    public OutboundEvent {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(kind, "kind");
        targets = Set.copyOf(Objects.requireNonNullElse(targets, Set.of()));
        excluded = Set.copyOf(Objects.requireNonNullElse(excluded, Set.of()));
        text = Objects.requireNonNullElse(text, "");
        payload = Map.copyOf(Objects.requireNonNullElse(payload, Map.of()));

        if (scope == EventScope.ROOM && roomId == null) {
            throw new IllegalArgumentException("ROOM scope requires a roomId");
        }
        if (scope == EventScope.PARTICIPANT && targets.isEmpty()) {
            throw new IllegalArgumentException("PARTICIPANT scope requires at least one target");
        }
    }

    public static OutboundEvent toParticipant(EntityId target, EventKind kind, String text) {
        return toParticipant(target, kind, text, Map.of());
    }

    public static OutboundEvent toParticipant(EntityId target,
                                              EventKind kind,
                                              String text,
                                              Map<String, Object> payload) {
        Objects.requireNonNull(target, "target");
        return new OutboundEvent(EventScope.PARTICIPANT, Set.of(target), null, Set.of(), kind, text, payload);
    }

    public static OutboundEvent message(EntityId target, String text) {
        return toParticipant(target, EventKind.MESSAGE, text);
    }

    public static OutboundEvent error(EntityId target, String text) {
        return toParticipant(target, EventKind.ERROR, text);
    }

    public static OutboundEvent toRoom(RoomId room, EventKind kind, String text, EntityId... excluded) {
        Objects.requireNonNull(room, "room");
        return new OutboundEvent(EventScope.ROOM, Set.of(), room, idSet(excluded), kind, text, Map.of());
    }

    public static OutboundEvent broadcast(EventKind kind, String text, EntityId... excluded) {
        return new OutboundEvent(EventScope.BROADCAST, Set.of(), null, idSet(excluded), kind, text, Map.of());
    }

    /**
     * Current health and effective stats of {@code entity}, addressed to itself.
     */
    public static OutboundEvent statUpdate(Entity entity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("current_health", entity.currentHealth());
        payload.put("max_health", entity.maxHealth());
        payload.put("armor_class", entity.effectiveStat(Stat.ARMOR_CLASS));
        payload.put("strength", entity.effectiveStat(Stat.STRENGTH));
        payload.put("dexterity", entity.effectiveStat(Stat.DEXTERITY));
        return toParticipant(entity.id(), EventKind.STAT_UPDATE, "", payload);
    }

    private static Set<EntityId> idSet(EntityId... ids) {
        Set<EntityId> set = new LinkedHashSet<>();
        if (ids != null) {
            Arrays.stream(ids).filter(Objects::nonNull).forEach(set::add);
        }
        return set;
    }
}
