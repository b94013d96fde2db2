package com.questrail.realm.engine.internal.dispatch;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.internal.world.World;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;

/**
 * EventDispatcher
 * =============================================================================
 * Buffers events produced by the current unit of work and routes them into
 * per-participant delivery queues when the unit completes.
 *
 * <h2>Two sides</h2>
 * <ul>
 *   <li>Engine side ({@link #publish}, {@link #flush}, {@link #discardPending},
 *       {@link #register}, {@link #unregister}): engine loop thread only</li>
 *   <li>Transport side ({@link #drain}): any thread</li>
 * </ul>
 * The delivery queues are the only state shared between the two.
 *
 * <h2>Ordering</h2>
 * Events reach each target in publish order. A unit's batch is flushed as a
 * whole before the next unit starts, so batches never interleave.
 *
 * <h2>Routing</h2>
 * Targets are resolved at flush time. Events addressed to ids without a
 * delivery queue (NPCs, disconnected participants) are dropped.
 *
 * <h2>Refused connects</h2>
 * A refused connect has no queue to land in, so it is buffered separately and
 * handed straight to the listener when the unit flushes.
 */
public final class EventDispatcher
{
    private final World world;
    private final List<OutboundEvent> batch = new ArrayList<>();
    private final Map<EntityId, String> refusals = new LinkedHashMap<>();
    private final ConcurrentMap<EntityId, Queue<OutboundEvent>> queues = new ConcurrentHashMap<>();

    private volatile DeliveryListener listener = DeliveryListener.NONE;

    public EventDispatcher(World world) {
        this.world = Objects.requireNonNull(world, "world");
    }

    public void setDeliveryListener(DeliveryListener listener) {
        this.listener = Objects.requireNonNullElse(listener, DeliveryListener.NONE);
    }

    public void publish(OutboundEvent event) {
        batch.add(Objects.requireNonNull(event, "event"));
    }

    public void publishAll(Collection<OutboundEvent> events) {
        for (OutboundEvent e : events) {
            publish(e);
        }
    }

    /**
     * Buffers a connect refusal for the current unit of work.
     */
    public void refuseConnect(EntityId participantId, String reason) {
        refusals.put(Objects.requireNonNull(participantId, "participantId"),
                Objects.requireNonNull(reason, "reason"));
    }

    /**
     * Number of events buffered by the current unit of work.
     */
    public int pendingCount() {
        return batch.size();
    }

    /**
     * Routes the buffered batch into delivery queues and notifies the listener
     * once per participant that received something.
     *
     * @return number of deliveries made
     */
    public int flush() {
        flushRefusals();
        if (batch.isEmpty()) {
            return 0;
        }
        List<OutboundEvent> events = new ArrayList<>(batch);
        batch.clear();

        Set<EntityId> touched = new LinkedHashSet<>();
        int deliveries = 0;
        for (OutboundEvent event : events) {
            for (EntityId target : resolve(event)) {
                Queue<OutboundEvent> q = queues.get(target);
                if (q != null) {
                    q.offer(event);
                    touched.add(target);
                    deliveries++;
                }
            }
        }

        DeliveryListener l = listener;
        for (EntityId id : touched) {
            l.onDeliverable(id);
        }
        return deliveries;
    }

    /**
     * Drops the buffered batch without delivering it.
     *
     * @return number of events dropped
     */
    public int discardPending() {
        int n = batch.size() + refusals.size();
        batch.clear();
        refusals.clear();
        return n;
    }

    /**
     * Opens a delivery queue for {@code participantId}. Idempotent.
     */
    public void register(EntityId participantId) {
        queues.computeIfAbsent(Objects.requireNonNull(participantId, "participantId"),
                id -> new ConcurrentLinkedQueue<>());
    }

    /**
     * Closes the delivery queue. Undrained events are discarded.
     */
    public void unregister(EntityId participantId) {
        if (participantId != null) {
            queues.remove(participantId);
        }
    }

    public boolean isRegistered(EntityId participantId) {
        return participantId != null && queues.containsKey(participantId);
    }

    /**
     * Removes and returns everything queued for {@code participantId}, oldest
     * first. Safe from any thread.
     */
    public List<OutboundEvent> drain(EntityId participantId) {
        Queue<OutboundEvent> q = participantId == null ? null : queues.get(participantId);
        if (q == null) {
            return List.of();
        }
        List<OutboundEvent> out = new ArrayList<>();
        OutboundEvent e;
        while ((e = q.poll()) != null) {
            out.add(e);
        }
        return out;
    }

    private void flushRefusals() {
        if (refusals.isEmpty()) {
            return;
        }
        Map<EntityId, String> refused = new LinkedHashMap<>(refusals);
        refusals.clear();

        DeliveryListener l = listener;
        refused.forEach(l::onConnectRefused);
    }

    private Collection<EntityId> resolve(OutboundEvent event) {
        switch (event.scope()) {
            case PARTICIPANT:
                return event.targets();
            case ROOM: {
                List<EntityId> ids = new ArrayList<>();
                for (Entity e : world.occupants(event.roomId())) {
                    if (!event.excluded().contains(e.id())) {
                        ids.add(e.id());
                    }
                }
                return ids;
            }
            case BROADCAST: {
                List<EntityId> ids = new ArrayList<>();
                for (EntityId id : queues.keySet()) {
                    if (!event.excluded().contains(id)) {
                        ids.add(id);
                    }
                }
                return ids;
            }
            default:
                throw new IllegalStateException("unknown scope: " + event.scope());
        }
    }
}
