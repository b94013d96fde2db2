package com.questrail.realm.engine.internal.dispatch;

import com.questrail.realm.api.EntityId;

/**
 * Notified after a flush for each participant that received at least one event.
 *
 * <p>Invoked on the engine loop thread. Implementations must not block; the
 * usual reaction is to schedule a {@code drain} on a transport thread.</p>
 */
@FunctionalInterface
public interface DeliveryListener
{
    DeliveryListener NONE = participantId -> {};

    void onDeliverable(EntityId participantId);

    /**
     * A connect for {@code participantId} was refused: the id is unknown or does
     * not name a participant. No delivery queue exists for it.
     */
    default void onConnectRefused(EntityId participantId, String reason) {}
}
