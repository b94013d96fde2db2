package com.questrail.realm.api;

import java.util.List;
import java.util.Map;

/**
 * RealmEngine
 * -----------------------------------------------------------------------------
 * The boundary between transport code and the serialized simulation core.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Accept participant input as commands, in arrival order</li>
 *   <li>Hand out per-participant notifications produced by the core</li>
 *   <li>Expose a coarse lifecycle status</li>
 * </ul>
 *
 * It is explicitly <b>not</b> a way to read or mutate world state. Everything a
 * caller wants to change must be expressed as a command; everything a caller
 * learns arrives as a delivered event.
 *
 * <h2>Threading and Concurrency</h2>
 * Every method on this interface is safe to call from any thread and never
 * blocks on world processing. Implementations serialize all world mutation on
 * a single engine loop.
 */
public interface RealmEngine
{
    /**
     * Enqueues a raw participant instruction for processing.
     *
     * @param sourceId the issuing participant
     * @param text     the raw instruction
     * @return {@code true} if accepted; {@code false} once shutdown was requested
     */
    boolean enqueueCommand(EntityId sourceId, String text);

    /**
     * Notifies the core that a participant's connection is open.
     */
    boolean connect(EntityId participantId);

    /**
     * Notifies the core that a participant's connection closed.
     */
    boolean disconnect(EntityId participantId);

    /**
     * Removes and returns all pending notifications for a participant, in the
     * order the core published them.
     *
     * @param participantId the receiving participant
     * @return pending notifications; empty if none or if the participant is unknown
     */
    List<Delivery> drain(EntityId participantId);

    /**
     * Requests an orderly shutdown. The in-flight unit of work finishes and
     * entities marked for saving are flushed before the loop exits.
     */
    void requestShutdown();

    /**
     * Returns the current lifecycle status.
     */
    EngineStatus status();

    /**
     * A notification delivered to one participant.
     *
     * @param kind    notification category (message, stat_update, combat, ...)
     * @param text    human-readable text; may be empty for data-only kinds
     * @param payload structured data; never {@code null}
     */
    record Delivery(String kind, String text, Map<String, Object> payload) {}
}
