package com.questrail.realm.engine.observability;

/**
 * Main interface for receiving engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface EngineObservabilitySink {
    /**
     * Called when the engine moves between lifecycle states.
     * @param event the lifecycle change
     */
    void onLifecycle(EngineLifecycleEvent event);

    /**
     * Called when an entity's combat phase changes.
     * @param event the transition details
     */
    void onCombatTransition(CombatTransitionEvent event);

    /**
     * Called when a participant command is rejected before any mutation.
     * @param event the rejection details
     */
    void onCommandRejected(CommandRejectedEvent event);

    /**
     * Called when a unit of work faults or another anomaly occurs.
     * @param event the error event
     */
    void onError(EngineErrorEvent event);
}
