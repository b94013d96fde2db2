package com.questrail.realm.engine.observability;

/**
 * No-op implementation of EngineObservabilitySink.
 */
public final class NullObservabilitySink implements EngineObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycle(EngineLifecycleEvent event) {}

    @Override
    public void onCombatTransition(CombatTransitionEvent event) {}

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {}

    @Override
    public void onError(EngineErrorEvent event) {}
}
