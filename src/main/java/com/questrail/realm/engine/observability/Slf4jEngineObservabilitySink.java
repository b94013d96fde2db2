package com.questrail.realm.engine.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EngineObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEngineObservabilitySink implements EngineObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEngineObservabilitySink.class);

    @Override
    public void onLifecycle(EngineLifecycleEvent event) {
        log.info("Engine: {} -> {}", event.from(), event.to());
    }

    @Override
    public void onCombatTransition(CombatTransitionEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Combat {}: {} -> {} (target {})",
                event.entityId(),
                event.from(),
                event.to(),
                event.targetId() != null ? event.targetId() : "none");
        }
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        log.debug("Rejected command from {}: '{}' ({})", event.sourceId(), event.text(), event.reason());
    }

    @Override
    public void onError(EngineErrorEvent event) {
        log.error("Engine Error: {} [{}]", event.message(), event.context(), event.cause());
    }
}
