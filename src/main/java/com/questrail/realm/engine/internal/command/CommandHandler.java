package com.questrail.realm.engine.internal.command;

import com.questrail.realm.engine.internal.world.Entity;

/**
 * Behavior bound to a verb in the {@link CommandRegistry}.
 *
 * <p>A handler either throws {@link CommandRejectedException} before mutating
 * anything, or performs its mutation and publishes its own events.</p>
 */
@FunctionalInterface
public interface CommandHandler
{
    /**
     * @param actor the issuing entity, already resolved and present
     * @param args  everything after the verb, trimmed; may be empty
     */
    void handle(Entity actor, String args);
}
