package com.questrail.realm.engine.persistence;

import com.questrail.realm.api.EntityId;

import java.util.Collection;

/**
 * PersistenceCollaborator
 * -----------------------------------------------------------------------------
 * Hook through which the engine reports entities that need saving.
 *
 * <p>The engine never decides when or how state is written. It only reports
 * which entities were mutated, and during shutdown hands over the full set of
 * entities marked since the last flush.</p>
 *
 * <p>Both methods are invoked on the engine loop thread. Implementations that
 * do slow I/O should hand the work off.</p>
 */
public interface PersistenceCollaborator
{
    /**
     * A unit of work mutated {@code entityId}.
     */
    void markDirty(EntityId entityId);

    /**
     * Final flush of every entity marked for saving. Called once, from the
     * shutdown drain pass, before the loop exits.
     */
    void flushOnShutdown(Collection<EntityId> entityIds);
}
