package com.questrail.realm.engine.persistence;

import com.questrail.realm.api.EntityId;

import java.util.Collection;

/**
 * No-op implementation of PersistenceCollaborator.
 */
public final class NullPersistenceCollaborator implements PersistenceCollaborator {
    public static final NullPersistenceCollaborator INSTANCE = new NullPersistenceCollaborator();

    private NullPersistenceCollaborator() {}

    @Override
    public void markDirty(EntityId entityId) {}

    @Override
    public void flushOnShutdown(Collection<EntityId> entityIds) {}
}
