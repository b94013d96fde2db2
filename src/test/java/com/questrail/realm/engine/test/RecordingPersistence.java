package com.questrail.realm.engine.test;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.persistence.PersistenceCollaborator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Test persistence collaborator that records every call.
 */
public final class RecordingPersistence implements PersistenceCollaborator {

    private final List<EntityId> marked = new ArrayList<>();
    private final List<List<EntityId>> flushes = new ArrayList<>();

    @Override
    public synchronized void markDirty(EntityId entityId) {
        marked.add(entityId);
    }

    @Override
    public synchronized void flushOnShutdown(Collection<EntityId> entityIds) {
        flushes.add(List.copyOf(entityIds));
    }

    public synchronized List<EntityId> marked() {
        return List.copyOf(marked);
    }

    public synchronized List<List<EntityId>> flushes() {
        return List.copyOf(flushes);
    }
}
