package com.questrail.realm.engine.internal.exec;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.persistence.PersistenceCollaborator;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Records entities mutated since the last flush and forwards each mark to the
 * {@link PersistenceCollaborator}.
 */
public final class DirtyTracker
{
    private final PersistenceCollaborator persistence;
    private final Set<EntityId> dirty = new LinkedHashSet<>();

    public DirtyTracker(PersistenceCollaborator persistence) {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
    }

    public void markDirty(EntityId entityId) {
        Objects.requireNonNull(entityId, "entityId");
        dirty.add(entityId);
        persistence.markDirty(entityId);
    }

    public boolean isDirty(EntityId entityId) {
        return dirty.contains(entityId);
    }

    /**
     * Hands every marked id to the collaborator's shutdown flush and clears the
     * set.
     *
     * @return the ids that were flushed, in first-marked order
     */
    public List<EntityId> flushOnShutdown() {
        List<EntityId> ids = List.copyOf(dirty);
        dirty.clear();
        persistence.flushOnShutdown(ids);
        return ids;
    }
}
