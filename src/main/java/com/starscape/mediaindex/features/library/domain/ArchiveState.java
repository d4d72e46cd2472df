package com.starscape.mediaindex.features.library.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Soft-delete state of an entity: either active or archived at a point in time.
 */
public sealed interface ArchiveState permits ArchiveState.Active, ArchiveState.Archived {
    
    ArchiveState ACTIVE = new Active();
    
    static ArchiveState of(Instant deletedAt) {
        return deletedAt == null ? ACTIVE : new Archived(deletedAt);
    }
    
    default boolean isArchived() {
        return this instanceof Archived;
    }
    
    record Active() implements ArchiveState {
    }
    
    record Archived(Instant at) implements ArchiveState {
        public Archived {
            Objects.requireNonNull(at, "Archive time cannot be null");
        }
    }
}
