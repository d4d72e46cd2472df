package com.starscape.mediaindex.common.events;

import com.starscape.mediaindex.common.domain.DomainEvent;

import java.time.Instant;
import java.util.List;

/**
 * Payload broadcast to clients after a batch operation changed entities.
 */
public record EntityChangeEvent(
    EntityKind kind,
    ChangeType change,
    List<String> uids,
    Instant occurredOn
) implements DomainEvent {
    
    public EntityChangeEvent {
        uids = List.copyOf(uids);
    }
    
    public static EntityChangeEvent of(EntityKind kind, ChangeType change, List<String> uids) {
        return new EntityChangeEvent(kind, change, uids, Instant.now());
    }
    
    @Override
    public String getEventType() {
        return kind.topic() + "." + change.name().toLowerCase();
    }
    
    @Override
    public String getAggregateId() {
        return kind.topic();
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
