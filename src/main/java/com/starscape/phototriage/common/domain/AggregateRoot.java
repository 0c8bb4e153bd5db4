package com.starscape.phototriage.common.domain;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entity that collects domain events until its repository has stored it.
 */
public abstract class AggregateRoot<ID extends Serializable> extends Entity<ID> {
    
    private final transient List<DomainEvent> pendingEvents = new ArrayList<>();
    
    protected AggregateRoot() {
        super();
    }
    
    protected AggregateRoot(ID id) {
        super(id);
    }
    
    protected void registerEvent(DomainEvent event) {
        pendingEvents.add(event);
    }
    
    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }
    
    /**
     * Hands over the pending events in registration order and forgets them.
     */
    public List<DomainEvent> pullDomainEvents() {
        List<DomainEvent> events = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return events;
    }
}
