package com.starscape.phototriage.common.domain;

import java.time.Instant;

/**
 * Something that happened to an aggregate. Implementations are serialized to JSON as-is when
 * they are written to the run event log.
 */
public interface DomainEvent {
    String getEventType();
    String getAggregateId();
    Instant getOccurredOn();
}
