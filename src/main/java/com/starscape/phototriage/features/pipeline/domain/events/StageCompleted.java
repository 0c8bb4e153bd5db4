package com.starscape.phototriage.features.pipeline.domain.events;

import com.starscape.phototriage.common.domain.DomainEvent;
import java.time.Instant;

/**
 * Published when a pipeline stage has committed its results.
 */
public record StageCompleted(
    String runId,
    String stage,
    int processed,
    String summary,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "StageCompleted";
    }
    
    @Override
    public String getAggregateId() {
        return runId;
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
