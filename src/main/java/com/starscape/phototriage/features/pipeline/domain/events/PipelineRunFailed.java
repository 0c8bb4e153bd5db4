package com.starscape.phototriage.features.pipeline.domain.events;

import com.starscape.phototriage.common.domain.DomainEvent;
import java.time.Instant;

/**
 * Published when a stage fails and the run stops. Stages before it stay committed.
 */
public record PipelineRunFailed(
    String runId,
    String stage,
    String errorMessage,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "PipelineRunFailed";
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
