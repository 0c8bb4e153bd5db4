package com.starscape.phototriage.features.pipeline.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.phototriage.common.exception.NotFoundException;
import com.starscape.phototriage.common.outbox.OutboxEvent;
import com.starscape.phototriage.common.outbox.OutboxService;
import com.starscape.phototriage.features.pipeline.api.dto.RunEventItem;
import com.starscape.phototriage.features.pipeline.domain.PipelineRunRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * The stage completions and failure of one run, in the order they were logged.
 */
@Service
public class GetRunEventsHandler {
    
    private final PipelineRunRepository runRepository;
    private final OutboxService outboxService;
    private final ObjectMapper objectMapper;
    
    public GetRunEventsHandler(
            PipelineRunRepository runRepository,
            OutboxService outboxService,
            ObjectMapper objectMapper) {
        this.runRepository = runRepository;
        this.outboxService = outboxService;
        this.objectMapper = objectMapper;
    }
    
    public List<RunEventItem> handle(String runId) {
        if (runRepository.findById(runId).isEmpty()) {
            throw new NotFoundException("Pipeline run not found: " + runId);
        }
        
        List<OutboxEvent> events = outboxService.eventsFor(PipelineRunTracker.AGGREGATE_TYPE, runId);
        List<RunEventItem> items = new ArrayList<>(events.size());
        for (OutboxEvent event : events) {
            try {
                items.add(new RunEventItem(
                    event.getEventId(),
                    event.getEventType(),
                    event.getOccurredOn(),
                    objectMapper.readTree(event.getPayload())));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Stored payload of event " + event.getEventId() + " is not valid JSON", e);
            }
        }
        return items;
    }
}
