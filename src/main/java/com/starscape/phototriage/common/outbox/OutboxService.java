package com.starscape.phototriage.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.phototriage.common.domain.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Appends domain events to the event log inside the caller's transaction.
 */
@Service
public class OutboxService {
    
    private static final Logger log = LoggerFactory.getLogger(OutboxService.class);
    
    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;
    
    public OutboxService(OutboxEventRepository outboxRepository, ObjectMapper objectMapper) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
    }
    
    @Transactional
    public void publish(DomainEvent event, String aggregateType) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.getEventType(), e);
        }
        
        String eventId = "evt_" + UUID.randomUUID().toString().replace("-", "");
        outboxRepository.save(new OutboxEvent(
            eventId, aggregateType, event.getAggregateId(), event.getEventType(), payload, event.getOccurredOn()));
        log.debug("Logged {} for {} {}", event.getEventType(), aggregateType, event.getAggregateId());
    }
    
    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsFor(String aggregateType, String aggregateId) {
        return outboxRepository.findByAggregateTypeAndAggregateIdOrderByCreatedAtAscEventIdAsc(aggregateType, aggregateId);
    }
}
