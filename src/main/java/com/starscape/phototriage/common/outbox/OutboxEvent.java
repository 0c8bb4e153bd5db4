package com.starscape.phototriage.common.outbox;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import java.time.Instant;

/**
 * One entry of the append-only event log, written in the transaction that changed the aggregate.
 * Reporting tools read it per aggregate in the order it was written.
 */
@Entity
@Table(name = "outbox_events")
public class OutboxEvent {
    
    @Id
    @Column(name = "event_id")
    private String eventId;
    
    @Column(name = "aggregate_type", nullable = false, updatable = false)
    private String aggregateType;
    
    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private String aggregateId;
    
    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    private String payload;
    
    @Column(name = "occurred_on", nullable = false, updatable = false)
    private Instant occurredOn;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected OutboxEvent() {
        // JPA constructor
    }
    
    public OutboxEvent(String eventId, String aggregateType, String aggregateId,
                       String eventType, String payload, Instant occurredOn) {
        if (aggregateType == null || aggregateId == null || eventType == null) {
            throw new IllegalArgumentException("Events need an aggregate type, aggregate id and event type");
        }
        this.eventId = eventId;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.payload = payload;
        this.occurredOn = occurredOn != null ? occurredOn : Instant.now();
        this.createdAt = Instant.now();
    }
    
    public String getEventId() { return eventId; }
    public String getAggregateType() { return aggregateType; }
    public String getAggregateId() { return aggregateId; }
    public String getEventType() { return eventType; }
    public String getPayload() { return payload; }
    public Instant getOccurredOn() { return occurredOn; }
    public Instant getCreatedAt() { return createdAt; }
}
