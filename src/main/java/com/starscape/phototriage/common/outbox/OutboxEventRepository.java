package com.starscape.phototriage.common.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {
    
    List<OutboxEvent> findByAggregateTypeAndAggregateIdOrderByCreatedAtAscEventIdAsc(String aggregateType, String aggregateId);
}
