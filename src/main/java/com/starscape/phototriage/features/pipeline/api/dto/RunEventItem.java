package com.starscape.phototriage.features.pipeline.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record RunEventItem(
    String eventId,
    String eventType,
    Instant occurredOn,
    JsonNode payload
) {}
