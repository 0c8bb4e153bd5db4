package com.starscape.phototriage.features.pipeline.api.dto;

import java.time.Instant;

public record CheckpointItem(
    String stage,
    String runId,
    int processedCount,
    String notes,
    Instant completedAt
) {}
