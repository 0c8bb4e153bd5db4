package com.starscape.phototriage.features.pipeline.api.dto;

public record StartRunResponse(
    String runId,
    String status,
    String linkage
) {}
