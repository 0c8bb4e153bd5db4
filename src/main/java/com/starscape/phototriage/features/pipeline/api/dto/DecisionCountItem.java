package com.starscape.phototriage.features.pipeline.api.dto;

public record DecisionCountItem(
    String decision,
    String ruleName,
    long count
) {}
