package com.starscape.phototriage.features.pipeline.api.dto;

import java.util.List;
import java.util.Map;

/**
 * Catalog-wide counts. {@code keptPhotos} are photos with neither an individual decision nor a
 * group rejection.
 */
public record PipelineStatusResponse(
    long totalPhotos,
    long totalPaths,
    long hashedPhotos,
    List<DecisionCountItem> individualDecisions,
    long groups,
    long groupedPhotos,
    Map<String, Long> groupRejectionsByRule,
    long aggregatedPaths,
    long photosWithAggregatedPaths,
    long keptPhotos,
    List<CheckpointItem> checkpoints,
    PipelineRunResponse lastRun
) {}
