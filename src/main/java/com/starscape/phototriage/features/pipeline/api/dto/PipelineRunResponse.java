package com.starscape.phototriage.features.pipeline.api.dto;

import java.time.Instant;

public record PipelineRunResponse(
    String runId,
    String status,
    String currentStage,
    String linkage,
    int bridgeMinPairs,
    int bridgeMaxPrimary,
    boolean reclassify,
    int classifiedRejected,
    int classifiedSeparated,
    int classifiedAccepted,
    int groupingCandidates,
    int groupsFormed,
    int groupedPhotos,
    int unlinkedPairs,
    int groupRejections,
    int aggregatedPaths,
    int guardTrips,
    String failureMessage,
    Instant startedAt,
    Instant finishedAt
) {}
