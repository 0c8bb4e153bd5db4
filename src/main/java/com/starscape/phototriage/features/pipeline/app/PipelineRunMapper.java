package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.features.pipeline.api.dto.PipelineRunResponse;
import com.starscape.phototriage.features.pipeline.domain.PipelineRun;

final class PipelineRunMapper {
    
    private PipelineRunMapper() {
    }
    
    static PipelineRunResponse toResponse(PipelineRun run) {
        return new PipelineRunResponse(
            run.getRunId(),
            run.getStatus().name(),
            run.getCurrentStage() != null ? run.getCurrentStage().name() : null,
            run.getLinkage().name(),
            run.getBridgeMinPairs(),
            run.getBridgeMaxPrimary(),
            run.isReclassify(),
            run.getClassifiedRejected(),
            run.getClassifiedSeparated(),
            run.getClassifiedAccepted(),
            run.getGroupingCandidates(),
            run.getGroupsFormed(),
            run.getGroupedPhotos(),
            run.getUnlinkedPairs(),
            run.getGroupRejections(),
            run.getAggregatedPaths(),
            run.getGuardTrips(),
            run.getFailureMessage(),
            run.getStartedAt(),
            run.getFinishedAt()
        );
    }
}
