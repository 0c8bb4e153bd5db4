package com.starscape.phototriage.features.pipeline.domain;

import java.util.List;
import java.util.Optional;

public interface PipelineRunRepository {
    PipelineRun save(PipelineRun run);
    PipelineRun saveAndFlush(PipelineRun run);
    Optional<PipelineRun> findById(String runId);
    boolean existsByStatus(RunStatus status);
    List<PipelineRun> findByStatus(RunStatus status);
    Optional<PipelineRun> findFirstByOrderByStartedAtDesc();
}
