package com.starscape.phototriage.features.pipeline.domain;

import java.util.List;
import java.util.Optional;

public interface StageCheckpointRepository {
    StageCheckpoint save(StageCheckpoint checkpoint);
    Optional<StageCheckpoint> findById(StageName stage);
    List<StageCheckpoint> findAllByOrderByStageAsc();
}
