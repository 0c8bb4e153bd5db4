package com.starscape.phototriage.features.pipeline.infra;

import com.starscape.phototriage.features.pipeline.domain.StageCheckpoint;
import com.starscape.phototriage.features.pipeline.domain.StageCheckpointRepository;
import com.starscape.phototriage.features.pipeline.domain.StageName;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaStageCheckpointRepository
        extends JpaRepository<StageCheckpoint, StageName>, StageCheckpointRepository {
}
