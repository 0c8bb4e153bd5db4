package com.starscape.phototriage.features.pipeline.infra;

import com.starscape.phototriage.features.pipeline.domain.PipelineRun;
import com.starscape.phototriage.features.pipeline.domain.PipelineRunRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaPipelineRunRepository extends JpaRepository<PipelineRun, String>, PipelineRunRepository {
}
