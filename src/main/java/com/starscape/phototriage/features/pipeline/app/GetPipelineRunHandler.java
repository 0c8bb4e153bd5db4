package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.common.exception.NotFoundException;
import com.starscape.phototriage.features.pipeline.api.dto.PipelineRunResponse;
import com.starscape.phototriage.features.pipeline.domain.PipelineRunRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class GetPipelineRunHandler {
    
    private final PipelineRunRepository runRepository;
    
    public GetPipelineRunHandler(PipelineRunRepository runRepository) {
        this.runRepository = runRepository;
    }
    
    @Transactional(readOnly = true)
    public PipelineRunResponse handle(String runId) {
        return runRepository.findById(runId)
            .map(PipelineRunMapper::toResponse)
            .orElseThrow(() -> new NotFoundException("Pipeline run not found: " + runId));
    }
}
