package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.common.config.TriageProperties;
import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import com.starscape.phototriage.features.pipeline.api.dto.StartRunRequest;
import com.starscape.phototriage.features.pipeline.api.dto.StartRunResponse;
import com.starscape.phototriage.features.pipeline.domain.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Opens a run and hands it to the pipeline executor. The run row is committed before the
 * executor picks it up; a run the executor refuses is failed straight away.
 */
@Service
public class StartPipelineRunHandler {
    
    private static final Logger log = LoggerFactory.getLogger(StartPipelineRunHandler.class);
    
    private final PipelineRunTracker tracker;
    private final PipelineOrchestrator orchestrator;
    private final TriageProperties properties;
    
    public StartPipelineRunHandler(
            PipelineRunTracker tracker,
            PipelineOrchestrator orchestrator,
            TriageProperties properties) {
        this.tracker = tracker;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }
    
    public StartRunResponse handle(StartRunRequest request) {
        LinkageMode linkage = request != null && request.linkage() != null
            ? request.linkage()
            : properties.getGrouping().getLinkage();
        boolean reclassify = request != null && Boolean.TRUE.equals(request.reclassify());
        
        PipelineRun run = tracker.open(linkage, reclassify);
        try {
            orchestrator.execute(run.getRunId(), linkage, reclassify);
        } catch (TaskRejectedException e) {
            log.error("Pipeline executor rejected run {}", run.getRunId(), e);
            tracker.fail(run.getRunId(), "Rejected by pipeline executor: " + e.getMessage());
            throw new IllegalStateException("Pipeline executor is busy, run " + run.getRunId() + " was not started", e);
        }
        
        return new StartRunResponse(run.getRunId(), run.getStatus().name(), linkage.name());
    }
}
