package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.features.classify.app.ClassificationSummary;
import com.starscape.phototriage.features.classify.app.ClassifyPhotosHandler;
import com.starscape.phototriage.features.grouping.app.GroupPhotosHandler;
import com.starscape.phototriage.features.grouping.app.GroupingResult;
import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import com.starscape.phototriage.features.grouprules.app.ApplyGroupRulesHandler;
import com.starscape.phototriage.features.grouprules.app.GroupRulesSummary;
import com.starscape.phototriage.features.pipeline.domain.StageName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs classify, group and group rules one after another, each in its own transaction.
 * A failing stage rolls back only itself; the run is then marked failed and stops.
 */
@Service
public class PipelineOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    
    private final ClassifyPhotosHandler classifyPhotosHandler;
    private final GroupPhotosHandler groupPhotosHandler;
    private final ApplyGroupRulesHandler applyGroupRulesHandler;
    private final PipelineRunTracker tracker;
    
    public PipelineOrchestrator(
            ClassifyPhotosHandler classifyPhotosHandler,
            GroupPhotosHandler groupPhotosHandler,
            ApplyGroupRulesHandler applyGroupRulesHandler,
            PipelineRunTracker tracker) {
        this.classifyPhotosHandler = classifyPhotosHandler;
        this.groupPhotosHandler = groupPhotosHandler;
        this.applyGroupRulesHandler = applyGroupRulesHandler;
        this.tracker = tracker;
    }
    
    @Async("pipelineExecutor")
    public void execute(String runId, LinkageMode linkage, boolean reclassify) {
        run(runId, linkage, reclassify);
    }
    
    /**
     * @return true if every stage completed
     */
    public boolean run(String runId, LinkageMode linkage, boolean reclassify) {
        StageName stage = StageName.CLASSIFY;
        try {
            tracker.enterStage(runId, stage);
            ClassificationSummary classification = classifyPhotosHandler.handle(runId, reclassify);
            tracker.classified(runId, classification);
            
            stage = StageName.GROUP;
            tracker.enterStage(runId, stage);
            GroupingResult grouping = groupPhotosHandler.handle(runId, linkage);
            tracker.grouped(runId, grouping);
            
            stage = StageName.GROUP_RULES;
            tracker.enterStage(runId, stage);
            GroupRulesSummary groupRules = applyGroupRulesHandler.handle(runId);
            tracker.groupRulesApplied(runId, groupRules);
            
            tracker.complete(runId);
            return true;
        } catch (RuntimeException e) {
            log.error("Pipeline run {} failed in stage {}", runId, stage, e);
            tracker.fail(runId, stage + ": " + e.getMessage());
            return false;
        }
    }
}
