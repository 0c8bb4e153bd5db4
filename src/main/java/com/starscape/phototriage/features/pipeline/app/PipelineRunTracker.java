package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.common.config.TriageProperties;
import com.starscape.phototriage.common.domain.DomainEvent;
import com.starscape.phototriage.common.exception.NotFoundException;
import com.starscape.phototriage.common.outbox.OutboxService;
import com.starscape.phototriage.features.classify.app.ClassificationSummary;
import com.starscape.phototriage.features.grouping.app.GroupingResult;
import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import com.starscape.phototriage.features.grouprules.app.GroupRulesSummary;
import com.starscape.phototriage.features.pipeline.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Persists run progress: status, per-stage counters, checkpoints and outbox events. Each method
 * commits on its own, outside the stage transactions.
 */
@Service
public class PipelineRunTracker {
    
    private static final Logger log = LoggerFactory.getLogger(PipelineRunTracker.class);
    static final String AGGREGATE_TYPE = "PipelineRun";
    
    private final PipelineRunRepository runRepository;
    private final StageCheckpointRepository checkpointRepository;
    private final OutboxService outboxService;
    private final TriageProperties properties;
    
    public PipelineRunTracker(
            PipelineRunRepository runRepository,
            StageCheckpointRepository checkpointRepository,
            OutboxService outboxService,
            TriageProperties properties) {
        this.runRepository = runRepository;
        this.checkpointRepository = checkpointRepository;
        this.outboxService = outboxService;
        this.properties = properties;
    }
    
    /**
     * @throws IllegalStateException if another run is still running
     */
    @Transactional
    public PipelineRun open(LinkageMode linkage, boolean reclassify) {
        if (runRepository.existsByStatus(RunStatus.RUNNING)) {
            throw new IllegalStateException("A pipeline run is already in progress");
        }
        String runId = "run_" + UUID.randomUUID().toString().replace("-", "");
        TriageProperties.Grouping grouping = properties.getGrouping();
        PipelineRun run = new PipelineRun(
            runId, linkage, grouping.getBridgeMinPairs(), grouping.getBridgeMaxPrimaryDistance(), reclassify);
        try {
            runRepository.saveAndFlush(run);
        } catch (DataIntegrityViolationException e) {
            throw new IllegalStateException("A pipeline run is already in progress", e);
        }
        log.info("Opened pipeline run {} (linkage={}, reclassify={})", runId, linkage, reclassify);
        return run;
    }
    
    @Transactional
    public void enterStage(String runId, StageName stage) {
        PipelineRun run = load(runId);
        run.enterStage(stage);
        runRepository.save(run);
        log.info("Run {} entering stage {}", runId, stage);
    }
    
    @Transactional
    public void classified(String runId, ClassificationSummary summary) {
        PipelineRun run = load(runId);
        run.completeClassification(summary.rejected(), summary.separated(), summary.accepted());
        checkpoint(StageName.CLASSIFY, runId, summary.examined(), "byRule=" + summary.byRule());
        saveAndPublish(run);
    }
    
    @Transactional
    public void grouped(String runId, GroupingResult result) {
        PipelineRun run = load(runId);
        run.completeGrouping(result.candidates(), result.groups().size(), result.groupedPhotos(), result.unlinkedPairs());
        checkpoint(StageName.GROUP, runId, result.candidates(),
            "linkage=" + result.linkage() + ", sameScenePairs=" + result.sameScenePairs());
        saveAndPublish(run);
    }
    
    @Transactional
    public void groupRulesApplied(String runId, GroupRulesSummary summary) {
        PipelineRun run = load(runId);
        run.completeGroupRules(summary.groups(), summary.rejections(), summary.aggregatedPaths(), summary.guardTrips().size());
        checkpoint(StageName.GROUP_RULES, runId, summary.groups(), "byRule=" + summary.byRule());
        saveAndPublish(run);
    }
    
    @Transactional
    public void complete(String runId) {
        PipelineRun run = load(runId);
        run.complete();
        saveAndPublish(run);
        log.info("Pipeline run {} completed", runId);
    }
    
    @Transactional
    public void fail(String runId, String message) {
        PipelineRun run = load(runId);
        run.fail(message);
        saveAndPublish(run);
    }
    
    /**
     * A run still marked running at startup was cut off by a shutdown; it would block every new run.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void failInterruptedRuns() {
        for (PipelineRun run : runRepository.findByStatus(RunStatus.RUNNING)) {
            log.warn("Marking interrupted pipeline run {} as failed (stage {})", run.getRunId(), run.getCurrentStage());
            run.fail("Interrupted by application shutdown");
            saveAndPublish(run);
        }
    }
    
    private PipelineRun load(String runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("Pipeline run not found: " + runId));
    }
    
    private void checkpoint(StageName stage, String runId, int processed, String notes) {
        StageCheckpoint checkpoint = checkpointRepository.findById(stage).orElseGet(() -> new StageCheckpoint(stage));
        checkpoint.record(runId, processed, notes);
        checkpointRepository.save(checkpoint);
    }
    
    private void saveAndPublish(PipelineRun run) {
        runRepository.save(run);
        for (DomainEvent event : run.pullDomainEvents()) {
            outboxService.publish(event, AGGREGATE_TYPE);
        }
    }
}
