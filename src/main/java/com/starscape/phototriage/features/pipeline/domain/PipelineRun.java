package com.starscape.phototriage.features.pipeline.domain;

import com.starscape.phototriage.common.domain.AggregateRoot;
import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import com.starscape.phototriage.features.pipeline.domain.events.PipelineRunFailed;
import com.starscape.phototriage.features.pipeline.domain.events.StageCompleted;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * One execution of classify, group and group rules, with the clustering settings it used and
 * the counts each stage produced.
 */
@Entity
@Table(name = "pipeline_runs")
public class PipelineRun extends AggregateRoot<String> {
    
    @Id
    @Column(name = "run_id")
    private String runId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LinkageMode linkage;
    
    @Column(name = "bridge_min_pairs", nullable = false)
    private int bridgeMinPairs;
    
    @Column(name = "bridge_max_primary", nullable = false)
    private int bridgeMaxPrimary;
    
    @Column(nullable = false)
    private boolean reclassify;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage")
    private StageName currentStage;
    
    @Column(name = "classified_rejected", nullable = false)
    private int classifiedRejected;
    
    @Column(name = "classified_separated", nullable = false)
    private int classifiedSeparated;
    
    @Column(name = "classified_accepted", nullable = false)
    private int classifiedAccepted;
    
    @Column(name = "grouping_candidates", nullable = false)
    private int groupingCandidates;
    
    @Column(name = "groups_formed", nullable = false)
    private int groupsFormed;
    
    @Column(name = "grouped_photos", nullable = false)
    private int groupedPhotos;
    
    @Column(name = "unlinked_pairs", nullable = false)
    private int unlinkedPairs;
    
    @Column(name = "group_rejections", nullable = false)
    private int groupRejections;
    
    @Column(name = "aggregated_paths", nullable = false)
    private int aggregatedPaths;
    
    @Column(name = "guard_trips", nullable = false)
    private int guardTrips;
    
    @Column(name = "failure_message", length = 2000)
    private String failureMessage;
    
    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Column(name = "finished_at")
    private Instant finishedAt;
    
    protected PipelineRun() {
        // JPA constructor
    }
    
    public PipelineRun(String runId, LinkageMode linkage, int bridgeMinPairs, int bridgeMaxPrimary, boolean reclassify) {
        super(runId);
        if (linkage == null) {
            throw new IllegalArgumentException("Linkage mode is required");
        }
        this.runId = runId;
        this.linkage = linkage;
        this.bridgeMinPairs = bridgeMinPairs;
        this.bridgeMaxPrimary = bridgeMaxPrimary;
        this.reclassify = reclassify;
        this.status = RunStatus.RUNNING;
        this.startedAt = Instant.now();
        this.updatedAt = startedAt;
    }
    
    @Override
    public String getId() {
        return runId;
    }
    
    public void enterStage(StageName stage) {
        requireRunning();
        this.currentStage = stage;
        this.updatedAt = Instant.now();
    }
    
    public void completeClassification(int rejected, int separated, int accepted) {
        requireRunning();
        this.classifiedRejected = rejected;
        this.classifiedSeparated = separated;
        this.classifiedAccepted = accepted;
        stageCompleted(StageName.CLASSIFY, rejected + separated + accepted,
            "rejected=" + rejected + ", separated=" + separated + ", accepted=" + accepted);
    }
    
    public void completeGrouping(int candidates, int groups, int grouped, int unlinked) {
        requireRunning();
        this.groupingCandidates = candidates;
        this.groupsFormed = groups;
        this.groupedPhotos = grouped;
        this.unlinkedPairs = unlinked;
        stageCompleted(StageName.GROUP, candidates,
            "linkage=" + linkage + ", groups=" + groups + ", groupedPhotos=" + grouped + ", unlinkedPairs=" + unlinked);
    }
    
    public void completeGroupRules(int groups, int rejections, int aggregated, int trips) {
        requireRunning();
        this.groupRejections = rejections;
        this.aggregatedPaths = aggregated;
        this.guardTrips = trips;
        stageCompleted(StageName.GROUP_RULES, groups,
            "rejections=" + rejections + ", aggregatedPaths=" + aggregated + ", guardTrips=" + trips);
    }
    
    public void complete() {
        requireRunning();
        this.status = RunStatus.COMPLETED;
        this.currentStage = null;
        this.finishedAt = Instant.now();
        this.updatedAt = finishedAt;
    }
    
    public void fail(String message) {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is already " + status);
        }
        this.status = RunStatus.FAILED;
        this.failureMessage = message != null && message.length() > 2000 ? message.substring(0, 2000) : message;
        this.finishedAt = Instant.now();
        this.updatedAt = finishedAt;
        registerEvent(new PipelineRunFailed(
            runId, currentStage != null ? currentStage.name() : null, failureMessage, finishedAt));
    }
    
    private void stageCompleted(StageName stage, int processed, String summary) {
        this.updatedAt = Instant.now();
        registerEvent(new StageCompleted(runId, stage.name(), processed, summary, updatedAt));
    }
    
    private void requireRunning() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is not running (status " + status + ")");
        }
    }
    
    public String getRunId() { return runId; }
    public LinkageMode getLinkage() { return linkage; }
    public int getBridgeMinPairs() { return bridgeMinPairs; }
    public int getBridgeMaxPrimary() { return bridgeMaxPrimary; }
    public boolean isReclassify() { return reclassify; }
    public RunStatus getStatus() { return status; }
    public StageName getCurrentStage() { return currentStage; }
    public int getClassifiedRejected() { return classifiedRejected; }
    public int getClassifiedSeparated() { return classifiedSeparated; }
    public int getClassifiedAccepted() { return classifiedAccepted; }
    public int getGroupingCandidates() { return groupingCandidates; }
    public int getGroupsFormed() { return groupsFormed; }
    public int getGroupedPhotos() { return groupedPhotos; }
    public int getUnlinkedPairs() { return unlinkedPairs; }
    public int getGroupRejections() { return groupRejections; }
    public int getAggregatedPaths() { return aggregatedPaths; }
    public int getGuardTrips() { return guardTrips; }
    public String getFailureMessage() { return failureMessage; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}
