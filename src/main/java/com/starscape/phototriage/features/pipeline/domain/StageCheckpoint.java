package com.starscape.phototriage.features.pipeline.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * The last run that completed a stage.
 */
@Entity
@Table(name = "stage_checkpoints")
public class StageCheckpoint {
    
    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "stage")
    private StageName stage;
    
    @Column(name = "run_id", nullable = false)
    private String runId;
    
    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;
    
    @Column(name = "processed_count", nullable = false)
    private int processedCount;
    
    @Column(length = 2000)
    private String notes;
    
    protected StageCheckpoint() {
        // JPA constructor
    }
    
    public StageCheckpoint(StageName stage) {
        this.stage = stage;
    }
    
    public void record(String runId, int processedCount, String notes) {
        this.runId = runId;
        this.processedCount = processedCount;
        this.notes = notes;
        this.completedAt = Instant.now();
    }
    
    public StageName getStage() { return stage; }
    public String getRunId() { return runId; }
    public Instant getCompletedAt() { return completedAt; }
    public int getProcessedCount() { return processedCount; }
    public String getNotes() { return notes; }
}
