package com.starscape.phototriage.features.classify.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * The verdict of an individual rule on one photo. At most one exists per photo.
 */
@Entity
@Table(name = "individual_decisions")
public class IndividualDecision {
    
    @Id
    @Column(name = "photo_id")
    private String photoId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Decision decision;
    
    @Column(name = "rule_name", nullable = false)
    private String ruleName;
    
    @Column(name = "run_id")
    private String runId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected IndividualDecision() {
        // JPA constructor
    }
    
    public IndividualDecision(String photoId, Decision decision, String ruleName, String runId) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("Photo ID cannot be blank");
        }
        if (decision == null) {
            throw new IllegalArgumentException("Decision cannot be null");
        }
        if (ruleName == null || ruleName.isBlank()) {
            throw new IllegalArgumentException("Rule name cannot be blank");
        }
        this.photoId = photoId;
        this.decision = decision;
        this.ruleName = ruleName;
        this.runId = runId;
        this.createdAt = Instant.now();
    }
    
    public boolean sameVerdictAs(Decision otherDecision, String otherRule) {
        return decision == otherDecision && ruleName.equals(otherRule);
    }
    
    public String getPhotoId() { return photoId; }
    public Decision getDecision() { return decision; }
    public String getRuleName() { return ruleName; }
    public String getRunId() { return runId; }
    public Instant getCreatedAt() { return createdAt; }
}
