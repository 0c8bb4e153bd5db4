package com.starscape.phototriage.features.grouprules.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A photo rejected inside its duplicate group, with the member whose evidence justified it.
 */
@Entity
@Table(name = "group_rejections")
public class GroupRejection {
    
    @Id
    @Column(name = "photo_id")
    private String photoId;
    
    @Column(name = "group_id", nullable = false)
    private String groupId;
    
    @Column(name = "rule_name", nullable = false)
    private String ruleName;
    
    @Column(name = "kept_photo_id")
    private String keptPhotoId;
    
    @Column(name = "run_id")
    private String runId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected GroupRejection() {
        // JPA constructor
    }
    
    public GroupRejection(String photoId, String groupId, String ruleName, String keptPhotoId, String runId) {
        if (photoId == null || groupId == null || ruleName == null) {
            throw new IllegalArgumentException("Photo ID, group ID and rule name are required");
        }
        this.photoId = photoId;
        this.groupId = groupId;
        this.ruleName = ruleName;
        this.keptPhotoId = keptPhotoId;
        this.runId = runId;
        this.createdAt = Instant.now();
    }
    
    public String getPhotoId() { return photoId; }
    public String getGroupId() { return groupId; }
    public String getRuleName() { return ruleName; }
    public String getKeptPhotoId() { return keptPhotoId; }
    public String getRunId() { return runId; }
    public Instant getCreatedAt() { return createdAt; }
}
