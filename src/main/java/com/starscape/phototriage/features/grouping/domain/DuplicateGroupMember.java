package com.starscape.phototriage.features.grouping.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Membership of one photo in a duplicate group. The group id is the smallest photo id of the group.
 */
@Entity
@Table(name = "duplicate_groups")
public class DuplicateGroupMember {
    
    @Id
    @Column(name = "photo_id")
    private String photoId;
    
    @Column(name = "group_id", nullable = false)
    private String groupId;
    
    @Column(name = "run_id")
    private String runId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected DuplicateGroupMember() {
        // JPA constructor
    }
    
    public DuplicateGroupMember(String photoId, String groupId, String runId) {
        if (photoId == null || groupId == null) {
            throw new IllegalArgumentException("Photo ID and group ID are required");
        }
        this.photoId = photoId;
        this.groupId = groupId;
        this.runId = runId;
        this.createdAt = Instant.now();
    }
    
    public String getPhotoId() { return photoId; }
    public String getGroupId() { return groupId; }
    public String getRunId() { return runId; }
    public Instant getCreatedAt() { return createdAt; }
}
