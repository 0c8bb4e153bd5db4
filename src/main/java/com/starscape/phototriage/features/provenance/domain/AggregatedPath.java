package com.starscape.phototriage.features.provenance.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A source path of a rejected photo, carried over to the photo kept in its place.
 */
@Entity
@Table(name = "aggregated_paths")
public class AggregatedPath {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "kept_photo_id", nullable = false)
    private String keptPhotoId;
    
    @Column(name = "source_path", nullable = false)
    private String sourcePath;
    
    @Column(name = "from_photo_id", nullable = false)
    private String fromPhotoId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected AggregatedPath() {
        // JPA constructor
    }
    
    public AggregatedPath(String keptPhotoId, String sourcePath, String fromPhotoId) {
        if (keptPhotoId == null || sourcePath == null || fromPhotoId == null) {
            throw new IllegalArgumentException("Kept photo, source path and origin photo are required");
        }
        if (keptPhotoId.equals(fromPhotoId)) {
            throw new IllegalArgumentException("Cannot aggregate paths of photo " + keptPhotoId + " onto itself");
        }
        this.keptPhotoId = keptPhotoId;
        this.sourcePath = sourcePath;
        this.fromPhotoId = fromPhotoId;
        this.createdAt = Instant.now();
    }
    
    public Long getId() { return id; }
    public String getKeptPhotoId() { return keptPhotoId; }
    public String getSourcePath() { return sourcePath; }
    public String getFromPhotoId() { return fromPhotoId; }
    public Instant getCreatedAt() { return createdAt; }
}
