package com.starscape.phototriage.features.catalog.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A source location at which a photo's content was found. Append-only: a path outlives
 * any decision taken about its photo.
 */
@Entity
@Table(name = "photo_paths")
public class PhotoPath {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "path_id")
    private Long pathId;
    
    @Column(name = "photo_id", nullable = false, updatable = false)
    private String photoId;
    
    @Column(name = "source_path", nullable = false, updatable = false)
    private String sourcePath;
    
    @Column(nullable = false, updatable = false)
    private String filename;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected PhotoPath() {
        // JPA constructor
    }
    
    public PhotoPath(String photoId, String sourcePath) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("Photo ID cannot be blank");
        }
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("Source path cannot be blank");
        }
        this.photoId = photoId;
        this.sourcePath = sourcePath;
        this.filename = filenameOf(sourcePath);
        this.createdAt = Instant.now();
    }
    
    public static String filenameOf(String path) {
        int lastSlash = path.lastIndexOf('/');
        return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
    }
    
    /** Filename without its last extension; dot-files keep their name. */
    public static String stemOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
    
    public Long getPathId() { return pathId; }
    public String getPhotoId() { return photoId; }
    public String getSourcePath() { return sourcePath; }
    public String getFilename() { return filename; }
    public Instant getCreatedAt() { return createdAt; }
}
