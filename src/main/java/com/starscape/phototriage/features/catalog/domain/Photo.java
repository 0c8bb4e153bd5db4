package com.starscape.phototriage.features.catalog.domain;

import com.starscape.phototriage.common.domain.AggregateRoot;
import com.starscape.phototriage.common.exception.InvariantViolationException;
import com.starscape.phototriage.features.hashing.domain.HashCodec;
import com.starscape.phototriage.features.hashing.domain.PerceptualHash;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * One unique image, identified by the SHA-256 checksum of its content.
 * Everything but the two perceptual hashes is fixed at ingestion; each hash is assigned once.
 */
@Entity
@Table(name = "photos")
public class Photo extends AggregateRoot<String> {
    
    @Id
    @Column(name = "photo_id")
    private String photoId;
    
    @Column(name = "mime_type", nullable = false)
    private String mimeType;
    
    @Column(nullable = false)
    private long bytes;
    
    @Column(name = "width")
    private Integer width;
    
    @Column(name = "height")
    private Integer height;
    
    @Column(name = "captured_at")
    private Instant capturedAt;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "date_source")
    private DateSource dateSource;
    
    @Column(name = "has_exif", nullable = false)
    private boolean hasExif;
    
    @Column(name = "primary_hash")
    private String primaryHash;
    
    @Column(name = "secondary_hash")
    private String secondaryHash;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "hashed_at")
    private Instant hashedAt;
    
    protected Photo() {
        // JPA constructor
    }
    
    public Photo(String photoId, String mimeType, long bytes, Integer width, Integer height,
                 Instant capturedAt, DateSource dateSource, boolean hasExif) {
        super(photoId);
        validateInput(photoId, mimeType, bytes, width, height);
        
        this.photoId = photoId;
        this.mimeType = mimeType;
        this.bytes = bytes;
        this.width = width;
        this.height = height;
        this.capturedAt = capturedAt;
        this.dateSource = capturedAt != null ? dateSource : null;
        this.hasExif = hasExif;
        this.createdAt = Instant.now();
    }
    
    private void validateInput(String photoId, String mimeType, long bytes, Integer width, Integer height) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("Photo ID cannot be blank");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("MIME type cannot be blank");
        }
        if (bytes < 0) {
            throw new IllegalArgumentException("Bytes cannot be negative");
        }
        if ((width != null && width < 0) || (height != null && height < 0)) {
            throw new IllegalArgumentException("Dimensions cannot be negative");
        }
    }
    
    @Override
    public String getId() {
        return photoId;
    }
    
    public String getPhotoId() { return photoId; }
    public String getMimeType() { return mimeType; }
    public long getBytes() { return bytes; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }
    public Instant getCapturedAt() { return capturedAt; }
    public DateSource getDateSource() { return dateSource; }
    public boolean hasExif() { return hasExif; }
    public String getPrimaryHash() { return primaryHash; }
    public String getSecondaryHash() { return secondaryHash; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getHashedAt() { return hashedAt; }
    
    public boolean hasPrimaryHash() {
        return primaryHash != null;
    }
    
    public boolean hasSecondaryHash() {
        return secondaryHash != null;
    }
    
    public PerceptualHash primary() {
        return HashCodec.decode(primaryHash);
    }
    
    public PerceptualHash secondary() {
        return HashCodec.decode(secondaryHash);
    }
    
    /**
     * Fill in perceptual hashes. A null argument leaves that hash untouched; re-assigning the
     * value already held is a no-op.
     *
     * @return true if either hash changed
     * @throws InvariantViolationException if a hash is already set to a different value
     */
    public boolean assignHashes(String primaryHex, String secondaryHex) {
        String primary = HashCodec.normalize(primaryHex);
        String secondary = HashCodec.normalize(secondaryHex);
        
        boolean changed = false;
        if (primary != null) {
            if (primaryHash == null) {
                primaryHash = primary;
                changed = true;
            } else if (!Objects.equals(primaryHash, primary)) {
                throw InvariantViolationException.forPhoto("Primary hash already assigned", photoId);
            }
        }
        if (secondary != null) {
            if (secondaryHash == null) {
                secondaryHash = secondary;
                changed = true;
            } else if (!Objects.equals(secondaryHash, secondary)) {
                throw InvariantViolationException.forPhoto("Secondary hash already assigned", photoId);
            }
        }
        if (changed) {
            this.hashedAt = Instant.now();
        }
        return changed;
    }
}
