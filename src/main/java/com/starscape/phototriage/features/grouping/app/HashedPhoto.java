package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.hashing.domain.PerceptualHash;

/**
 * A grouping candidate. The secondary hash may be missing.
 */
public record HashedPhoto(String photoId, PerceptualHash primary, PerceptualHash secondary) {
    
    public HashedPhoto {
        if (photoId == null || primary == null) {
            throw new IllegalArgumentException("Grouping candidates need an id and a primary hash");
        }
    }
}
