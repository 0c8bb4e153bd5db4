package com.starscape.phototriage.features.grouprules.app;

import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.hashing.domain.PerceptualHash;

/**
 * A duplicate-group member as group rules see it.
 */
public record GroupMember(PhotoFacts facts, PerceptualHash primary, PerceptualHash secondary) {
    
    public GroupMember {
        if (facts == null || primary == null) {
            throw new IllegalArgumentException("Group members need facts and a primary hash");
        }
    }
    
    public static GroupMember of(PhotoFacts facts) {
        return new GroupMember(facts, facts.photo().primary(), facts.photo().secondary());
    }
    
    public String photoId() {
        return facts.photoId();
    }
    
    /** Pixel area, 0 when dimensions are unknown. */
    public long resolution() {
        return facts.area();
    }
    
    public boolean hasResolution() {
        return facts.hasDimensions();
    }
    
    public long bytes() {
        return facts.photo().getBytes();
    }
    
    public boolean hasExif() {
        return facts.photo().hasExif();
    }
}
