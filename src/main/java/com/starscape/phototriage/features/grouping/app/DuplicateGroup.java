package com.starscape.phototriage.features.grouping.app;

import java.util.List;

/**
 * A cluster of at least two photos. {@code groupId} is the smallest member id and
 * {@code photoIds} is sorted.
 */
public record DuplicateGroup(String groupId, List<String> photoIds) {
    
    public DuplicateGroup {
        photoIds = List.copyOf(photoIds);
        if (photoIds.size() < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least two photos");
        }
    }
    
    public int size() {
        return photoIds.size();
    }
}
