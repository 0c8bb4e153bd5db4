package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.grouping.domain.LinkageMode;

import java.util.List;

/**
 * Groups ordered by group id, plus diagnostics. {@code unlinkedPairs} counts same-scene pairs
 * whose photos ended up outside a common group. {@code widthMismatches} counts photos left out
 * because their primary hash width differs from the rest of the batch.
 */
public record GroupingResult(
    LinkageMode linkage,
    int candidates,
    int sameScenePairs,
    int unlinkedPairs,
    List<DuplicateGroup> groups,
    int widthMismatches
) {
    public GroupingResult {
        groups = List.copyOf(groups);
    }
    
    public int groupedPhotos() {
        return groups.stream().mapToInt(DuplicateGroup::size).sum();
    }
    
    public int singletons() {
        return candidates - groupedPhotos();
    }
}
