package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Clusters near-duplicate photos. Candidates are put in photo-id order before indexing, so group
 * ids and memberships depend only on the candidate set.
 */
public class SimilarityGrouper {
    
    private static final Logger log = LoggerFactory.getLogger(SimilarityGrouper.class);
    
    private final PairwiseComparator comparator;
    private final Map<LinkageMode, ClusteringStrategy> strategies;
    
    public SimilarityGrouper(PairwiseComparator comparator, List<ClusteringStrategy> strategies) {
        this.comparator = comparator;
        this.strategies = new EnumMap<>(LinkageMode.class);
        for (ClusteringStrategy strategy : strategies) {
            this.strategies.put(strategy.mode(), strategy);
        }
    }
    
    public GroupingResult group(Collection<HashedPhoto> candidates, LinkageMode linkage) {
        ClusteringStrategy strategy = strategies.get(linkage);
        if (strategy == null) {
            throw new IllegalArgumentException("No clustering strategy for linkage " + linkage);
        }
        
        List<HashedPhoto> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparing(HashedPhoto::photoId));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).photoId().equals(ordered.get(i - 1).photoId())) {
                throw new IllegalArgumentException("Duplicate grouping candidate " + ordered.get(i).photoId());
            }
        }
        int before = ordered.size();
        ordered = withCommonWidths(ordered);
        int widthMismatches = before - ordered.size();
        
        List<PairDistance> pairs = comparator.sameScenePairs(ordered);
        List<int[]> clusters = strategy.cluster(ordered.size(), pairs);
        
        int[] clusterOf = new int[ordered.size()];
        Arrays.fill(clusterOf, -1);
        List<DuplicateGroup> groups = new ArrayList<>(clusters.size());
        for (int[] cluster : clusters) {
            List<String> photoIds = new ArrayList<>(cluster.length);
            for (int index : cluster) {
                clusterOf[index] = groups.size();
                photoIds.add(ordered.get(index).photoId());
            }
            // members are in index order, i.e. photo-id order
            groups.add(new DuplicateGroup(photoIds.get(0), photoIds));
        }
        
        int unlinked = 0;
        for (PairDistance pair : pairs) {
            if (clusterOf[pair.left()] < 0 || clusterOf[pair.left()] != clusterOf[pair.right()]) {
                unlinked++;
            }
        }
        
        GroupingResult result = new GroupingResult(
            linkage, ordered.size(), pairs.size(), unlinked, groups, widthMismatches);
        log.info("Grouped {} candidates with {} linkage: {} groups, {} grouped photos, {} same-scene pairs, {} unlinked, {} width mismatches",
            result.candidates(), linkage, groups.size(), result.groupedPhotos(), pairs.size(), unlinked, widthMismatches);
        return result;
    }
    
    /**
     * Hashes of different widths cannot be compared. The most common primary width wins (the
     * narrower one on a tie) and photos with another width are left out; secondary hashes of an
     * uncommon width are dropped, leaving the photo with no secondary evidence.
     */
    static List<HashedPhoto> withCommonWidths(List<HashedPhoto> ordered) {
        if (ordered.isEmpty()) {
            return ordered;
        }
        int primaryWidth = commonWidth(ordered.stream().map(photo -> photo.primary().bitWidth()).toList());
        List<Integer> secondaryWidths = ordered.stream()
            .filter(photo -> photo.secondary() != null && photo.primary().bitWidth() == primaryWidth)
            .map(photo -> photo.secondary().bitWidth())
            .toList();
        int secondaryWidth = secondaryWidths.isEmpty() ? -1 : commonWidth(secondaryWidths);
        
        List<HashedPhoto> kept = new ArrayList<>(ordered.size());
        for (HashedPhoto photo : ordered) {
            if (photo.primary().bitWidth() != primaryWidth) {
                log.warn("Leaving {} out of grouping: {}-bit primary hash, batch uses {} bits",
                    photo.photoId(), photo.primary().bitWidth(), primaryWidth);
                continue;
            }
            if (photo.secondary() != null && photo.secondary().bitWidth() != secondaryWidth) {
                log.warn("Ignoring secondary hash of {}: {} bits, batch uses {} bits",
                    photo.photoId(), photo.secondary().bitWidth(), secondaryWidth);
                kept.add(new HashedPhoto(photo.photoId(), photo.primary(), null));
                continue;
            }
            kept.add(photo);
        }
        return kept;
    }
    
    private static int commonWidth(List<Integer> widths) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (int width : widths) {
            counts.merge(width, 1, Integer::sum);
        }
        int best = -1;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
