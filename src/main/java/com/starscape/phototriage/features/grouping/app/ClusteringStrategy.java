package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.grouping.domain.LinkageMode;

import java.util.List;

/**
 * Turns same-scene pairs into clusters of candidate indices.
 */
public interface ClusteringStrategy {
    
    LinkageMode mode();
    
    /**
     * @param candidateCount number of candidates; indices run from 0 to {@code candidateCount - 1}
     * @param pairs every same-scene pair, {@code left < right}
     * @return clusters of at least two members, each in ascending index order, ordered by smallest index
     */
    List<int[]> cluster(int candidateCount, List<PairDistance> pairs);
}
