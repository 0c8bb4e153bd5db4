package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.grouping.domain.LinkageMode;

import java.util.List;

/**
 * Connected components of the same-scene graph.
 */
public class SingleLinkageStrategy implements ClusteringStrategy {
    
    @Override
    public LinkageMode mode() {
        return LinkageMode.SINGLE;
    }
    
    @Override
    public List<int[]> cluster(int candidateCount, List<PairDistance> pairs) {
        DisjointSet components = new DisjointSet(candidateCount);
        for (PairDistance pair : pairs) {
            components.union(pair.left(), pair.right());
        }
        return components.sets(2);
    }
}
