package com.starscape.phototriage.features.grouping.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Finds every same-scene pair among the candidates. Rows are split into blocks compared in
 * parallel; each block builds its own edge list and the lists are joined in block order.
 */
public class PairwiseComparator {
    
    private static final Logger log = LoggerFactory.getLogger(PairwiseComparator.class);
    
    private final SameScenePredicate predicate;
    private final int blockSize;
    
    public PairwiseComparator(SameScenePredicate predicate, int blockSize) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("Block size must be positive");
        }
        this.predicate = predicate;
        this.blockSize = blockSize;
    }
    
    /**
     * @return qualifying pairs with {@code left < right}, ordered by left then right index
     */
    public List<PairDistance> sameScenePairs(List<HashedPhoto> candidates) {
        int n = candidates.size();
        int blocks = (n + blockSize - 1) / blockSize;
        
        List<PairDistance> edges = IntStream.range(0, blocks)
            .parallel()
            .mapToObj(block -> compareBlock(candidates, block * blockSize, Math.min(n, (block + 1) * blockSize)))
            .flatMap(List::stream)
            .toList();
        
        log.debug("Compared {} candidates in {} blocks: {} same-scene pairs", n, blocks, edges.size());
        return edges;
    }
    
    private List<PairDistance> compareBlock(List<HashedPhoto> candidates, int fromRow, int toRow) {
        List<PairDistance> edges = new ArrayList<>();
        int n = candidates.size();
        int maxPrimary = predicate.maxPrimary();
        for (int i = fromRow; i < toRow; i++) {
            HashedPhoto left = candidates.get(i);
            for (int j = i + 1; j < n; j++) {
                PairDistance pair = PairDistance.between(i, j, left, candidates.get(j));
                if (pair.primary() <= maxPrimary && predicate.sameScene(pair)) {
                    edges.add(pair);
                }
            }
        }
        return edges;
    }
}
