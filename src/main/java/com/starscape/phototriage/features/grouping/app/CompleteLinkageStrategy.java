package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Complete linkage inside each connected component, followed by a bridge merge.
 * <p>
 * Pairs are taken closest first. Two clusters merge only when every cross pair between them is
 * same-scene, which yields tight cores. The bridge merge then works with pairs whose primary
 * distance is at most {@code bridgeMaxPrimary}: two cores of two or more photos are joined when at
 * least {@code bridgeMinPairs} such pairs run between them, and a photo left on its own joins
 * every core it has one such pair with.
 */
public class CompleteLinkageStrategy implements ClusteringStrategy {
    
    private static final Logger log = LoggerFactory.getLogger(CompleteLinkageStrategy.class);
    
    private final int bridgeMinPairs;
    private final int bridgeMaxPrimary;
    
    public CompleteLinkageStrategy(int bridgeMinPairs, int bridgeMaxPrimary) {
        if (bridgeMinPairs < 1) {
            throw new IllegalArgumentException("Bridge merge needs at least one pair");
        }
        this.bridgeMinPairs = bridgeMinPairs;
        this.bridgeMaxPrimary = bridgeMaxPrimary;
    }
    
    @Override
    public LinkageMode mode() {
        return LinkageMode.COMPLETE;
    }
    
    @Override
    public List<int[]> cluster(int candidateCount, List<PairDistance> pairs) {
        DisjointSet components = new DisjointSet(candidateCount);
        for (PairDistance pair : pairs) {
            components.union(pair.left(), pair.right());
        }
        
        Map<Integer, List<PairDistance>> pairsByComponent = new HashMap<>();
        for (PairDistance pair : pairs) {
            pairsByComponent.computeIfAbsent(components.find(pair.left()), root -> new ArrayList<>()).add(pair);
        }
        
        // Components are disjoint, so one forest holds the cores of all of them
        DisjointSet cores = new DisjointSet(candidateCount);
        for (List<PairDistance> componentPairs : pairsByComponent.values()) {
            linkCores(cores, componentPairs);
        }
        int coreCount = cores.sets(2).size();
        
        int bridged = 0;
        for (List<PairDistance> componentPairs : pairsByComponent.values()) {
            bridged += bridgeCores(cores, componentPairs);
        }
        
        List<int[]> clusters = cores.sets(2);
        log.debug("Complete linkage: {} components, {} cores, {} bridge merges, {} clusters",
            pairsByComponent.size(), coreCount, bridged, clusters.size());
        return clusters;
    }
    
    /**
     * Greedy complete linkage over one component's pairs, closest first.
     */
    private void linkCores(DisjointSet cores, List<PairDistance> componentPairs) {
        Set<Long> sameScene = new HashSet<>(componentPairs.size() * 2);
        for (PairDistance pair : componentPairs) {
            sameScene.add(key(pair.left(), pair.right()));
        }
        
        List<PairDistance> ordered = new ArrayList<>(componentPairs);
        ordered.sort(PairDistance.CLOSEST_FIRST);
        
        Map<Integer, List<Integer>> members = new HashMap<>();
        for (PairDistance pair : ordered) {
            int rootA = cores.find(pair.left());
            int rootB = cores.find(pair.right());
            if (rootA == rootB) {
                continue;
            }
            List<Integer> membersA = members.getOrDefault(rootA, List.of(pair.left()));
            List<Integer> membersB = members.getOrDefault(rootB, List.of(pair.right()));
            if (!allSameScene(membersA, membersB, sameScene)) {
                continue;
            }
            cores.union(rootA, rootB);
            List<Integer> merged = new ArrayList<>(membersA.size() + membersB.size());
            merged.addAll(membersA);
            merged.addAll(membersB);
            members.remove(rootA);
            members.remove(rootB);
            members.put(cores.find(rootA), merged);
        }
    }
    
    private static boolean allSameScene(List<Integer> a, List<Integer> b, Set<Long> sameScene) {
        for (int x : a) {
            for (int y : b) {
                if (!sameScene.contains(key(Math.min(x, y), Math.max(x, y)))) {
                    return false;
                }
            }
        }
        return true;
    }
    
    /**
     * Joins cores that enough close pairs connect; one pair is enough when either side is a single
     * photo. Qualification is judged on the cores as linked, so the outcome does not depend on the
     * order merges happen in.
     *
     * @return number of core pairs joined
     */
    private int bridgeCores(DisjointSet cores, List<PairDistance> componentPairs) {
        Map<Long, Integer> bridgeCounts = new TreeMap<>();
        for (PairDistance pair : componentPairs) {
            if (pair.primary() > bridgeMaxPrimary) {
                continue;
            }
            int coreA = cores.find(pair.left());
            int coreB = cores.find(pair.right());
            if (coreA == coreB) {
                continue;
            }
            bridgeCounts.merge(key(Math.min(coreA, coreB), Math.max(coreA, coreB)), 1, Integer::sum);
        }
        
        List<int[]> joins = new ArrayList<>();
        for (Map.Entry<Long, Integer> entry : bridgeCounts.entrySet()) {
            int coreA = (int) (entry.getKey() >>> 32);
            int coreB = (int) (entry.getKey() & 0xFFFFFFFFL);
            boolean loneEnd = cores.sizeOf(coreA) < 2 || cores.sizeOf(coreB) < 2;
            if (loneEnd || entry.getValue() >= bridgeMinPairs) {
                joins.add(new int[] {coreA, coreB});
            }
        }
        for (int[] join : joins) {
            cores.union(join[0], join[1]);
        }
        return joins.size();
    }
    
    private static long key(int a, int b) {
        return ((long) a << 32) | (b & 0xFFFFFFFFL);
    }
    
    public int getBridgeMinPairs() {
        return bridgeMinPairs;
    }
    
    public int getBridgeMaxPrimary() {
        return bridgeMaxPrimary;
    }
}
