package com.starscape.phototriage.features.grouping.app;

import java.util.ArrayList;
import java.util.List;

/**
 * Union-find over dense indices {@code 0..size-1}, with union by size and path compression.
 */
public class DisjointSet {
    
    private final int[] parent;
    private final int[] size;
    
    public DisjointSet(int elements) {
        parent = new int[elements];
        size = new int[elements];
        for (int i = 0; i < elements; i++) {
            parent[i] = i;
            size[i] = 1;
        }
    }
    
    public int find(int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }
    
    /**
     * @return true if the two elements were in different sets
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB]) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        return true;
    }
    
    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }
    
    public int sizeOf(int x) {
        return size[find(x)];
    }
    
    public int elements() {
        return parent.length;
    }
    
    /**
     * Sets with at least {@code minSize} members. Each set is in ascending index order and sets
     * are ordered by their smallest index.
     */
    public List<int[]> sets(int minSize) {
        int n = parent.length;
        int[] slot = new int[n];
        int[] fill = new int[n];
        List<int[]> sets = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            slot[i] = -1;
        }
        for (int i = 0; i < n; i++) {
            int root = find(i);
            if (size[root] < minSize) {
                continue;
            }
            if (slot[root] < 0) {
                slot[root] = sets.size();
                sets.add(new int[size[root]]);
            }
            sets.get(slot[root])[fill[root]++] = i;
        }
        return sets;
    }
}
