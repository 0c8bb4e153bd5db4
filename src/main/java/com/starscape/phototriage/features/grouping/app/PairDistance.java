package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.hashing.domain.HashCodec;

import java.util.Comparator;

/**
 * Distances between the candidates at indices {@code left < right}. A secondary distance of
 * {@link #UNKNOWN} means at least one side has no secondary hash.
 */
public record PairDistance(int left, int right, int primary, int secondary) {
    
    public static final int UNKNOWN = -1;
    
    /** Closest first; ties fall back to candidate order so the result never depends on input order. */
    public static final Comparator<PairDistance> CLOSEST_FIRST = Comparator
        .comparingInt(PairDistance::primary)
        .thenComparingInt(PairDistance::secondaryOrMax)
        .thenComparingInt(PairDistance::left)
        .thenComparingInt(PairDistance::right);
    
    public static PairDistance between(int left, int right, HashedPhoto a, HashedPhoto b) {
        int primary = HashCodec.distance(a.primary(), b.primary());
        int secondary = a.secondary() != null && b.secondary() != null
            ? HashCodec.distance(a.secondary(), b.secondary())
            : UNKNOWN;
        return new PairDistance(left, right, primary, secondary);
    }
    
    public boolean hasSecondary() {
        return secondary != UNKNOWN;
    }
    
    int secondaryOrMax() {
        return hasSecondary() ? secondary : Integer.MAX_VALUE;
    }
}
