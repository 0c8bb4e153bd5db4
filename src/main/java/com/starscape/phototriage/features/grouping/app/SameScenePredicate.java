package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.common.config.TriageProperties;

/**
 * Decides whether two photos show the same scene from their primary distance {@code p} and
 * secondary distance {@code s}:
 * <ul>
 *   <li>{@code p <= safe}: same, whatever {@code s} is</li>
 *   <li>{@code safe < p <= near}: same when {@code s < nearSecondaryExclusive}</li>
 *   <li>{@code near < p <= far}: same when {@code s <= farSecondaryInclusive}</li>
 *   <li>otherwise different</li>
 * </ul>
 * An unknown secondary distance never confirms a borderline pair.
 */
public final class SameScenePredicate {
    
    private final int safePrimary;
    private final int nearPrimary;
    private final int nearSecondaryExclusive;
    private final int farPrimary;
    private final int farSecondaryInclusive;
    
    public SameScenePredicate(int safePrimary, int nearPrimary, int nearSecondaryExclusive,
                              int farPrimary, int farSecondaryInclusive) {
        if (safePrimary > nearPrimary || nearPrimary > farPrimary) {
            throw new IllegalArgumentException(
                "Primary bands must be ordered: safe <= near <= far, got "
                    + safePrimary + "/" + nearPrimary + "/" + farPrimary);
        }
        this.safePrimary = safePrimary;
        this.nearPrimary = nearPrimary;
        this.nearSecondaryExclusive = nearSecondaryExclusive;
        this.farPrimary = farPrimary;
        this.farSecondaryInclusive = farSecondaryInclusive;
    }
    
    public static SameScenePredicate defaults() {
        return from(new TriageProperties.Grouping());
    }
    
    public static SameScenePredicate from(TriageProperties.Grouping config) {
        return new SameScenePredicate(
            config.getSafePrimaryDistance(),
            config.getNearPrimaryDistance(),
            config.getNearSecondaryExclusive(),
            config.getFarPrimaryDistance(),
            config.getFarSecondaryInclusive());
    }
    
    public boolean sameScene(int primary, int secondary) {
        if (primary <= safePrimary) {
            return true;
        }
        if (secondary < 0) {
            return false;
        }
        if (primary <= nearPrimary) {
            return secondary < nearSecondaryExclusive;
        }
        if (primary <= farPrimary) {
            return secondary <= farSecondaryInclusive;
        }
        return false;
    }
    
    public boolean sameScene(PairDistance pair) {
        return sameScene(pair.primary(), pair.secondary());
    }
    
    /** Largest primary distance that can still be same-scene. */
    public int maxPrimary() {
        return farPrimary;
    }
}
