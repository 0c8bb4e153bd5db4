package com.starscape.phototriage.features.grouprules.app.rules;

import com.starscape.phototriage.features.grouprules.app.DistanceTable;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupRule;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rejects scaled-down copies: clearly lower resolution than the largest member, and nearly
 * identical primary hash.
 */
public class ResolutionDerivativeRule implements GroupRule {
    
    public static final String NAME = "RESOLUTION_DERIVATIVE";
    
    private final int maxDistance;
    private final double resolutionRatio;
    
    public ResolutionDerivativeRule(int maxDistance, double resolutionRatio) {
        this.maxDistance = maxDistance;
        this.resolutionRatio = resolutionRatio;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances) {
        if (survivors.size() < 2) {
            return List.of();
        }
        GroupMember largest = survivors.stream()
            .min(Comparator.comparingLong(GroupMember::resolution)
                .thenComparingLong(GroupMember::bytes)
                .reversed()
                .thenComparing(GroupMember::photoId))
            .orElseThrow();
        
        List<RuleRejection> rejections = new ArrayList<>();
        for (GroupMember member : survivors) {
            if (member == largest || !member.hasResolution()) {
                continue;
            }
            if (member.resolution() < largest.resolution() * resolutionRatio
                    && distances.primary(member, largest) <= maxDistance) {
                rejections.add(new RuleRejection(member.photoId(), largest.photoId(), NAME));
            }
        }
        return rejections;
    }
}
