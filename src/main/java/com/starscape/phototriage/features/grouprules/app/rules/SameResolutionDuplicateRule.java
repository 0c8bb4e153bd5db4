package com.starscape.phototriage.features.grouprules.app.rules;

import com.starscape.phototriage.features.grouprules.app.DistanceTable;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupRule;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;

import java.util.*;

/**
 * Breaks ties between copies at identical resolution whose hashes match: the larger file wins,
 * then the one carrying EXIF, then the smaller photo id.
 */
public class SameResolutionDuplicateRule implements GroupRule {
    
    public static final String NAME = "SAME_RESOLUTION_DUPLICATE";
    
    private static final Comparator<GroupMember> PREFERRED_FIRST = Comparator
        .comparingLong(GroupMember::bytes)
        .thenComparing(GroupMember::hasExif)
        .reversed()
        .thenComparing(GroupMember::photoId);
    
    private final int maxPrimaryDistance;
    
    public SameResolutionDuplicateRule(int maxPrimaryDistance) {
        this.maxPrimaryDistance = maxPrimaryDistance;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances) {
        List<GroupMember> ordered = new ArrayList<>(survivors);
        ordered.sort(PREFERRED_FIRST);
        
        Set<String> rejected = new HashSet<>();
        List<RuleRejection> rejections = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            GroupMember keeper = ordered.get(i);
            if (rejected.contains(keeper.photoId())) {
                continue;
            }
            for (int j = i + 1; j < ordered.size(); j++) {
                GroupMember other = ordered.get(j);
                if (!rejected.contains(other.photoId()) && isCopy(keeper, other, distances)) {
                    rejected.add(other.photoId());
                    rejections.add(new RuleRejection(other.photoId(), keeper.photoId(), NAME));
                }
            }
        }
        return rejections;
    }
    
    private boolean isCopy(GroupMember a, GroupMember b, DistanceTable distances) {
        if (!a.hasResolution() || !b.hasResolution() || a.resolution() != b.resolution()) {
            return false;
        }
        if (distances.primary(a, b) > maxPrimaryDistance) {
            return false;
        }
        int secondary = distances.secondary(a, b);
        return secondary == DistanceTable.UNKNOWN || secondary == 0;
    }
}
