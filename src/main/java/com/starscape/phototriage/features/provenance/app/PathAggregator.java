package com.starscape.phototriage.features.provenance.app;

import com.starscape.phototriage.features.catalog.domain.PhotoPath;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupOutcome;
import com.starscape.phototriage.features.grouprules.app.QualityHint;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;
import com.starscape.phototriage.features.provenance.domain.AggregatedPath;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Moves the provenance of rejected photos onto survivors of the same group, so no source location
 * is forgotten. Paths go to the kept counterpart when it survived, else to the best survivor by
 * {@link QualityHint}.
 */
@Component
public class PathAggregator {
    
    /**
     * @param outcome the final outcome of one group
     * @param members every member of the group, rejected ones included
     */
    public List<AggregatedPath> aggregate(GroupOutcome outcome, Collection<GroupMember> members) {
        if (outcome.rejections().isEmpty()) {
            return List.of();
        }
        if (outcome.survivors().isEmpty()) {
            throw new IllegalStateException("Group " + outcome.groupId() + " has no survivor to receive paths");
        }
        
        Map<String, GroupMember> byId = new HashMap<>();
        for (GroupMember member : members) {
            byId.put(member.photoId(), member);
        }
        Set<String> survivorIds = new HashSet<>();
        for (GroupMember survivor : outcome.survivors()) {
            survivorIds.add(survivor.photoId());
        }
        GroupMember fallback = QualityHint.best(outcome.survivors());
        
        Set<List<String>> seen = new HashSet<>();
        List<AggregatedPath> aggregated = new ArrayList<>();
        for (RuleRejection rejection : outcome.rejections()) {
            GroupMember rejected = byId.get(rejection.photoId());
            if (rejected == null) {
                throw new IllegalArgumentException(
                    "Rejected photo " + rejection.photoId() + " is not a member of group " + outcome.groupId());
            }
            String target = rejection.keptPhotoId() != null && survivorIds.contains(rejection.keptPhotoId())
                ? rejection.keptPhotoId()
                : fallback.photoId();
            
            for (PhotoPath path : rejected.facts().paths()) {
                if (seen.add(List.of(target, path.getSourcePath(), rejected.photoId()))) {
                    aggregated.add(new AggregatedPath(target, path.getSourcePath(), rejected.photoId()));
                }
            }
        }
        return aggregated;
    }
}
