package com.starscape.phototriage.features.grouprules.app;

import java.util.List;
import java.util.Optional;

/**
 * The rejections applied to one group and the members left standing, in photo-id order.
 */
public record GroupOutcome(
    String groupId,
    List<RuleRejection> rejections,
    List<GroupMember> survivors,
    GuardTrip guardTrip
) {
    public GroupOutcome {
        rejections = List.copyOf(rejections);
        survivors = List.copyOf(survivors);
    }
    
    public Optional<GuardTrip> guard() {
        return Optional.ofNullable(guardTrip);
    }
}
