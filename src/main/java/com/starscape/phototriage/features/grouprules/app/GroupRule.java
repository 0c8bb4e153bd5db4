package com.starscape.phototriage.features.grouprules.app;

import java.util.List;

/**
 * A relational rule over the members of one duplicate group.
 */
public interface GroupRule {
    
    String name();
    
    /**
     * @param survivors members not rejected so far, in photo-id order
     * @param distances distances between all members of the group
     * @return proposed rejections; every rejected id must be one of {@code survivors}
     */
    List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances);
}
