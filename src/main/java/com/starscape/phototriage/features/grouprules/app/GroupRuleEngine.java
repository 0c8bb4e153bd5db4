package com.starscape.phototriage.features.grouprules.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies the group rules to one duplicate group, in priority order.
 * <p>
 * Each rule sees only the members that survived the rules before it. A proposed rejection is
 * applied only while its kept counterpart is still a survivor. Before every rejection the engine
 * checks that another survivor remains; if not, it stops rejecting in this group and reports a
 * {@link GuardTrip}. A group therefore always keeps at least one member.
 */
public class GroupRuleEngine {
    
    private static final Logger log = LoggerFactory.getLogger(GroupRuleEngine.class);
    
    private final List<GroupRule> rules;
    
    public GroupRuleEngine(List<GroupRule> rules) {
        this.rules = List.copyOf(rules);
    }
    
    public List<GroupRule> getRules() {
        return rules;
    }
    
    public GroupOutcome apply(String groupId, List<GroupMember> members) {
        if (members.size() < 2) {
            throw new IllegalArgumentException("Group " + groupId + " has fewer than two members");
        }
        List<GroupMember> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparing(GroupMember::photoId));
        DistanceTable distances = DistanceTable.of(ordered);
        
        Map<String, GroupMember> survivors = new LinkedHashMap<>();
        for (GroupMember member : ordered) {
            survivors.put(member.photoId(), member);
        }
        List<RuleRejection> applied = new ArrayList<>();
        
        for (GroupRule rule : rules) {
            List<GroupMember> snapshot = List.copyOf(survivors.values());
            Set<String> offered = new HashSet<>(survivors.keySet());
            
            for (RuleRejection rejection : rule.evaluate(snapshot, distances)) {
                if (!offered.contains(rejection.photoId())) {
                    throw new IllegalStateException("Rule " + rule.name() + " rejected photo "
                        + rejection.photoId() + " which was not among its survivors in group " + groupId);
                }
                if (!survivors.containsKey(rejection.photoId())) {
                    continue;
                }
                if (survivors.size() <= 1) {
                    GuardTrip trip = new GuardTrip(groupId, rejection.photoId(), rule.name());
                    log.warn("Refusing to reject last survivor {} of group {} (rule {})",
                        rejection.photoId(), groupId, rule.name());
                    return new GroupOutcome(groupId, applied, List.copyOf(survivors.values()), trip);
                }
                if (rejection.keptPhotoId() != null && !survivors.containsKey(rejection.keptPhotoId())) {
                    log.debug("Skipping {} rejection of {} in group {}: kept photo {} is gone",
                        rule.name(), rejection.photoId(), groupId, rejection.keptPhotoId());
                    continue;
                }
                survivors.remove(rejection.photoId());
                applied.add(rejection);
            }
        }
        
        return new GroupOutcome(groupId, applied, List.copyOf(survivors.values()), null);
    }
}
