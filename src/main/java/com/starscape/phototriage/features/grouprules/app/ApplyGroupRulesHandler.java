package com.starscape.phototriage.features.grouprules.app;

import com.starscape.phototriage.common.exception.InvariantViolationException;
import com.starscape.phototriage.features.catalog.app.PhotoCatalog;
import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.grouping.domain.DuplicateGroupMember;
import com.starscape.phototriage.features.grouping.domain.DuplicateGroupRepository;
import com.starscape.phototriage.features.grouprules.domain.GroupRejection;
import com.starscape.phototriage.features.grouprules.domain.GroupRejectionRepository;
import com.starscape.phototriage.features.provenance.app.PathAggregator;
import com.starscape.phototriage.features.provenance.domain.AggregatedPath;
import com.starscape.phototriage.features.provenance.domain.AggregatedPathRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Group-rule stage: recomputes group rejections and aggregated paths for every duplicate group.
 * Old results are replaced in the same transaction.
 */
@Service
public class ApplyGroupRulesHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ApplyGroupRulesHandler.class);
    
    private final DuplicateGroupRepository groupRepository;
    private final GroupRejectionRepository rejectionRepository;
    private final AggregatedPathRepository aggregatedPathRepository;
    private final PhotoCatalog photoCatalog;
    private final GroupRuleEngine engine;
    private final PathAggregator pathAggregator;
    
    public ApplyGroupRulesHandler(
            DuplicateGroupRepository groupRepository,
            GroupRejectionRepository rejectionRepository,
            AggregatedPathRepository aggregatedPathRepository,
            PhotoCatalog photoCatalog,
            GroupRuleEngine engine,
            PathAggregator pathAggregator) {
        this.groupRepository = groupRepository;
        this.rejectionRepository = rejectionRepository;
        this.aggregatedPathRepository = aggregatedPathRepository;
        this.photoCatalog = photoCatalog;
        this.engine = engine;
        this.pathAggregator = pathAggregator;
    }
    
    @Transactional
    public GroupRulesSummary handle(String runId) {
        Map<String, List<String>> groups = new TreeMap<>();
        for (DuplicateGroupMember member : groupRepository.findAllByOrderByGroupIdAscPhotoIdAsc()) {
            groups.computeIfAbsent(member.getGroupId(), id -> new ArrayList<>()).add(member.getPhotoId());
        }
        
        Map<String, GroupMember> members = new HashMap<>();
        for (PhotoFacts facts : photoCatalog.loadFactsById(groups.values().stream().flatMap(List::stream).toList())) {
            members.put(facts.photoId(), GroupMember.of(facts));
        }
        
        List<GroupRejection> rejections = new ArrayList<>();
        List<AggregatedPath> aggregated = new ArrayList<>();
        List<GuardTrip> guardTrips = new ArrayList<>();
        Map<String, Integer> byRule = new TreeMap<>();
        
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            String groupId = group.getKey();
            List<GroupMember> groupMembers = new ArrayList<>(group.getValue().size());
            for (String photoId : group.getValue()) {
                GroupMember member = members.get(photoId);
                if (member == null) {
                    throw InvariantViolationException.forGroup("Grouped photo is missing from the catalog", groupId, photoId);
                }
                groupMembers.add(member);
            }
            
            GroupOutcome outcome = engine.apply(groupId, groupMembers);
            verifySurvivor(groupId, groupMembers, outcome);
            outcome.guard().ifPresent(guardTrips::add);
            
            for (RuleRejection rejection : outcome.rejections()) {
                rejections.add(new GroupRejection(
                    rejection.photoId(), groupId, rejection.ruleName(), rejection.keptPhotoId(), runId));
                byRule.merge(rejection.ruleName(), 1, Integer::sum);
            }
            aggregated.addAll(pathAggregator.aggregate(outcome, groupMembers));
        }
        
        rejectionRepository.deleteAllInBatch();
        aggregatedPathRepository.deleteAllInBatch();
        rejectionRepository.saveAll(rejections);
        aggregatedPathRepository.saveAll(aggregated);
        
        if (!guardTrips.isEmpty()) {
            log.warn("Last-survivor guard tripped in {} groups", guardTrips.size());
        }
        log.info("Group rules complete: groups={}, rejections={}, aggregatedPaths={}, byRule={}",
            groups.size(), rejections.size(), aggregated.size(), byRule);
        return new GroupRulesSummary(groups.size(), rejections.size(), aggregated.size(), byRule, guardTrips);
    }
    
    private static void verifySurvivor(String groupId, List<GroupMember> groupMembers, GroupOutcome outcome) {
        Set<String> rejected = new HashSet<>();
        for (RuleRejection rejection : outcome.rejections()) {
            if (!rejected.add(rejection.photoId())) {
                throw InvariantViolationException.forGroup("Photo rejected twice", groupId, rejection.photoId());
            }
        }
        if (rejected.size() >= groupMembers.size()) {
            throw InvariantViolationException.forGroup(
                "Every member of the group would be rejected", groupId, groupMembers.get(0).photoId());
        }
    }
}
