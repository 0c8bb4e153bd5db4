package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.common.config.TriageProperties;
import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.classify.app.Classification;
import com.starscape.phototriage.features.classify.app.IndividualClassifier;
import com.starscape.phototriage.features.classify.app.IndividualRuleCatalog;
import com.starscape.phototriage.features.grouping.app.CompleteLinkageStrategy;
import com.starscape.phototriage.features.grouping.app.DuplicateGroup;
import com.starscape.phototriage.features.grouping.app.GroupingResult;
import com.starscape.phototriage.features.grouping.app.HashedPhoto;
import com.starscape.phototriage.features.grouping.app.PairwiseComparator;
import com.starscape.phototriage.features.grouping.app.SameScenePredicate;
import com.starscape.phototriage.features.grouping.app.SimilarityGrouper;
import com.starscape.phototriage.features.grouping.app.SingleLinkageStrategy;
import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupOutcome;
import com.starscape.phototriage.features.grouprules.app.GroupRuleCatalog;
import com.starscape.phototriage.features.grouprules.app.GroupRuleEngine;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;
import com.starscape.phototriage.features.hashing.domain.PerceptualHash;
import com.starscape.phototriage.features.provenance.app.PathAggregator;
import com.starscape.phototriage.features.provenance.domain.AggregatedPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

import static com.starscape.phototriage.support.TestPhotos.bitRange;
import static com.starscape.phototriage.support.TestPhotos.bits;
import static com.starscape.phototriage.support.TestPhotos.facts;
import static com.starscape.phototriage.support.TestPhotos.hex;
import static com.starscape.phototriage.support.TestPhotos.photo;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Classification, grouping, group rules and path aggregation run twice over the same catalogue
 * must agree, whatever order the catalogue is read in.
 */
class TriagePassRepeatabilityTest {
    
    private final IndividualClassifier classifier;
    private final SimilarityGrouper grouper;
    private final GroupRuleEngine engine;
    private final PathAggregator aggregator = new PathAggregator();
    
    TriagePassRepeatabilityTest() {
        TriageProperties properties = new TriageProperties();
        TriageProperties.Classify classify = properties.getClassify();
        classifier = new IndividualClassifier(
            IndividualRuleCatalog.rejectionRules(classify, path -> false),
            IndividualRuleCatalog.separationRules(classify));
        TriageProperties.Grouping grouping = properties.getGrouping();
        grouper = new SimilarityGrouper(
            new PairwiseComparator(SameScenePredicate.from(grouping), 3),
            List.of(
                new SingleLinkageStrategy(),
                new CompleteLinkageStrategy(grouping.getBridgeMinPairs(), grouping.getBridgeMaxPrimaryDistance())));
        engine = new GroupRuleEngine(GroupRuleCatalog.rules(properties.getGroupRules()));
    }
    
    record PassResult(
        Map<String, Classification> decisions,
        List<DuplicateGroup> groups,
        List<RuleRejection> rejections,
        List<List<String>> aggregatedPaths
    ) {
    }
    
    private static PhotoFacts hashed(Photo photo, PerceptualHash primary, PerceptualHash secondary, String... paths) {
        photo.assignHashes(hex(primary), secondary != null ? hex(secondary) : null);
        return facts(photo, paths);
    }
    
    private static List<PhotoFacts> catalogue() {
        return List.of(
            hashed(photo("icon", 50, 80, 2_000L), bits(40), null, "/Users/me/Pictures/icon.png"),
            hashed(photo("master", 3000, 3000, 4_000_000L), bits(0), bits(0), "/Users/me/Pictures/beach.jpg"),
            hashed(photo("preview", 300, 300, 60_000L), bits(2), bits(1), "/Users/me/Library/Previews/beach.jpg"),
            hashed(photo("copy", 3000, 3000, 3_900_000L), bits(0), bits(0),
                "/Volumes/Backup/beach copy.jpg", "/Volumes/Old/beach copy.jpg"),
            // a chain: hike-1 and hike-4 are too far apart to be same-scene directly
            hashed(photo("hike-1", 4000, 3000, 5_000_000L), bitRange(32, 64), bitRange(32, 64),
                "/Users/me/Pictures/hike.jpg"),
            hashed(photo("hike-2", 2000, 1500, 1_200_000L), bitRange(34, 64), bitRange(32, 64),
                "/Users/me/Pictures/hike small.jpg"),
            hashed(photo("hike-3", 4000, 3000, 4_800_000L), bitRange(44, 64), bitRange(32, 63),
                "/Volumes/Backup/hike.jpg"),
            hashed(photo("hike-4", 4000, 3000, 4_700_000L), bitRange(50, 64), bitRange(32, 60),
                "/Volumes/Backup/hike edit.jpg"),
            hashed(photo("booth", 1280, 720, 300_000L), bitRange(50, 60), null,
                "/Users/me/Pictures/Photo Booth Library/Originals/Photo 1.jpg"),
            hashed(photo("undated", null, null, 800_000L), bitRange(0, 40), null, "/Users/me/Pictures/scan.jpg"),
            facts(photo("unhashed", 1024, 768, 400_000L), "/Users/me/Pictures/unhashed.jpg")
        );
    }
    
    private PassResult runPass(List<PhotoFacts> catalogue, LinkageMode linkage) {
        Map<String, Classification> decisions = new TreeMap<>();
        Map<String, PhotoFacts> byId = new HashMap<>();
        List<HashedPhoto> candidates = new ArrayList<>();
        for (PhotoFacts facts : catalogue) {
            byId.put(facts.photoId(), facts);
            Optional<Classification> decision = classifier.classify(facts);
            if (decision.isPresent()) {
                decisions.put(facts.photoId(), decision.get());
            } else if (facts.photo().primary() != null) {
                candidates.add(new HashedPhoto(facts.photoId(), facts.photo().primary(), facts.photo().secondary()));
            }
        }
        
        GroupingResult grouping = grouper.group(candidates, linkage);
        
        List<RuleRejection> rejections = new ArrayList<>();
        List<List<String>> paths = new ArrayList<>();
        for (DuplicateGroup group : grouping.groups()) {
            List<GroupMember> members = group.photoIds().stream()
                .map(id -> GroupMember.of(byId.get(id)))
                .toList();
            GroupOutcome outcome = engine.apply(group.groupId(), members);
            rejections.addAll(outcome.rejections());
            for (AggregatedPath path : aggregator.aggregate(outcome, members)) {
                paths.add(List.of(path.getKeptPhotoId(), path.getSourcePath(), path.getFromPhotoId()));
            }
        }
        return new PassResult(decisions, grouping.groups(), rejections, paths);
    }
    
    @ParameterizedTest
    @EnumSource(LinkageMode.class)
    @DisplayName("a second pass over unchanged input reaches the same decisions")
    void secondPassMatchesFirst(LinkageMode linkage) {
        List<PhotoFacts> catalogue = catalogue();
        
        PassResult first = runPass(catalogue, linkage);
        PassResult second = runPass(catalogue, linkage);
        
        assertThat(first.decisions()).isNotEmpty();
        assertThat(first.groups()).isNotEmpty();
        assertThat(first.rejections()).isNotEmpty();
        assertThat(first.aggregatedPaths()).isNotEmpty();
        assertThat(second).isEqualTo(first);
    }
    
    @ParameterizedTest
    @EnumSource(LinkageMode.class)
    @DisplayName("reading the catalogue in another order does not change the outcome")
    void passIgnoresCatalogueOrder(LinkageMode linkage) {
        List<PhotoFacts> catalogue = catalogue();
        PassResult expected = runPass(catalogue, linkage);
        
        Random random = new Random(7);
        for (int round = 0; round < 4; round++) {
            List<PhotoFacts> shuffled = new ArrayList<>(catalogue);
            Collections.shuffle(shuffled, random);
            
            assertThat(runPass(shuffled, linkage)).isEqualTo(expected);
        }
    }
}
