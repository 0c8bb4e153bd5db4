package com.starscape.phototriage.features.provenance.app;

import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupOutcome;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;
import com.starscape.phototriage.features.provenance.domain.AggregatedPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.starscape.phototriage.support.TestPhotos.bits;
import static com.starscape.phototriage.support.TestPhotos.member;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class PathAggregatorTest {
    
    private final PathAggregator aggregator = new PathAggregator();
    
    private final GroupMember small = member("a", 800, 600, 100_000L, bits(0), "/backup/a.jpg", "/old/a.jpg");
    private final GroupMember large = member("b", 4000, 3000, 4_000_000L, bits(0), "/pictures/b.jpg");
    private final GroupMember medium = member("c", 2000, 1500, 1_000_000L, bits(0), "/pictures/c.jpg");
    
    @Test
    @DisplayName("paths go to the kept photo when it survived")
    void toKeptPhoto() {
        GroupOutcome outcome = new GroupOutcome("a",
            List.of(new RuleRejection("a", "c", "RULE")), List.of(large, medium), null);
        
        assertThat(aggregator.aggregate(outcome, List.of(small, large, medium)))
            .extracting(AggregatedPath::getKeptPhotoId, AggregatedPath::getSourcePath, AggregatedPath::getFromPhotoId)
            .containsExactly(
                tuple("c", "/backup/a.jpg", "a"),
                tuple("c", "/old/a.jpg", "a"));
    }
    
    @Test
    @DisplayName("without a surviving counterpart paths go to the best survivor")
    void toBestSurvivor() {
        GroupOutcome outcome = new GroupOutcome("a",
            List.of(new RuleRejection("a", null, "RULE"), new RuleRejection("c", "a", "RULE")),
            List.of(large), null);
        
        assertThat(aggregator.aggregate(outcome, List.of(small, large, medium)))
            .extracting(AggregatedPath::getKeptPhotoId)
            .containsOnly("b")
            .hasSize(3);
    }
    
    @Test
    @DisplayName("no rejections means nothing to aggregate")
    void nothingRejected() {
        GroupOutcome outcome = new GroupOutcome("a", List.of(), List.of(small, large), null);
        
        assertThat(aggregator.aggregate(outcome, List.of(small, large))).isEmpty();
    }
    
    @Test
    @DisplayName("rejections without survivors cannot be aggregated")
    void needsSurvivor() {
        GroupOutcome outcome = new GroupOutcome("a",
            List.of(new RuleRejection("a", "b", "RULE")), List.of(), null);
        
        assertThatThrownBy(() -> aggregator.aggregate(outcome, List.of(small, large)))
            .isInstanceOf(IllegalStateException.class);
    }
}
