package com.starscape.phototriage.features.grouprules.app.rules;

import com.starscape.phototriage.features.grouprules.app.DistanceTable;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.starscape.phototriage.support.TestPhotos.bitRange;
import static com.starscape.phototriage.support.TestPhotos.bits;
import static com.starscape.phototriage.support.TestPhotos.member;
import static com.starscape.phototriage.support.TestPhotos.photo;
import static com.starscape.phototriage.support.TestPhotos.photoWithExif;
import static org.assertj.core.api.Assertions.assertThat;

class ResolutionRulesTest {
    
    @Nested
    class ResolutionDerivative {
        
        private final ResolutionDerivativeRule rule = new ResolutionDerivativeRule(2, 0.9);
        
        @Test
        @DisplayName("scaled-down copies within distance 2 of the largest member go")
        void rejectsScaledCopies() {
            List<GroupMember> survivors = List.of(
                member("a", 4000, 3000, 5_000_000L, bits(0), "/p/a.jpg"),
                member("b", 2000, 1500, 1_000_000L, bits(2), "/p/b.jpg"),
                member("c", 2000, 1500, 1_000_000L, bits(3), "/p/c.jpg"),
                member("d", 3900, 3000, 4_000_000L, bits(1), "/p/d.jpg"));
            
            // c is too far from a; d is within 90% of a's resolution
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors)))
                .containsExactly(new RuleRejection("b", "a", ResolutionDerivativeRule.NAME));
        }
        
        @Test
        @DisplayName("a member of unknown resolution is not taken for a scaled copy")
        void keepsUndimensionedMember() {
            List<GroupMember> survivors = List.of(
                member("a", 4000, 3000, 5_000_000L, bits(0), "/p/a.jpg"),
                member(photo("b", null, null, 1_000_000L), bits(1), null, "/p/b.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors))).isEmpty();
        }
    }
    
    @Nested
    class SameResolutionDuplicate {
        
        private final SameResolutionDuplicateRule rule = new SameResolutionDuplicateRule(0);
        
        @Test
        @DisplayName("the larger file wins")
        void largerFileWins() {
            List<GroupMember> survivors = List.of(
                member("a", 3000, 2000, 1_000L, bits(0), "/p/a.jpg"),
                member("b", 3000, 2000, 2_000L, bits(0), "/p/b.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors)))
                .containsExactly(new RuleRejection("a", "b", SameResolutionDuplicateRule.NAME));
        }
        
        @Test
        @DisplayName("EXIF wins between equal sizes, then the smaller id")
        void exifThenId() {
            List<GroupMember> survivors = List.of(
                member("a", 3000, 2000, 1_000L, bits(0), "/p/a.jpg"),
                member(photoWithExif("b", 3000, 2000, 1_000L), bits(0), null, "/p/b.jpg"),
                member("c", 3000, 2000, 1_000L, bits(0), "/p/c.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors)))
                .containsExactly(
                    new RuleRejection("a", "b", SameResolutionDuplicateRule.NAME),
                    new RuleRejection("c", "b", SameResolutionDuplicateRule.NAME));
        }
        
        @Test
        @DisplayName("two members of unknown resolution are not resolution duplicates")
        void unknownResolutionsDoNotMatch() {
            List<GroupMember> survivors = List.of(
                member(photo("a", null, null, 1_000L), bits(0), null, "/p/a.jpg"),
                member(photo("b", null, null, 2_000L), bits(0), null, "/p/b.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors))).isEmpty();
        }
        
        @Test
        @DisplayName("differing secondary hashes mean different shots")
        void secondaryMustMatch() {
            List<GroupMember> survivors = List.of(
                member(photo("a", 3000, 2000, 1_000L), bits(0), bits(0), "/p/a.jpg"),
                member(photo("b", 3000, 2000, 2_000L), bits(0), bitRange(8, 10), "/p/b.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors))).isEmpty();
        }
    }
}
