package com.starscape.phototriage.features.grouprules.app.rules;

import com.starscape.phototriage.features.grouprules.app.DistanceTable;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.starscape.phototriage.support.TestPhotos.bits;
import static com.starscape.phototriage.support.TestPhotos.member;
import static org.assertj.core.api.Assertions.assertThat;

class LibraryRulesTest {
    
    @Nested
    class OlderLibraryCopy {
        
        private final OlderLibraryCopyRule rule = new OlderLibraryCopyRule();
        
        @Test
        @DisplayName("the iPhoto copy goes when the Photos library has the same resolution")
        void rejectsIPhotoCopy() {
            List<GroupMember> survivors = List.of(
                member("a", 3000, 2000, 1_000L, bits(0), "/Pictures/iPhoto Library.photolibrary/Masters/x.jpg"),
                member("b", 3000, 2000, 1_000L, bits(0), "/Pictures/Photos Library.photoslibrary/originals/x.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors)))
                .containsExactly(new RuleRejection("a", "b", OlderLibraryCopyRule.NAME));
        }
        
        @Test
        @DisplayName("a higher-resolution iPhoto copy is kept")
        void keepsDifferentResolution() {
            List<GroupMember> survivors = List.of(
                member("a", 4000, 3000, 1_000L, bits(0), "/Pictures/iPhoto Library.photolibrary/Masters/x.jpg"),
                member("b", 3000, 2000, 1_000L, bits(0), "/Pictures/Photos Library.photoslibrary/originals/x.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors))).isEmpty();
        }
    }
    
    @Nested
    class PhotoBoothFiltered {
        
        private final PhotoBoothFilteredRule rule = new PhotoBoothFilteredRule();
        
        @Test
        @DisplayName("the filtered shot goes when the original is present")
        void rejectsFiltered() {
            List<GroupMember> survivors = List.of(
                member("a", 1280, 720, 1_000L, bits(0), "/Pictures/Photo Booth Library/Pictures/Photo 1.jpg"),
                member("b", 1280, 720, 1_000L, bits(3), "/Pictures/Photo Booth Library/Originals/Photo 1.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors)))
                .containsExactly(new RuleRejection("a", "b", PhotoBoothFilteredRule.NAME));
        }
        
        @Test
        @DisplayName("filtered shots without an original stay")
        void needsOriginal() {
            List<GroupMember> survivors = List.of(
                member("a", 1280, 720, 1_000L, bits(0), "/Pictures/Photo Booth Library/Pictures/Photo 1.jpg"),
                member("b", 1280, 720, 1_000L, bits(3), "/Pictures/Photo Booth Library/Pictures/Photo 2.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors))).isEmpty();
        }
    }
    
    @Nested
    class GenericName {
        
        private final GenericNameRule rule = new GenericNameRule();
        
        @Test
        @DisplayName("a camera-named copy of a renamed photo goes")
        void rejectsCameraName() {
            List<GroupMember> survivors = List.of(
                member("a", 3000, 2000, 2_345_678L, bits(0), "/dcim/IMG_1234.JPG"),
                member("b", 3000, 2000, 2_345_678L, bits(0), "/albums/Grandma's birthday.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors)))
                .containsExactly(new RuleRejection("a", "b", GenericNameRule.NAME));
        }
        
        @Test
        @DisplayName("different bytes are not the same pixels")
        void needsIdenticalFile() {
            List<GroupMember> survivors = List.of(
                member("a", 3000, 2000, 2_345_678L, bits(0), "/dcim/DSC_0001.jpg"),
                member("b", 3000, 2000, 2_345_679L, bits(0), "/albums/Harbour.jpg"));
            
            assertThat(rule.evaluate(survivors, DistanceTable.of(survivors))).isEmpty();
        }
    }
}
