package com.starscape.phototriage.features.grouprules.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.starscape.phototriage.support.TestPhotos.bits;
import static com.starscape.phototriage.support.TestPhotos.member;
import static com.starscape.phototriage.support.TestPhotos.photoWithExif;
import static org.assertj.core.api.Assertions.assertThat;

class QualityHintTest {
    
    @Test
    @DisplayName("resolution outranks file size")
    void resolutionFirst() {
        GroupMember big = member("b", 4000, 3000, 1_000L, bits(0), "/p/b.jpg");
        GroupMember heavy = member("a", 2000, 1500, 9_000_000L, bits(0), "/p/a.jpg");
        
        assertThat(QualityHint.best(List.of(heavy, big))).isSameAs(big);
    }
    
    @Test
    @DisplayName("EXIF and then library path break size ties")
    void laterCriteria() {
        GroupMember plain = member("a", 100, 100, 10L, bits(0), "/p/a.jpg");
        GroupMember exif = member(photoWithExif("b", 100, 100, 10L), bits(0), null, "/p/b.jpg");
        GroupMember library = member("c", 100, 100, 10L, bits(0), "/Pictures/Photos Library.photoslibrary/originals/c.jpg");
        
        assertThat(QualityHint.best(List.of(plain, exif))).isSameAs(exif);
        assertThat(QualityHint.best(List.of(plain, library))).isSameAs(library);
        assertThat(QualityHint.pathQuality(member("d", 100, 100, 10L, bits(0), "/x/Thumbnails/d.jpg"))).isZero();
    }
    
    @Test
    @DisplayName("the smaller id wins a full tie")
    void idBreaksTies() {
        GroupMember a = member("a", 100, 100, 10L, bits(0), "/p/a.jpg");
        GroupMember b = member("b", 100, 100, 10L, bits(0), "/p/b.jpg");
        
        assertThat(QualityHint.best(List.of(b, a))).isSameAs(a);
    }
}
