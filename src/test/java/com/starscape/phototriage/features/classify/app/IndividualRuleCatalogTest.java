package com.starscape.phototriage.features.classify.app;

import com.starscape.phototriage.common.config.TriageProperties;
import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.support.TestPhotos;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IndividualRuleCatalogTest {
    
    private final TriageProperties.Classify config = new TriageProperties.Classify();
    
    private Optional<String> ruleFor(PhotoFacts facts, SiblingFileProbe probe) {
        IndividualClassifier classifier = new IndividualClassifier(
            IndividualRuleCatalog.rejectionRules(config, probe),
            IndividualRuleCatalog.separationRules(config));
        return classifier.classify(facts).map(Classification::ruleName);
    }
    
    private Optional<String> ruleFor(PhotoFacts facts) {
        return ruleFor(facts, path -> false);
    }
    
    @Test
    @DisplayName("rules are listed in their evaluation order")
    void ruleOrder() {
        assertThat(IndividualRuleCatalog.rejectionRules(config, path -> false))
            .extracting(IndividualRule::name)
            .containsExactly("TINY_ICON", "GAME_TEXTURE", "ANIMATION_FRAME", "CHAT_ICON", "WEB_ASSET",
                "FACE_CROP", "STOCK_GREETING", "FLAG_ICON", "SYSTEM_CACHE", "VIDEO_PREVIEW_THUMB");
        assertThat(IndividualRuleCatalog.separationRules(config))
            .extracting(IndividualRule::name)
            .containsExactly("SEPARATE_COLLECTION", "PHOTOBOOTH");
    }
    
    @Test
    @DisplayName("game textures and animation frames are rejected by path")
    void pathMarkers() {
        assertThat(ruleFor(TestPhotos.facts("a", 512, 512, "/home/kid/.minecraft/textures/grass.png")))
            .contains("GAME_TEXTURE");
        assertThat(ruleFor(TestPhotos.facts("a", 640, 480, "/Users/kid/HUE Animation/frame001.jpg")))
            .contains("ANIMATION_FRAME");
        assertThat(ruleFor(TestPhotos.facts("a", 640, 480, "/Volumes/Old/FlipShare Data/Previews/clip.jpg")))
            .contains("VIDEO_PREVIEW_THUMB");
        assertThat(ruleFor(TestPhotos.facts("a", 640, 480, "/Volumes/Old/20121223-175144/se.png")))
            .contains("FLAG_ICON");
    }
    
    @Test
    @DisplayName("chat icons must be small")
    void chatIcons() {
        assertThat(ruleFor(TestPhotos.facts("a", 128, 128, "/Users/me/Library/Messages/buddy.png")))
            .contains("CHAT_ICON");
        assertThat(ruleFor(TestPhotos.facts("a", 1024, 768, "/Users/me/Library/Messages/Attachments/photo.jpg")))
            .isEmpty();
    }
    
    @Test
    @DisplayName("saved web page assets need a sibling html file")
    void webAssets() {
        PhotoFacts facts = TestPhotos.facts("a", 300, 200, "/Users/me/Desktop/Recipe_files/banner.jpg");
        Set<String> existing = Set.of("/Users/me/Desktop/Recipe.html");
        
        assertThat(ruleFor(facts, existing::contains)).contains("WEB_ASSET");
        assertThat(ruleFor(facts, path -> false)).isEmpty();
    }
    
    @Test
    @DisplayName("face crops are small and close to square")
    void faceCrops() {
        String path = "/Pictures/Photos Library.photoslibrary/resources/modelresources/face1.jpg";
        
        assertThat(ruleFor(TestPhotos.facts("a", 300, 310, path))).contains("FACE_CROP");
        assertThat(ruleFor(TestPhotos.facts("a", 300, 400, path))).isEmpty();
        assertThat(ruleFor(TestPhotos.facts("a", 800, 800, path))).isEmpty();
    }
    
    @Test
    @DisplayName("stock greeting templates are three-digit thumbnails")
    void stockGreetings() {
        assertThat(ruleFor(TestPhotos.facts("a", 1024, 768, "/Library/iPhoto/Thumbnails/123_1024.jpg")))
            .contains("STOCK_GREETING");
        assertThat(ruleFor(TestPhotos.facts("a", 1024, 768, "/Library/iPhoto/Thumbnails/1234.jpg")))
            .isEmpty();
    }
    
    @Test
    @DisplayName("collections to keep apart come from configuration")
    void configuredSeparation() {
        config.setSeparateCollectionMarkers(List.of("/tor/Pictures/2013/03/03/"));
        
        assertThat(ruleFor(TestPhotos.facts("a", 2000, 1500, "/Users/tor/Pictures/2013/03/03/scan01.jpg")))
            .contains("SEPARATE_COLLECTION");
    }
}
