package com.starscape.phototriage.features.classify.app;

import com.starscape.phototriage.common.config.TriageProperties;
import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.catalog.domain.PhotoPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The ordered individual rules. Thresholds and path markers come from {@code app.triage.classify}.
 */
@Configuration
public class IndividualRuleCatalog {
    
    private static final Logger log = LoggerFactory.getLogger(IndividualRuleCatalog.class);
    
    public static final String TINY_ICON = "TINY_ICON";
    public static final String GAME_TEXTURE = "GAME_TEXTURE";
    public static final String ANIMATION_FRAME = "ANIMATION_FRAME";
    public static final String CHAT_ICON = "CHAT_ICON";
    public static final String WEB_ASSET = "WEB_ASSET";
    public static final String FACE_CROP = "FACE_CROP";
    public static final String STOCK_GREETING = "STOCK_GREETING";
    public static final String FLAG_ICON = "FLAG_ICON";
    public static final String SYSTEM_CACHE = "SYSTEM_CACHE";
    public static final String VIDEO_PREVIEW_THUMB = "VIDEO_PREVIEW_THUMB";
    public static final String SEPARATE_COLLECTION = "SEPARATE_COLLECTION";
    public static final String PHOTOBOOTH = "PHOTOBOOTH";
    
    private static final Pattern SAVED_PAGE_DIR = Pattern.compile("(.+)_files/", Pattern.CASE_INSENSITIVE);
    private static final Pattern STOCK_GREETING_STEM = Pattern.compile("^\\d{3}$");
    
    @Bean
    public IndividualClassifier individualClassifier(TriageProperties properties, SiblingFileProbe siblingFileProbe) {
        TriageProperties.Classify config = properties.getClassify();
        IndividualClassifier classifier = new IndividualClassifier(
            rejectionRules(config, siblingFileProbe),
            separationRules(config)
        );
        log.info("Individual classifier ready: {} rejection rules, {} separation rules",
            classifier.getRejectionRules().size(), classifier.getSeparationRules().size());
        return classifier;
    }
    
    public static List<IndividualRule> rejectionRules(TriageProperties.Classify config, SiblingFileProbe probe) {
        List<String> gameMarkers = List.copyOf(config.getGameAssetMarkers());
        List<String> animationMarkers = List.copyOf(config.getAnimationMarkers());
        List<String> chatMarkers = List.copyOf(config.getChatIconMarkers());
        List<String> flagMarkers = List.copyOf(config.getFlagIconMarkers());
        List<String> cacheMarkers = List.copyOf(config.getSystemCacheMarkers());
        List<String> videoPreviewMarkers = List.copyOf(config.getVideoPreviewMarkers());
        long tinyArea = config.getTinyAreaThreshold();
        int chatMaxSide = config.getChatIconMaxSide();
        String faceMarker = config.getFaceCropMarker();
        int faceMaxSide = config.getFaceCropMaxSide();
        double faceTolerance = config.getFaceCropAspectTolerance();
        
        return List.of(
            IndividualRule.reject(TINY_ICON, facts -> facts.hasDimensions() && facts.area() < tinyArea),
            IndividualRule.reject(GAME_TEXTURE, facts -> facts.anyPathContainsAny(gameMarkers)),
            IndividualRule.reject(ANIMATION_FRAME, facts -> facts.anyPathContainsAny(animationMarkers)),
            IndividualRule.reject(CHAT_ICON,
                facts -> facts.hasDimensions()
                    && facts.anyPathContainsAny(chatMarkers)
                    && facts.maxSide() < chatMaxSide),
            IndividualRule.reject(WEB_ASSET, facts -> isSavedWebPageAsset(facts, probe)),
            IndividualRule.reject(FACE_CROP, facts -> isFaceCrop(facts, faceMarker, faceMaxSide, faceTolerance)),
            IndividualRule.reject(STOCK_GREETING, IndividualRuleCatalog::isStockGreeting),
            IndividualRule.reject(FLAG_ICON, facts -> facts.anyPathContainsAny(flagMarkers)),
            IndividualRule.reject(SYSTEM_CACHE, facts -> facts.anyPathContainsAny(cacheMarkers)),
            IndividualRule.reject(VIDEO_PREVIEW_THUMB, facts -> facts.anyPathContainsAny(videoPreviewMarkers))
        );
    }
    
    public static List<IndividualRule> separationRules(TriageProperties.Classify config) {
        List<String> collectionMarkers = List.copyOf(config.getSeparateCollectionMarkers());
        List<String> photoBoothMarkers = List.copyOf(config.getPhotoBoothMarkers());
        
        return List.of(
            IndividualRule.separate(SEPARATE_COLLECTION, facts -> facts.anyPathContainsAny(collectionMarkers)),
            IndividualRule.separate(PHOTOBOOTH, facts -> facts.anyPathContainsAny(photoBoothMarkers))
        );
    }
    
    /**
     * A browser "save page" drops images into {@code <name>_files/} next to {@code <name>.htm(l)}.
     */
    static boolean isSavedWebPageAsset(PhotoFacts facts, SiblingFileProbe probe) {
        for (String path : facts.sourcePaths()) {
            Matcher matcher = SAVED_PAGE_DIR.matcher(path);
            if (matcher.find()) {
                String base = matcher.group(1);
                if (probe.exists(base + ".htm") || probe.exists(base + ".html")) {
                    return true;
                }
            }
        }
        return false;
    }
    
    static boolean isFaceCrop(PhotoFacts facts, String marker, int maxSide, double aspectTolerance) {
        if (!facts.hasDimensions() || !facts.anyPathContains(marker)) {
            return false;
        }
        if (facts.maxSide() > maxSide || facts.width() == 0 || facts.height() == 0) {
            return false;
        }
        double aspect = (double) facts.width() / facts.height();
        return Math.abs(aspect - 1.0) <= aspectTolerance;
    }
    
    static boolean isStockGreeting(PhotoFacts facts) {
        for (PhotoPath path : facts.paths()) {
            if (!path.getSourcePath().toLowerCase(Locale.ROOT).contains("/thumbnails/")) {
                continue;
            }
            String stem = PhotoPath.stemOf(path.getFilename());
            if (stem.endsWith("_1024")) {
                stem = stem.substring(0, stem.length() - "_1024".length());
            }
            if (STOCK_GREETING_STEM.matcher(stem).matches()) {
                return true;
            }
        }
        return false;
    }
}
