package com.starscape.phototriage.common.config;

import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the triage pipeline.
 * Binds to app.triage.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.triage")
public class TriageProperties {

    private Classify classify = new Classify();
    private Grouping grouping = new Grouping();
    private GroupRules groupRules = new GroupRules();

    public Classify getClassify() {
        return classify;
    }

    public void setClassify(Classify classify) {
        this.classify = classify;
    }

    public Grouping getGrouping() {
        return grouping;
    }

    public void setGrouping(Grouping grouping) {
        this.grouping = grouping;
    }

    public GroupRules getGroupRules() {
        return groupRules;
    }

    public void setGroupRules(GroupRules groupRules) {
        this.groupRules = groupRules;
    }

    /**
     * Thresholds and path markers for the individual rules. Markers are matched
     * case-insensitively as substrings of a source path.
     */
    public static class Classify {

        private long tinyAreaThreshold = 5000;
        private List<String> gameAssetMarkers = new ArrayList<>(List.of("minecraft"));
        private List<String> animationMarkers = new ArrayList<>(List.of("HUE Animation"));
        private List<String> chatIconMarkers = new ArrayList<>(List.of("/iChat Icons/", "/Messages/", "/Skype/"));
        private int chatIconMaxSide = 200;
        private String faceCropMarker = "/modelresources/";
        private int faceCropMaxSide = 500;
        private double faceCropAspectTolerance = 0.1;
        private List<String> flagIconMarkers = new ArrayList<>(List.of("20121223-175144"));
        private List<String> systemCacheMarkers = new ArrayList<>(List.of(
            "/.cache/", "/cache/", "/.thumbnails/", "/temp/", "/.Trash/", "/Trash/", "/My Flip Video Prefs/"));
        private List<String> videoPreviewMarkers = new ArrayList<>(List.of("/FlipShare Data/Previews/"));
        private List<String> separateCollectionMarkers = new ArrayList<>();
        private List<String> photoBoothMarkers = new ArrayList<>(List.of(
            "Photo Booth Library/Originals/", "Photo Booth Library/Pictures/"));

        public long getTinyAreaThreshold() { return tinyAreaThreshold; }
        public void setTinyAreaThreshold(long tinyAreaThreshold) { this.tinyAreaThreshold = tinyAreaThreshold; }
        public List<String> getGameAssetMarkers() { return gameAssetMarkers; }
        public void setGameAssetMarkers(List<String> gameAssetMarkers) { this.gameAssetMarkers = gameAssetMarkers; }
        public List<String> getAnimationMarkers() { return animationMarkers; }
        public void setAnimationMarkers(List<String> animationMarkers) { this.animationMarkers = animationMarkers; }
        public List<String> getChatIconMarkers() { return chatIconMarkers; }
        public void setChatIconMarkers(List<String> chatIconMarkers) { this.chatIconMarkers = chatIconMarkers; }
        public int getChatIconMaxSide() { return chatIconMaxSide; }
        public void setChatIconMaxSide(int chatIconMaxSide) { this.chatIconMaxSide = chatIconMaxSide; }
        public String getFaceCropMarker() { return faceCropMarker; }
        public void setFaceCropMarker(String faceCropMarker) { this.faceCropMarker = faceCropMarker; }
        public int getFaceCropMaxSide() { return faceCropMaxSide; }
        public void setFaceCropMaxSide(int faceCropMaxSide) { this.faceCropMaxSide = faceCropMaxSide; }
        public double getFaceCropAspectTolerance() { return faceCropAspectTolerance; }
        public void setFaceCropAspectTolerance(double faceCropAspectTolerance) { this.faceCropAspectTolerance = faceCropAspectTolerance; }
        public List<String> getFlagIconMarkers() { return flagIconMarkers; }
        public void setFlagIconMarkers(List<String> flagIconMarkers) { this.flagIconMarkers = flagIconMarkers; }
        public List<String> getSystemCacheMarkers() { return systemCacheMarkers; }
        public void setSystemCacheMarkers(List<String> systemCacheMarkers) { this.systemCacheMarkers = systemCacheMarkers; }
        public List<String> getVideoPreviewMarkers() { return videoPreviewMarkers; }
        public void setVideoPreviewMarkers(List<String> videoPreviewMarkers) { this.videoPreviewMarkers = videoPreviewMarkers; }
        public List<String> getSeparateCollectionMarkers() { return separateCollectionMarkers; }
        public void setSeparateCollectionMarkers(List<String> separateCollectionMarkers) { this.separateCollectionMarkers = separateCollectionMarkers; }
        public List<String> getPhotoBoothMarkers() { return photoBoothMarkers; }
        public void setPhotoBoothMarkers(List<String> photoBoothMarkers) { this.photoBoothMarkers = photoBoothMarkers; }
    }

    /**
     * Same-scene thresholds, clustering mode and comparison batching.
     */
    public static class Grouping {

        private LinkageMode linkage = LinkageMode.SINGLE;
        private int safePrimaryDistance = 10;
        private int nearPrimaryDistance = 12;
        private int nearSecondaryExclusive = 22;
        private int farPrimaryDistance = 14;
        private int farSecondaryInclusive = 17;
        private int bridgeMinPairs = 1;
        private int bridgeMaxPrimaryDistance = 10;
        private int comparisonBlockSize = 256;

        public LinkageMode getLinkage() { return linkage; }
        public void setLinkage(LinkageMode linkage) { this.linkage = linkage; }
        public int getSafePrimaryDistance() { return safePrimaryDistance; }
        public void setSafePrimaryDistance(int safePrimaryDistance) { this.safePrimaryDistance = safePrimaryDistance; }
        public int getNearPrimaryDistance() { return nearPrimaryDistance; }
        public void setNearPrimaryDistance(int nearPrimaryDistance) { this.nearPrimaryDistance = nearPrimaryDistance; }
        public int getNearSecondaryExclusive() { return nearSecondaryExclusive; }
        public void setNearSecondaryExclusive(int nearSecondaryExclusive) { this.nearSecondaryExclusive = nearSecondaryExclusive; }
        public int getFarPrimaryDistance() { return farPrimaryDistance; }
        public void setFarPrimaryDistance(int farPrimaryDistance) { this.farPrimaryDistance = farPrimaryDistance; }
        public int getFarSecondaryInclusive() { return farSecondaryInclusive; }
        public void setFarSecondaryInclusive(int farSecondaryInclusive) { this.farSecondaryInclusive = farSecondaryInclusive; }
        public int getBridgeMinPairs() { return bridgeMinPairs; }
        public void setBridgeMinPairs(int bridgeMinPairs) { this.bridgeMinPairs = bridgeMinPairs; }
        public int getBridgeMaxPrimaryDistance() { return bridgeMaxPrimaryDistance; }
        public void setBridgeMaxPrimaryDistance(int bridgeMaxPrimaryDistance) { this.bridgeMaxPrimaryDistance = bridgeMaxPrimaryDistance; }
        public int getComparisonBlockSize() { return comparisonBlockSize; }
        public void setComparisonBlockSize(int comparisonBlockSize) { this.comparisonBlockSize = comparisonBlockSize; }
    }

    /**
     * Evidence thresholds for the group rules.
     */
    public static class GroupRules {

        private List<String> thumbnailMarkers = new ArrayList<>(List.of("/thumbnails/", "/previews/"));
        private int thumbnailMaxDistance = 4;
        private int derivativeMaxDistance = 2;
        private double derivativeResolutionRatio = 0.9;
        private int tieBreakMaxDistance = 0;

        public List<String> getThumbnailMarkers() { return thumbnailMarkers; }
        public void setThumbnailMarkers(List<String> thumbnailMarkers) { this.thumbnailMarkers = thumbnailMarkers; }
        public int getThumbnailMaxDistance() { return thumbnailMaxDistance; }
        public void setThumbnailMaxDistance(int thumbnailMaxDistance) { this.thumbnailMaxDistance = thumbnailMaxDistance; }
        public int getDerivativeMaxDistance() { return derivativeMaxDistance; }
        public void setDerivativeMaxDistance(int derivativeMaxDistance) { this.derivativeMaxDistance = derivativeMaxDistance; }
        public double getDerivativeResolutionRatio() { return derivativeResolutionRatio; }
        public void setDerivativeResolutionRatio(double derivativeResolutionRatio) { this.derivativeResolutionRatio = derivativeResolutionRatio; }
        public int getTieBreakMaxDistance() { return tieBreakMaxDistance; }
        public void setTieBreakMaxDistance(int tieBreakMaxDistance) { this.tieBreakMaxDistance = tieBreakMaxDistance; }
    }
}
