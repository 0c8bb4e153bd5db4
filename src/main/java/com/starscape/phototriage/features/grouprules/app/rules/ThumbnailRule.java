package com.starscape.phototriage.features.grouprules.app.rules;

import com.starscape.phototriage.features.grouprules.app.DistanceTable;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupRule;
import com.starscape.phototriage.features.grouprules.app.PathMarkers;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rejects thumbnails and previews that are visibly the same picture as a larger master copy.
 */
public class ThumbnailRule implements GroupRule {
    
    public static final String NAME = "THUMBNAIL";
    
    private static final Comparator<GroupMember> LARGEST_FIRST = Comparator
        .comparingLong(GroupMember::resolution)
        .thenComparingLong(GroupMember::bytes)
        .reversed()
        .thenComparing(GroupMember::photoId);
    
    private final List<String> thumbnailMarkers;
    private final int maxDistance;
    
    public ThumbnailRule(List<String> thumbnailMarkers, int maxDistance) {
        this.thumbnailMarkers = List.copyOf(thumbnailMarkers);
        this.maxDistance = maxDistance;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances) {
        List<GroupMember> thumbnails = new ArrayList<>();
        List<GroupMember> masters = new ArrayList<>();
        for (GroupMember member : survivors) {
            if (PathMarkers.isThumbnail(member, thumbnailMarkers)) {
                thumbnails.add(member);
            } else {
                masters.add(member);
            }
        }
        if (thumbnails.isEmpty() || masters.isEmpty()) {
            return List.of();
        }
        
        GroupMember master = masters.stream().min(LARGEST_FIRST).orElseThrow();
        List<RuleRejection> rejections = new ArrayList<>();
        for (GroupMember thumbnail : thumbnails) {
            if (thumbnail.hasResolution()
                    && master.resolution() > thumbnail.resolution()
                    && distances.primary(thumbnail, master) <= maxDistance) {
                rejections.add(new RuleRejection(thumbnail.photoId(), master.photoId(), NAME));
            }
        }
        return rejections;
    }
}
