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
 * Photo Booth keeps the unfiltered shot under {@code Originals/} and the filtered one under
 * {@code Pictures/}; the filtered version goes when an original is in the group.
 */
public class PhotoBoothFilteredRule implements GroupRule {
    
    public static final String NAME = "PHOTOBOOTH_FILTERED";
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances) {
        List<RuleRejection> rejections = new ArrayList<>();
        for (GroupMember filtered : survivors) {
            if (!PathMarkers.isPhotoBoothFiltered(filtered)) {
                continue;
            }
            survivors.stream()
                .filter(PathMarkers::isPhotoBoothOriginal)
                .filter(original -> !PathMarkers.isPhotoBoothFiltered(original))
                .min(Comparator.comparingLong(GroupMember::resolution).reversed().thenComparing(GroupMember::photoId))
                .ifPresent(original -> rejections.add(new RuleRejection(filtered.photoId(), original.photoId(), NAME)));
        }
        return rejections;
    }
}
