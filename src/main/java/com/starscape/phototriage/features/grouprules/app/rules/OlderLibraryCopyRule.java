package com.starscape.phototriage.features.grouprules.app.rules;

import com.starscape.phototriage.features.grouprules.app.DistanceTable;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupRule;
import com.starscape.phototriage.features.grouprules.app.PathMarkers;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;

import java.util.ArrayList;
import java.util.List;

/**
 * Prefers the Photos library over the iPhoto library it was migrated from: an iPhoto copy is
 * rejected when a Photos-library member has the same resolution.
 */
public class OlderLibraryCopyRule implements GroupRule {
    
    public static final String NAME = "OLDER_LIBRARY_COPY";
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances) {
        List<GroupMember> photosLibrary = survivors.stream().filter(PathMarkers::inPhotosLibrary).toList();
        if (photosLibrary.isEmpty()) {
            return List.of();
        }
        
        List<RuleRejection> rejections = new ArrayList<>();
        for (GroupMember member : survivors) {
            if (!member.hasResolution() || !PathMarkers.inIPhotoLibrary(member)) {
                continue;
            }
            for (GroupMember newer : photosLibrary) {
                if (!newer.photoId().equals(member.photoId()) && newer.resolution() == member.resolution()) {
                    rejections.add(new RuleRejection(member.photoId(), newer.photoId(), NAME));
                    break;
                }
            }
        }
        return rejections;
    }
}
