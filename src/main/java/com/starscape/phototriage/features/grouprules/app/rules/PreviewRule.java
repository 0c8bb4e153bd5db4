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
 * Rejects a library preview when an original with the same filename and a bigger file exists.
 */
public class PreviewRule implements GroupRule {
    
    public static final String NAME = "PREVIEW";
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances) {
        List<GroupMember> previews = new ArrayList<>();
        List<GroupMember> originals = new ArrayList<>();
        for (GroupMember member : survivors) {
            if (PathMarkers.isPreview(member)) {
                previews.add(member);
            } else {
                originals.add(member);
            }
        }
        
        List<RuleRejection> rejections = new ArrayList<>();
        for (GroupMember preview : previews) {
            String filename = preview.facts().firstFilename();
            originals.stream()
                .filter(original -> original.facts().firstFilename().equalsIgnoreCase(filename))
                .filter(original -> original.bytes() > preview.bytes())
                .min(Comparator.comparingLong(GroupMember::bytes).reversed().thenComparing(GroupMember::photoId))
                .ifPresent(original -> rejections.add(new RuleRejection(preview.photoId(), original.photoId(), NAME)));
        }
        return rejections;
    }
}
