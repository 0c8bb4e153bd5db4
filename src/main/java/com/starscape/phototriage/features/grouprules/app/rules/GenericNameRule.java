package com.starscape.phototriage.features.grouprules.app.rules;

import com.starscape.phototriage.features.grouprules.app.DistanceTable;
import com.starscape.phototriage.features.grouprules.app.GroupMember;
import com.starscape.phototriage.features.grouprules.app.GroupRule;
import com.starscape.phototriage.features.grouprules.app.PathMarkers;
import com.starscape.phototriage.features.grouprules.app.RuleRejection;

import java.util.ArrayList;
import java.util.List;

/**
 * When the same pixels exist under a camera name ({@code IMG_1234.JPG}) and a name someone chose,
 * the camera-named copy goes. Same pixels means equal file size and primary distance 0.
 */
public class GenericNameRule implements GroupRule {
    
    public static final String NAME = "GENERIC_NAME";
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<RuleRejection> evaluate(List<GroupMember> survivors, DistanceTable distances) {
        List<GroupMember> cameraNamed = new ArrayList<>();
        List<GroupMember> humanNamed = new ArrayList<>();
        for (GroupMember member : survivors) {
            if (PathMarkers.isCameraGeneratedName(member.facts().firstFilename())) {
                cameraNamed.add(member);
            } else {
                humanNamed.add(member);
            }
        }
        
        List<RuleRejection> rejections = new ArrayList<>();
        for (GroupMember camera : cameraNamed) {
            // survivors are in id order, so the first match is deterministic
            for (GroupMember human : humanNamed) {
                if (human.bytes() == camera.bytes() && distances.primary(camera, human) == 0) {
                    rejections.add(new RuleRejection(camera.photoId(), human.photoId(), NAME));
                    break;
                }
            }
        }
        return rejections;
    }
}
