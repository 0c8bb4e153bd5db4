package com.starscape.phototriage.features.grouprules.app;

import com.starscape.phototriage.features.catalog.domain.PhotoPath;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * A rough "best copy" ordering: resolution, then file size, then EXIF, then path quality.
 * <p>
 * This is a hint for display and for choosing where aggregated paths go. It never decides a
 * rejection; rules must cite concrete evidence instead.
 */
public final class QualityHint {
    
    /** Best first; photo id breaks remaining ties. */
    public static final Comparator<GroupMember> BEST_FIRST = Comparator
        .comparingLong(GroupMember::resolution)
        .thenComparingLong(GroupMember::bytes)
        .thenComparing(GroupMember::hasExif)
        .thenComparingInt(QualityHint::pathQuality)
        .reversed()
        .thenComparing(GroupMember::photoId);
    
    private QualityHint() {
    }
    
    public static GroupMember best(Collection<GroupMember> members) {
        return members.stream()
            .min(BEST_FIRST)
            .orElseThrow(() -> new IllegalArgumentException("No members to choose from"));
    }
    
    /**
     * 3 for a Photos library path, 2 for iPhoto, 1 for any other non-thumbnail, non-preview path.
     */
    static int pathQuality(GroupMember member) {
        int quality = 0;
        List<PhotoPath> paths = member.facts().paths();
        for (PhotoPath path : paths) {
            String lower = path.getSourcePath().toLowerCase(Locale.ROOT);
            if (lower.contains("/thumbnails/") || lower.contains(PathMarkers.PREVIEWS)
                    || path.getFilename().toLowerCase(Locale.ROOT).startsWith("thumb_")) {
                continue;
            }
            if (lower.contains(PathMarkers.PHOTOS_LIBRARY)) {
                quality = 3;
            } else if (lower.contains(PathMarkers.IPHOTO_LIBRARY)) {
                quality = Math.max(quality, 2);
            } else {
                quality = Math.max(quality, 1);
            }
        }
        return quality;
    }
}
