package com.starscape.phototriage.features.grouprules.app;

/**
 * A rule's proposal to reject {@code photoId} because of {@code keptPhotoId}. The kept id is null
 * only for rules without a specific counterpart.
 */
public record RuleRejection(String photoId, String keptPhotoId, String ruleName) {
    
    public RuleRejection {
        if (photoId == null || ruleName == null) {
            throw new IllegalArgumentException("Rejections need a photo and a rule name");
        }
        if (photoId.equals(keptPhotoId)) {
            throw new IllegalArgumentException("Photo " + photoId + " cannot be kept in favour of itself");
        }
    }
}
