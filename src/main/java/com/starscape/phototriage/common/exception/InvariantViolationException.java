package com.starscape.phototriage.common.exception;

/**
 * Raised when a write would break a pipeline invariant: rejecting the last survivor of a
 * duplicate group, recording two different decisions for one photo, or re-assigning a hash.
 * The message always names the offending photo and, where relevant, group.
 */
public class InvariantViolationException extends IllegalStateException {

    private final String photoId;
    private final String groupId;

    public InvariantViolationException(String message, String photoId, String groupId) {
        super(message);
        this.photoId = photoId;
        this.groupId = groupId;
    }

    public static InvariantViolationException forPhoto(String message, String photoId) {
        return new InvariantViolationException(message + " [photo=" + photoId + "]", photoId, null);
    }

    public static InvariantViolationException forGroup(String message, String groupId, String photoId) {
        return new InvariantViolationException(
            message + " [group=" + groupId + ", photo=" + photoId + "]", photoId, groupId);
    }

    public String getPhotoId() {
        return photoId;
    }

    public String getGroupId() {
        return groupId;
    }
}
