package com.starscape.phototriage.features.grouprules.app;

import com.starscape.phototriage.features.catalog.domain.PhotoPath;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Path and filename conventions of photo libraries and cameras.
 */
public final class PathMarkers {
    
    public static final String PREVIEWS = "/previews/";
    public static final String IPHOTO_LIBRARY = ".photolibrary/";
    public static final String PHOTOS_LIBRARY = ".photoslibrary/";
    public static final String PHOTO_BOOTH_PICTURES = "photo booth library/pictures/";
    public static final String PHOTO_BOOTH_ORIGINALS = "photo booth library/originals/";
    
    private static final List<Pattern> CAMERA_NAMES = List.of(
        Pattern.compile("^IMG_\\d+$"),
        Pattern.compile("^DSC_?\\d+$"),
        Pattern.compile("^DSCN?\\d+$"),
        Pattern.compile("^P\\d{7}$"),
        Pattern.compile("^\\d{8}_\\d+$")
    );
    
    private PathMarkers() {
    }
    
    public static boolean isThumbnail(GroupMember member, List<String> thumbnailMarkers) {
        for (PhotoPath path : member.facts().paths()) {
            if (path.getFilename().toLowerCase(Locale.ROOT).startsWith("thumb_")) {
                return true;
            }
        }
        return member.facts().anyPathContainsAny(thumbnailMarkers);
    }
    
    public static boolean isPreview(GroupMember member) {
        return member.facts().anyPathContains(PREVIEWS);
    }
    
    public static boolean inIPhotoLibrary(GroupMember member) {
        return member.facts().anyPathContains(IPHOTO_LIBRARY);
    }
    
    public static boolean inPhotosLibrary(GroupMember member) {
        return member.facts().anyPathContains(PHOTOS_LIBRARY);
    }
    
    public static boolean isPhotoBoothFiltered(GroupMember member) {
        return member.facts().anyPathContains(PHOTO_BOOTH_PICTURES);
    }
    
    public static boolean isPhotoBoothOriginal(GroupMember member) {
        return member.facts().anyPathContains(PHOTO_BOOTH_ORIGINALS);
    }
    
    /** {@code IMG_1234.JPG}, {@code DSC_0001.jpg}, {@code P1010001.JPG}, {@code 20190704_1234.jpg} and the like. */
    public static boolean isCameraGeneratedName(String filename) {
        String stem = PhotoPath.stemOf(filename).toUpperCase(Locale.ROOT);
        for (Pattern pattern : CAMERA_NAMES) {
            if (pattern.matcher(stem).matches()) {
                return true;
            }
        }
        return false;
    }
}
