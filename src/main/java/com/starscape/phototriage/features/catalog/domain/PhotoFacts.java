package com.starscape.phototriage.features.catalog.domain;

import java.util.List;
import java.util.Locale;

/**
 * A photo together with every path it was found at: the complete evidence rules may look at.
 * Paths keep ingestion order, so {@link #firstPath()} is stable across runs.
 */
public record PhotoFacts(Photo photo, List<PhotoPath> paths) {

    public PhotoFacts {
        if (photo == null) {
            throw new IllegalArgumentException("Photo cannot be null");
        }
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public String photoId() {
        return photo.getPhotoId();
    }

    public List<String> sourcePaths() {
        return paths.stream().map(PhotoPath::getSourcePath).toList();
    }

    public String firstPath() {
        return paths.isEmpty() ? "" : paths.get(0).getSourcePath();
    }

    public String firstFilename() {
        return paths.isEmpty() ? "" : paths.get(0).getFilename();
    }

    /**
     * Whether both pixel dimensions are known. Rules that need dimensions must not match
     * a photo without them.
     */
    public boolean hasDimensions() {
        return photo.getWidth() != null && photo.getHeight() != null;
    }
    
    /** Width in pixels, 0 when unknown. */
    public int width() {
        return photo.getWidth() == null ? 0 : photo.getWidth();
    }

    /** Height in pixels, 0 when unknown. */
    public int height() {
        return photo.getHeight() == null ? 0 : photo.getHeight();
    }

    public long area() {
        return (long) width() * height();
    }

    public int maxSide() {
        return Math.max(width(), height());
    }

    public boolean anyPathContains(String marker) {
        String needle = marker.toLowerCase(Locale.ROOT);
        for (PhotoPath path : paths) {
            if (path.getSourcePath().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    public boolean anyPathContainsAny(List<String> markers) {
        for (String marker : markers) {
            if (anyPathContains(marker)) {
                return true;
            }
        }
        return false;
    }
}
