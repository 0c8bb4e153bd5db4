package com.starscape.phototriage.features.catalog.domain;

/**
 * Where a photo's capture-date estimate came from, most to least trustworthy.
 */
public enum DateSource {
    EXIF,
    FILENAME,
    MTIME
}
