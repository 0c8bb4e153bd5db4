package com.starscape.phototriage.features.classify.domain;

public enum Decision {
    /** Junk: discard the photo. */
    REJECT,
    /** Keep, but outside the main deduplication flow. */
    SEPARATE
}
