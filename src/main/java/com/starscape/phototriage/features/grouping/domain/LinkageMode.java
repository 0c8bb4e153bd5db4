package com.starscape.phototriage.features.grouping.domain;

/**
 * How same-scene pairs are turned into duplicate groups.
 */
public enum LinkageMode {
    /** Connected components: any chain of same-scene pairs joins a group. */
    SINGLE,
    /** Groups whose members are all pairwise same-scene, then joined across bridge pairs. */
    COMPLETE
}
