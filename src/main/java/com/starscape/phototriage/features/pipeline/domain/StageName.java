package com.starscape.phototriage.features.pipeline.domain;

/**
 * Pipeline stages in execution order.
 */
public enum StageName {
    CLASSIFY,
    GROUP,
    GROUP_RULES
}
