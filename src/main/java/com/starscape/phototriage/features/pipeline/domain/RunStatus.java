package com.starscape.phototriage.features.pipeline.domain;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
