package com.starscape.phototriage.features.pipeline.api.dto;

import com.starscape.phototriage.features.grouping.domain.LinkageMode;

/**
 * Both fields are optional: linkage defaults to {@code app.triage.grouping.linkage},
 * reclassify to false.
 */
public record StartRunRequest(
    LinkageMode linkage,
    Boolean reclassify
) {}
