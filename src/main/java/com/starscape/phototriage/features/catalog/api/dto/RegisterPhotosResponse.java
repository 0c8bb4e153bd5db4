package com.starscape.phototriage.features.catalog.api.dto;

public record RegisterPhotosResponse(
    int created,
    int existing,
    int pathsAdded
) {}
