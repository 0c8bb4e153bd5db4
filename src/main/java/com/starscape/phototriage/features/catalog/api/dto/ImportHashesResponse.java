package com.starscape.phototriage.features.catalog.api.dto;

public record ImportHashesResponse(
    int imported,
    int alreadyHashed,
    int unknownPhotos
) {}
