package com.starscape.phototriage.features.catalog.api.dto;

import jakarta.validation.constraints.NotBlank;

public record HashImportItem(
    @NotBlank(message = "Photo ID is required")
    String photoId,
    
    @NotBlank(message = "Primary hash is required")
    String primaryHash,
    
    String secondaryHash
) {}
