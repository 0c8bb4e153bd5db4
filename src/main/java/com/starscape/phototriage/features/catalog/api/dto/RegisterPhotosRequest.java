package com.starscape.phototriage.features.catalog.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RegisterPhotosRequest(
    @NotEmpty(message = "Photos list cannot be empty")
    @Size(max = 5000, message = "Maximum 5000 photos per batch")
    @Valid
    List<PhotoRegistration> photos
) {}
