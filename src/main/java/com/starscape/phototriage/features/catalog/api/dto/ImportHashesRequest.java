package com.starscape.phototriage.features.catalog.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ImportHashesRequest(
    @NotEmpty(message = "Hashes list cannot be empty")
    @Valid
    List<HashImportItem> hashes
) {}
