package com.starscape.phototriage.features.catalog.api.dto;

import com.starscape.phototriage.features.catalog.domain.DateSource;
import jakarta.validation.constraints.*;

import java.time.Instant;
import java.util.List;

public record PhotoRegistration(
    @NotBlank(message = "Photo ID is required")
    @Pattern(regexp = "^[0-9a-fA-F]{64}$", message = "Photo ID must be a SHA-256 hex checksum")
    String photoId,
    
    @NotBlank(message = "MIME type is required")
    String mimeType,
    
    @PositiveOrZero(message = "Bytes cannot be negative")
    long bytes,
    
    @PositiveOrZero(message = "Width cannot be negative")
    Integer width,
    
    @PositiveOrZero(message = "Height cannot be negative")
    Integer height,
    
    Instant capturedAt,
    
    DateSource dateSource,
    
    boolean hasExif,
    
    @NotEmpty(message = "At least one source path is required")
    List<@NotBlank String> sourcePaths
) {}
