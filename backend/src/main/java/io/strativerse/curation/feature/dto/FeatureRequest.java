package io.strativerse.curation.feature.dto;

import io.strativerse.curation.feature.FeatureType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record FeatureRequest(
    @NotBlank @Size(max = 255) String name,
    @NotNull FeatureType type,
    String wkt,
    double error,
    double elevation,
    double elevationError,
    UUID parentId) {}
