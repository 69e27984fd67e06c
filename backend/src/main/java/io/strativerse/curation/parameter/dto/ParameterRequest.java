package io.strativerse.curation.parameter.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ParameterRequest(
    @NotBlank @Size(max = 255) String name,
    @Size(max = 50) @Pattern(regexp = "^[a-z][a-z0-9_]*$") String slug,
    String description,
    String preparation,
    String instrumentation) {}
