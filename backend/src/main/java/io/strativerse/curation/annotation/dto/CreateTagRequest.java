package io.strativerse.curation.annotation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTagRequest(
    @NotBlank(message = "type is required") @Size(max = 55) String type,
    @NotBlank(message = "key is required") @Size(max = 55) String key,
    String value,
    @Size(max = 500) String comment) {}
