package io.strativerse.curation.person.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AliasRequest(
    @NotBlank(message = "alias is required") @Size(max = 255) String alias) {}
