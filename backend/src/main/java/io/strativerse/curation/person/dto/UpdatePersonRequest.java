package io.strativerse.curation.person.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdatePersonRequest(
    @Size(max = 255) String givenNames,
    @NotBlank @Size(max = 255) String lastName,
    @Size(max = 10) String suffix,
    @Size(max = 19) String orcid) {}
