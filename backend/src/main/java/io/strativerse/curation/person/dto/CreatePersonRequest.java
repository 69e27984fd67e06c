package io.strativerse.curation.person.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreatePersonRequest(
    @Size(max = 255) String givenNames,
    @NotBlank @Size(max = 255) String lastName,
    @Size(max = 10) String suffix,
    @Size(max = 19) String orcid,
    List<@NotBlank @Size(max = 255) String> aliases) {}
