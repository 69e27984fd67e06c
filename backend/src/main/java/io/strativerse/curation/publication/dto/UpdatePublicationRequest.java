package io.strativerse.curation.publication.dto;

import io.strativerse.curation.publication.PublicationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdatePublicationRequest(
    @Size(max = 55) @Pattern(regexp = "^[A-Za-z0-9_:-]*$") String slug,
    @NotBlank @Size(max = 255) String title,
    int year,
    @Size(max = 255) String doi,
    @Size(max = 500) String url,
    PublicationType type,
    String abstractText) {}
