package io.strativerse.curation.person.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

public record CombinePeopleRequest(
    @NotNull(message = "personIds is required") List<UUID> personIds,
    @Size(max = 1000) String comment) {}
