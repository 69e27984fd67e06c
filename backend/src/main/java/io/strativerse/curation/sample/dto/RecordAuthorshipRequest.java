package io.strativerse.curation.sample.dto;

import io.strativerse.curation.sample.RecordRole;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record RecordAuthorshipRequest(@NotNull UUID personId, @NotNull RecordRole role) {}
