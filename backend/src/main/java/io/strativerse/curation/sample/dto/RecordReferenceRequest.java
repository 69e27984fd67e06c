package io.strativerse.curation.sample.dto;

import io.strativerse.curation.sample.ReferenceType;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record RecordReferenceRequest(@NotNull UUID publicationId, @NotNull ReferenceType type) {}
