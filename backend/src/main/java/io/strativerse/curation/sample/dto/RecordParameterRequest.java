package io.strativerse.curation.sample.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record RecordParameterRequest(
    @NotNull UUID parameterId,
    @Size(max = 55) String units,
    Integer nValues,
    Double minValue,
    Double maxValue,
    Double meanValue) {}
