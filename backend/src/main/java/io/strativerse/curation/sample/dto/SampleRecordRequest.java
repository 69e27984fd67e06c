package io.strativerse.curation.sample.dto;

import io.strativerse.curation.sample.RecordMedium;
import io.strativerse.curation.sample.RecordResolution;
import io.strativerse.curation.sample.RecordType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.UUID;

public record SampleRecordRequest(
    @NotBlank @Size(max = 255) String name,
    LocalDate dateCollected,
    String description,
    RecordMedium medium,
    RecordType type,
    RecordResolution resolution,
    String wkt,
    double error,
    double elevation,
    double elevationError,
    UUID featureId,
    Double minYear,
    Double maxYear) {}
