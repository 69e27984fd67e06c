package io.strativerse.curation.sample.dto;

import io.strativerse.curation.geometry.GeometryType;
import io.strativerse.curation.geometry.WktBounds;
import io.strativerse.curation.sample.RecordAuthorship;
import io.strativerse.curation.sample.RecordReference;
import io.strativerse.curation.sample.SampleRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record SampleRecordResponse(
    UUID id,
    String name,
    LocalDate dateCollected,
    String description,
    String medium,
    String type,
    String resolution,
    UUID featureId,
    Double minYear,
    Double maxYear,
    String wkt,
    GeometryType geometryType,
    WktBounds bounds,
    List<Author> authors,
    List<Reference> references) {

  public record Author(UUID personId, String role, int order) {}

  public record Reference(UUID id, UUID publicationId, String type) {}

  public static SampleRecordResponse from(
      SampleRecord record, List<RecordAuthorship> authors, List<RecordReference> references) {
    return new SampleRecordResponse(
        record.getId(),
        record.getName(),
        record.getDateCollected(),
        record.getDescription(),
        record.getMedium().name(),
        record.getType().name(),
        record.getResolution().name(),
        record.getFeatureId(),
        record.getMinYear(),
        record.getMaxYear(),
        record.getGeo().getWkt(),
        record.getGeo().getGeometryType(),
        record.getGeo().getBounds(),
        authors.stream()
            .map(a -> new Author(a.getPersonId(), a.getRole().name(), a.getOrder()))
            .toList(),
        references.stream()
            .map(r -> new Reference(r.getId(), r.getPublicationId(), r.getType().name()))
            .toList());
  }
}
