package io.strativerse.curation.sample;

import io.strativerse.curation.geometry.GeoFields;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** A physical sample (core, outcrop, tree...) and the data derived from it. */
@Entity
@Table(name = "records")
public class SampleRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "date_collected")
  private LocalDate dateCollected;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "medium", nullable = false, length = 55)
  private RecordMedium medium;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 55)
  private RecordType type;

  @Enumerated(EnumType.STRING)
  @Column(name = "resolution", nullable = false, length = 55)
  private RecordResolution resolution;

  @Embedded private GeoFields geo;

  @Column(name = "feature_id")
  private UUID featureId;

  @Column(name = "min_year")
  private Double minYear;

  @Column(name = "max_year")
  private Double maxYear;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SampleRecord() {}

  public SampleRecord(String name, RecordMedium medium, RecordType type, GeoFields geo) {
    this.name = name;
    this.medium = medium != null ? medium : RecordMedium.OTHER;
    this.type = type != null ? type : RecordType.OTHER;
    this.resolution = RecordResolution.UNKNOWN;
    this.geo = geo != null ? geo : GeoFields.empty();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(
      String name,
      LocalDate dateCollected,
      String description,
      RecordMedium medium,
      RecordType type,
      RecordResolution resolution) {
    this.name = name;
    this.dateCollected = dateCollected;
    this.description = description;
    this.medium = medium != null ? medium : RecordMedium.OTHER;
    this.type = type != null ? type : RecordType.OTHER;
    this.resolution = resolution != null ? resolution : RecordResolution.UNKNOWN;
    this.updatedAt = Instant.now();
  }

  /** Callers validate that {@code minYear <= maxYear} before calling. */
  void updateYearRange(Double minYear, Double maxYear) {
    this.minYear = minYear;
    this.maxYear = maxYear;
    this.updatedAt = Instant.now();
  }

  void linkFeature(UUID featureId) {
    this.featureId = featureId;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public LocalDate getDateCollected() {
    return dateCollected;
  }

  public String getDescription() {
    return description;
  }

  public RecordMedium getMedium() {
    return medium;
  }

  public RecordType getType() {
    return type;
  }

  public RecordResolution getResolution() {
    return resolution;
  }

  public GeoFields getGeo() {
    return geo;
  }

  public UUID getFeatureId() {
    return featureId;
  }

  public Double getMinYear() {
    return minYear;
  }

  public Double getMaxYear() {
    return maxYear;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
