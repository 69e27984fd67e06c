package io.strativerse.curation.feature;

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
import java.util.UUID;

/**
 * A named geographic feature. Features form a tree through {@code parentId}; {@code
 * recursiveDepth} is the distance to the root and is maintained by {@link FeatureService}.
 */
@Entity
@Table(name = "features")
public class Feature {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 55)
  private FeatureType type;

  @Embedded private GeoFields geo;

  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "recursive_depth", nullable = false)
  private int recursiveDepth;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Feature() {}

  public Feature(String name, FeatureType type, GeoFields geo) {
    this.name = name;
    this.type = type;
    this.geo = geo != null ? geo : GeoFields.empty();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(String name, FeatureType type) {
    this.name = name;
    this.type = type;
    this.updatedAt = Instant.now();
  }

  /** Package-private: parent and depth only change together, through {@link FeatureService}. */
  void placeUnder(UUID parentId, int recursiveDepth) {
    this.parentId = parentId;
    this.recursiveDepth = recursiveDepth;
    this.updatedAt = Instant.now();
  }

  void refreshDepth(int recursiveDepth) {
    this.recursiveDepth = recursiveDepth;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public FeatureType getType() {
    return type;
  }

  public GeoFields getGeo() {
    return geo;
  }

  public UUID getParentId() {
    return parentId;
  }

  public int getRecursiveDepth() {
    return recursiveDepth;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return name + " <" + type + " " + id + ">";
  }
}
