package io.strativerse.curation.annotation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Key/value annotation on any entity. The owner is an (entity kind, id) pair with no foreign key;
 * (owner, type, key) is unique.
 */
@Entity
@Table(
    name = "annotation_tags",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"entity_type", "entity_id", "tag_type", "tag_key"}))
public class Tag {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_type", nullable = false, length = 20)
  private EntityKind entityType;

  @Column(name = "entity_id", nullable = false)
  private UUID entityId;

  @Column(name = "tag_type", nullable = false, length = 55)
  private String annotationType;

  @Column(name = "tag_key", nullable = false, length = 55)
  private String annotationKey;

  @Column(name = "tag_value", columnDefinition = "TEXT")
  private String value;

  @Column(name = "comment", length = 500)
  private String comment;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Tag() {}

  public Tag(AnnotationOwner owner, String type, String key, String value, String comment) {
    this.entityType = owner.kind();
    this.entityId = owner.id();
    this.annotationType = type;
    this.annotationKey = key;
    this.value = value;
    this.comment = comment;
    this.createdAt = Instant.now();
  }

  void moveTo(AnnotationOwner owner) {
    this.entityType = owner.kind();
    this.entityId = owner.id();
  }

  public AnnotationOwner getOwner() {
    return new AnnotationOwner(entityType, entityId);
  }

  public UUID getId() {
    return id;
  }

  public String getType() {
    return annotationType;
  }

  public String getKey() {
    return annotationKey;
  }

  public String getValue() {
    return value;
  }

  public String getComment() {
    return comment;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public String toString() {
    return annotationKey + "=`" + value + "`";
  }
}
