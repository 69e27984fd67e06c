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
 * File annotation on any entity. {@code fileRef} is the storage key issued by the external file
 * store; the bytes never pass through this table.
 */
@Entity
@Table(
    name = "annotation_attachments",
    uniqueConstraints =
        @UniqueConstraint(
            columnNames = {"entity_type", "entity_id", "attachment_type", "attachment_key"}))
public class Attachment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_type", nullable = false, length = 20)
  private EntityKind entityType;

  @Column(name = "entity_id", nullable = false)
  private UUID entityId;

  @Column(name = "attachment_type", nullable = false, length = 55)
  private String annotationType;

  @Column(name = "attachment_key", nullable = false, length = 55)
  private String annotationKey;

  @Column(name = "file_ref", nullable = false, length = 500)
  private String fileRef;

  @Column(name = "file_name", length = 255)
  private String fileName;

  @Column(name = "comment", length = 500)
  private String comment;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Attachment() {}

  public Attachment(
      AnnotationOwner owner,
      String type,
      String key,
      String fileRef,
      String fileName,
      String comment) {
    this.entityType = owner.kind();
    this.entityId = owner.id();
    this.annotationType = type;
    this.annotationKey = key;
    this.fileRef = fileRef;
    this.fileName = fileName;
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

  public String getFileRef() {
    return fileRef;
  }

  public String getFileName() {
    return fileName;
  }

  public String getComment() {
    return comment;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
