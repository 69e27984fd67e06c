package io.strativerse.curation.sample;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;

@Entity
@Table(
    name = "record_references",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"record_id", "publication_id", "type"}))
public class RecordReference {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "record_id", nullable = false)
  private UUID recordId;

  @Column(name = "publication_id", nullable = false)
  private UUID publicationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 55)
  private ReferenceType type;

  protected RecordReference() {}

  public RecordReference(UUID recordId, UUID publicationId, ReferenceType type) {
    this.recordId = recordId;
    this.publicationId = publicationId;
    this.type = type;
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecordId() {
    return recordId;
  }

  public UUID getPublicationId() {
    return publicationId;
  }

  public ReferenceType getType() {
    return type;
  }
}
