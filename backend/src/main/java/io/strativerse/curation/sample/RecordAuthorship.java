package io.strativerse.curation.sample;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "record_authorships")
public class RecordAuthorship {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "record_id", nullable = false)
  private UUID recordId;

  @Column(name = "person_id", nullable = false)
  private UUID personId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 55)
  private RecordRole role;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  protected RecordAuthorship() {}

  public RecordAuthorship(UUID recordId, UUID personId, RecordRole role, int order) {
    this.recordId = recordId;
    this.personId = personId;
    this.role = role;
    this.sortOrder = order;
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecordId() {
    return recordId;
  }

  public UUID getPersonId() {
    return personId;
  }

  public RecordRole getRole() {
    return role;
  }

  public int getOrder() {
    return sortOrder;
  }
}
