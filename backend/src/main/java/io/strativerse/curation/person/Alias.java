package io.strativerse.curation.person;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * An alternate rendered name for a {@link Person}. The alias text is unique across all people, so
 * an alias resolves to at most one person.
 */
@Entity
@Table(name = "aliases", uniqueConstraints = @UniqueConstraint(columnNames = "alias"))
public class Alias {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "person_id", nullable = false)
  private UUID personId;

  @Column(name = "alias", nullable = false, length = 255)
  private String alias;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Alias() {}

  public Alias(UUID personId, String alias) {
    this.personId = personId;
    this.alias = alias;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getPersonId() {
    return personId;
  }

  public String getAlias() {
    return alias;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
