package io.strativerse.curation.publication;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/**
 * Attaches a person to a publication in a role. {@code order} is the 0-based position within the
 * role and drives citation text.
 */
@Entity
@Table(name = "authorships")
public class Authorship {

  public static final String AUTHOR_ROLE = "author";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "publication_id", nullable = false)
  private UUID publicationId;

  @Column(name = "person_id", nullable = false)
  private UUID personId;

  @Column(name = "role", nullable = false, length = 55)
  private String role;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  protected Authorship() {}

  public Authorship(UUID publicationId, UUID personId, String role, int order) {
    this.publicationId = publicationId;
    this.personId = personId;
    this.role = role;
    this.sortOrder = order;
  }

  public UUID getId() {
    return id;
  }

  public UUID getPublicationId() {
    return publicationId;
  }

  public UUID getPersonId() {
    return personId;
  }

  public String getRole() {
    return role;
  }

  public int getOrder() {
    return sortOrder;
  }
}
