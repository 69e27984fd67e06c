package io.strativerse.curation.person;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "people")
public class Person {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "given_names", nullable = false, length = 255)
  private String givenNames;

  @Column(name = "last_name", nullable = false, length = 255)
  private String lastName;

  @Column(name = "suffix", nullable = false, length = 10)
  private String suffix;

  @Column(name = "orcid", length = 19)
  private String orcid;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Person() {}

  public Person(String givenNames, String lastName, String suffix) {
    this.givenNames = givenNames != null ? givenNames : "";
    this.lastName = lastName;
    this.suffix = suffix != null ? suffix : "";
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(String givenNames, String lastName, String suffix, String orcid) {
    this.givenNames = givenNames != null ? givenNames : "";
    this.lastName = lastName;
    this.suffix = suffix != null ? suffix : "";
    this.orcid = orcid;
    this.updatedAt = Instant.now();
  }

  public String displayName() {
    if (givenNames == null || givenNames.isBlank()) {
      return lastName;
    }
    return givenNames + " " + lastName;
  }

  public UUID getId() {
    return id;
  }

  public String getGivenNames() {
    return givenNames;
  }

  public String getLastName() {
    return lastName;
  }

  public String getSuffix() {
    return suffix;
  }

  public String getOrcid() {
    return orcid;
  }

  public void setOrcid(String orcid) {
    this.orcid = orcid;
    this.updatedAt = Instant.now();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return displayName();
  }
}
