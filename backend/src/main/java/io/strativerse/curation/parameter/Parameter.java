package io.strativerse.curation.parameter;

import io.strativerse.curation.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Entity
@Table(name = "parameters", uniqueConstraints = @UniqueConstraint(columnNames = "slug"))
public class Parameter {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "slug", nullable = false, length = 55)
  private String slug;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "preparation", columnDefinition = "TEXT")
  private String preparation;

  @Column(name = "instrumentation", columnDefinition = "TEXT")
  private String instrumentation;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Parameter() {}

  public Parameter(String name, String slug) {
    this.name = name;
    this.slug = slug;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Generates a slug from a human-readable name. Converts to lowercase, replaces spaces and hyphens
   * with underscores, strips non-alphanumeric characters (except underscores), and validates
   * against the pattern ^[a-z][a-z0-9_]*$.
   */
  public static String generateSlug(String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Invalid name", "Name must not be blank");
    }
    String slug =
        name.toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_").replaceAll("[^a-z0-9_]", "");

    if (slug.isEmpty() || !Character.isLetter(slug.charAt(0))) {
      throw new ValidationException(
          "Invalid slug", "Generated slug must start with a letter: " + slug);
    }
    return slug.length() > 50 ? slug.substring(0, 50) : slug;
  }

  public void updateMetadata(
      String name, String description, String preparation, String instrumentation) {
    this.name = name;
    this.description = description;
    this.preparation = preparation;
    this.instrumentation = instrumentation;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSlug() {
    return slug;
  }

  public String getDescription() {
    return description;
  }

  public String getPreparation() {
    return preparation;
  }

  public String getInstrumentation() {
    return instrumentation;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
