package io.strativerse.curation.publication;

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

@Entity
@Table(name = "publications", uniqueConstraints = @UniqueConstraint(columnNames = "slug"))
public class Publication {

  public static final int MAX_SLUG_LENGTH = 55;
  public static final int MAX_TITLE_LENGTH = 255;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "slug", nullable = false, length = MAX_SLUG_LENGTH)
  private String slug;

  @Column(name = "title", nullable = false, length = MAX_TITLE_LENGTH)
  private String title;

  @Column(name = "year_published", nullable = false)
  private int year;

  @Column(name = "doi", nullable = false, length = 255)
  private String doi;

  @Column(name = "url", nullable = false, length = 500)
  private String url;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 30)
  private PublicationType type;

  @Column(name = "abstract_text", columnDefinition = "TEXT")
  private String abstractText;

  /** Raw BibTeX or CSL-JSON the publication was last imported from. */
  @Column(name = "source_text", columnDefinition = "TEXT")
  private String sourceText;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Publication() {}

  public Publication(String slug, String title, int year) {
    this.slug = slug;
    this.title = title;
    this.year = year;
    this.doi = "";
    this.url = "";
    this.type = PublicationType.OTHER;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateBibliographic(
      String title, int year, String doi, String url, PublicationType type, String abstractText) {
    this.title = truncate(title, MAX_TITLE_LENGTH);
    this.year = year;
    this.doi = doi != null ? doi : "";
    this.url = url != null ? url : "";
    this.type = type != null ? type : PublicationType.OTHER;
    this.abstractText = abstractText;
    this.updatedAt = Instant.now();
  }

  public void setSlug(String slug) {
    this.slug = slug;
    this.updatedAt = Instant.now();
  }

  public void setSourceText(String sourceText) {
    this.sourceText = sourceText;
  }

  /** First 25 characters of the title, with an ellipsis when cut. */
  public String shortTitle() {
    if (title.length() > 25) {
      return title.substring(0, 25).strip() + "...";
    }
    return title;
  }

  private static String truncate(String value, int max) {
    if (value == null) {
      return "";
    }
    return value.length() > max ? value.substring(0, max) : value;
  }

  public UUID getId() {
    return id;
  }

  public String getSlug() {
    return slug;
  }

  public String getTitle() {
    return title;
  }

  public int getYear() {
    return year;
  }

  public String getDoi() {
    return doi;
  }

  public String getUrl() {
    return url;
  }

  public PublicationType getType() {
    return type;
  }

  public String getAbstractText() {
    return abstractText;
  }

  public String getSourceText() {
    return sourceText;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
