package io.strativerse.curation.publication.importer;

import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.publication.Publication;
import io.strativerse.curation.publication.PublicationRepository;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Builds author-date citation slugs such as {@code smith19}, {@code smith_and_jones19} or {@code
 * smith_etal19}, disambiguated with a trailing letter when taken.
 */
@Component
public class CitationSlugGenerator {

  static final List<String> SUFFIXES = disambiguationSuffixes();

  private final PublicationRepository publicationRepository;

  public CitationSlugGenerator(PublicationRepository publicationRepository) {
    this.publicationRepository = publicationRepository;
  }

  /**
   * Returns the first free slug for the given authors.
   *
   * @param excludeId the publication being re-slugged, whose own slug does not count as taken; null
   *     for a new publication
   * @throws ValidationException when the base slug and all 26 lettered variants are taken
   */
  public String generate(List<String> surnames, int year, String title, UUID excludeId) {
    String base = baseSlug(surnames, year, title);
    for (String suffix : SUFFIXES) {
      String candidate = base + suffix;
      boolean taken =
          excludeId == null
              ? publicationRepository.existsBySlug(candidate)
              : publicationRepository.existsBySlugAndIdNot(candidate, excludeId);
      if (!taken) {
        return candidate;
      }
    }
    throw new ValidationException(
        "Slug collision", "Could not find a unique slug for '" + base + "' (tried a to z)");
  }

  /** The undisambiguated slug: author text, then the two-digit year. */
  static String baseSlug(List<String> surnames, int year, String title) {
    String authors =
        switch (surnames.size()) {
          case 0 -> firstWord(title);
          case 1 -> surnames.get(0);
          case 2 -> surnames.get(0) + "_and_" + surnames.get(1);
          default -> surnames.get(0) + "_etal";
        };
    String yy = String.format(Locale.ROOT, "%02d", Math.floorMod(year, 100));
    String normalized = normalize(authors);
    if (normalized.isEmpty()) {
      normalized = "anon";
    }
    int room = Publication.MAX_SLUG_LENGTH - yy.length() - 1;
    if (normalized.length() > room) {
      normalized = normalized.substring(0, room);
    }
    return normalized + yy;
  }

  /** Lowercase ASCII with diacritics and whitespace removed. */
  static String normalize(String text) {
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
    return decomposed
        .replaceAll("[^\\x00-\\x7F]", "")
        .replaceAll("\\s+", "")
        .toLowerCase(Locale.ROOT);
  }

  private static String firstWord(String title) {
    if (title == null || title.isBlank()) {
      return "anon";
    }
    return title.strip().split("\\s+")[0].replaceAll("[^\\p{L}\\p{N}]", "");
  }

  private static List<String> disambiguationSuffixes() {
    List<String> suffixes = new ArrayList<>();
    suffixes.add("");
    for (char c = 'a'; c <= 'z'; c++) {
      suffixes.add(String.valueOf(c));
    }
    return List.copyOf(suffixes);
  }
}
