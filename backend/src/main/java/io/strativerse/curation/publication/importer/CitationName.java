package io.strativerse.curation.publication.importer;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A personal name as it appears in a citation. {@link #alias()} is the canonical text used to
 * match the name against registered person aliases.
 *
 * @param given given names, possibly blank
 * @param particle name particle such as {@code van} or {@code de}, possibly blank
 * @param family family name
 * @param suffix generational suffix such as {@code Jr.}, possibly blank
 * @param literal a name that must not be split (institutions), overriding the other parts
 */
public record CitationName(
    String given, String particle, String family, String suffix, String literal) {

  public CitationName {
    given = clean(given);
    particle = clean(particle);
    family = clean(family);
    suffix = clean(suffix);
    literal = clean(literal);
  }

  public static CitationName of(String given, String family) {
    return new CitationName(given, "", family, "", "");
  }

  /** {@code "<particle family>, <suffix>, <given>"} with empty parts left out. */
  public String alias() {
    if (!literal.isEmpty()) {
      return literal;
    }
    return Stream.of(lastName(), suffix, given)
        .filter(part -> !part.isEmpty())
        .collect(Collectors.joining(", "));
  }

  /** Family name with its particle, as stored on a person. */
  public String lastName() {
    if (!literal.isEmpty()) {
      return literal;
    }
    return (particle + " " + family).strip();
  }

  /** Name used in citation keys. */
  public String surname() {
    return !literal.isEmpty() ? literal : family;
  }

  /**
   * Reads a CSL-JSON name object. {@code non-dropping-particle} is part of the family name; a
   * {@code literal} replaces the whole name.
   */
  public static CitationName fromCsl(JsonNode node) {
    return new CitationName(
        node.path("given").asText(""),
        node.path("non-dropping-particle").asText(""),
        node.path("family").asText(""),
        node.path("suffix").asText(""),
        node.path("literal").asText(""));
  }

  /** Splits a BibTeX name list on {@code and} outside braces and parses each name. */
  public static List<CitationName> parseBibtexList(String names) {
    return parseBibtexList(names, UnaryOperator.identity());
  }

  /**
   * Same as {@link #parseBibtexList(String)}, passing every name part through {@code decode} (e.g.
   * LaTeX to text) after the name structure has been read.
   */
  public static List<CitationName> parseBibtexList(String names, UnaryOperator<String> decode) {
    List<CitationName> result = new ArrayList<>();
    if (names == null || names.isBlank()) {
      return result;
    }
    for (String name : splitTopLevel(names.strip().replaceAll("\\s+", " "), " and ")) {
      if (!name.isBlank()) {
        result.add(parseBibtex(name.strip(), decode));
      }
    }
    return result;
  }

  /**
   * Parses one BibTeX name in any of the forms {@code First von Last}, {@code von Last, First} or
   * {@code von Last, Jr, First}. A fully braced name such as {@code {World Bank}} is a literal.
   */
  public static CitationName parseBibtex(String name) {
    return parseBibtex(name, UnaryOperator.identity());
  }

  static CitationName parseBibtex(String name, UnaryOperator<String> decode) {
    String trimmed = name.strip();
    if (isFullyBraced(trimmed)) {
      return build(decode, "", "", "", "", trimmed.substring(1, trimmed.length() - 1));
    }
    List<String> parts = splitTopLevel(trimmed, ",");
    if (parts.size() == 1) {
      List<String> words = words(parts.get(0));
      if (words.size() == 1) {
        return build(decode, "", "", words.get(0), "", "");
      }
      int vonStart = -1;
      int vonEnd = -1;
      for (int i = 0; i < words.size() - 1; i++) {
        if (startsLowercase(words.get(i))) {
          if (vonStart < 0) {
            vonStart = i;
          }
          vonEnd = i;
        }
      }
      if (vonStart < 0) {
        return build(
            decode,
            String.join(" ", words.subList(0, words.size() - 1)),
            "",
            words.get(words.size() - 1),
            "",
            "");
      }
      return build(
          decode,
          String.join(" ", words.subList(0, vonStart)),
          String.join(" ", words.subList(vonStart, vonEnd + 1)),
          String.join(" ", words.subList(vonEnd + 1, words.size())),
          "",
          "");
    }
    String first = parts.get(parts.size() - 1);
    String suffix = parts.size() > 2 ? parts.get(1) : "";
    List<String> words = words(parts.get(0));
    int vonEnd = -1;
    for (int i = 0; i < words.size() - 1; i++) {
      if (startsLowercase(words.get(i))) {
        vonEnd = i;
      }
    }
    return build(
        decode,
        first,
        String.join(" ", words.subList(0, vonEnd + 1)),
        String.join(" ", words.subList(vonEnd + 1, words.size())),
        suffix,
        "");
  }

  private static CitationName build(
      UnaryOperator<String> decode,
      String given,
      String particle,
      String family,
      String suffix,
      String literal) {
    return new CitationName(
        decode.apply(given),
        decode.apply(particle),
        decode.apply(family),
        decode.apply(suffix),
        decode.apply(literal));
  }

  private static List<String> splitTopLevel(String text, String separator) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth = Math.max(0, depth - 1);
      } else if (depth == 0 && text.regionMatches(true, i, separator, 0, separator.length())) {
        parts.add(text.substring(start, i).strip());
        start = i + separator.length();
        i = start - 1;
      }
    }
    parts.add(text.substring(start).strip());
    return parts;
  }

  private static List<String> words(String text) {
    List<String> words = new ArrayList<>();
    for (String word : splitTopLevel(text.strip().replaceAll("\\s+", " "), " ")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }

  /** A word starting with a lowercase letter outside braces is a particle. */
  private static boolean startsLowercase(String word) {
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      if (c == '{') {
        return false;
      }
      if (Character.isLetter(c)) {
        return Character.isLowerCase(c);
      }
    }
    return false;
  }

  private static boolean isFullyBraced(String text) {
    if (text.length() < 2 || text.charAt(0) != '{' || text.charAt(text.length() - 1) != '}') {
      return false;
    }
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0 && i < text.length() - 1) {
          return false;
        }
      }
    }
    return true;
  }

  private static String clean(String value) {
    if (value == null) {
      return "";
    }
    return value.replace("{", "").replace("}", "").replaceAll("\\s+", " ").strip();
  }
}
