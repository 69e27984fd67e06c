package io.strativerse.curation.publication;

import java.util.Arrays;
import java.util.Locale;

/** Publication kinds, named after CSL item types. */
public enum PublicationType {
  ARTICLE_JOURNAL("article-journal"),
  ARTICLE("article"),
  BOOK("book"),
  CHAPTER("chapter"),
  PAPER_CONFERENCE("paper-conference"),
  THESIS("thesis"),
  REPORT("report"),
  WEBPAGE("webpage"),
  DATASET("dataset"),
  MANUSCRIPT("manuscript"),
  MAP("map"),
  OTHER("other");

  private final String cslName;

  PublicationType(String cslName) {
    this.cslName = cslName;
  }

  public String cslName() {
    return cslName;
  }

  /** Maps a CSL {@code type} value; unknown or missing types become {@link #OTHER}. */
  public static PublicationType fromCsl(String cslType) {
    if (cslType == null) {
      return OTHER;
    }
    String normalized = cslType.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.cslName.equals(normalized))
        .findFirst()
        .orElse(OTHER);
  }

  /** Maps a BibTeX entry type such as {@code article} or {@code phdthesis}. */
  public static PublicationType fromBibtex(String entryType) {
    if (entryType == null) {
      return OTHER;
    }
    return switch (entryType.trim().toLowerCase(Locale.ROOT)) {
      case "article" -> ARTICLE_JOURNAL;
      case "book", "booklet" -> BOOK;
      case "inbook", "incollection" -> CHAPTER;
      case "inproceedings", "conference", "proceedings" -> PAPER_CONFERENCE;
      case "phdthesis", "mastersthesis", "thesis" -> THESIS;
      case "techreport", "report" -> REPORT;
      case "online", "electronic" -> WEBPAGE;
      case "dataset" -> DATASET;
      case "unpublished" -> MANUSCRIPT;
      default -> OTHER;
    };
  }
}
