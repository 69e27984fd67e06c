package io.strativerse.curation.publication.importer;

import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.publication.Publication;
import io.strativerse.curation.publication.PublicationRepository;
import io.strativerse.curation.publication.PublicationType;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jbibtex.BibTeXDatabase;
import org.jbibtex.BibTeXEntry;
import org.jbibtex.BibTeXFormatter;
import org.jbibtex.BibTeXParser;
import org.jbibtex.Key;
import org.jbibtex.ObjectResolutionException;
import org.jbibtex.ParseException;
import org.jbibtex.TokenMgrException;
import org.jbibtex.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Imports BibTeX entries keyed by citation key. A key that already names a publication updates it
 * in place and leaves its authorships alone; a new key creates a publication with authorships for
 * every person field.
 */
@Component
public class BibtexImporter {

  private static final Logger log = LoggerFactory.getLogger(BibtexImporter.class);

  static final List<String> PERSON_FIELDS = List.of("author", "editor", "translator");

  private static final Key KEY_DATE = new Key("date");
  private static final Key KEY_DOI = new Key("doi");
  private static final Key KEY_URL = new Key("url");
  private static final Key KEY_ABSTRACT = new Key("abstract");
  private static final Pattern YEAR_PATTERN = Pattern.compile("\\d{4}");

  private final PublicationRepository publicationRepository;
  private final AuthorResolver authorResolver;

  public BibtexImporter(
      PublicationRepository publicationRepository, AuthorResolver authorResolver) {
    this.publicationRepository = publicationRepository;
    this.authorResolver = authorResolver;
  }

  /**
   * Imports every entry of {@code text} in file order. Runs in the caller's transaction.
   *
   * @throws ValidationException if the text does not parse, or an entry has no year or a key that
   *     is too long to be a slug
   */
  public List<ImportedItem> importText(String text) {
    BibTeXDatabase database = parse(text);
    List<ImportedItem> items = new ArrayList<>();
    for (BibTeXEntry entry : database.getEntries().values()) {
      items.add(importEntry(entry));
    }
    return items;
  }

  static BibTeXDatabase parse(String text) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Invalid BibTeX", "No BibTeX text supplied");
    }
    try {
      return new BibTeXParser().parse(new StringReader(text));
    } catch (ParseException | TokenMgrException | ObjectResolutionException e) {
      throw new ValidationException("Invalid BibTeX", e.getMessage(), e);
    }
  }

  private ImportedItem importEntry(BibTeXEntry entry) {
    String key = entry.getKey().getValue();
    if (key.length() > Publication.MAX_SLUG_LENGTH) {
      throw new ValidationException(
          "Invalid BibTeX entry",
          "Citation key '"
              + key
              + "' is longer than "
              + Publication.MAX_SLUG_LENGTH
              + " characters");
    }
    int year = yearOf(entry, key);
    String title = field(entry, BibTeXEntry.KEY_TITLE);
    title = title.isEmpty() ? "Untitled" : LatexText.toPlain(title);
    PublicationType type = PublicationType.fromBibtex(entry.getType().getValue());

    var existing = publicationRepository.findBySlug(key);
    boolean created = existing.isEmpty();
    var publication = existing.orElseGet(() -> new Publication(key, "", year));
    publication.updateBibliographic(
        title,
        year,
        field(entry, KEY_DOI),
        field(entry, KEY_URL),
        type,
        emptyToNull(LatexText.toPlain(field(entry, KEY_ABSTRACT))));
    publication.setSourceText(format(entry));
    publication = publicationRepository.save(publication);

    if (created) {
      authorResolver.replaceAuthorships(publication.getId(), namesByRole(entry));
    }
    log.info(
        "Imported BibTeX entry: key={}, id={}, created={}", key, publication.getId(), created);
    return new ImportedItem(publication, created);
  }

  static Map<String, List<CitationName>> namesByRole(BibTeXEntry entry) {
    Map<String, List<CitationName>> roles = new LinkedHashMap<>();
    for (String role : PERSON_FIELDS) {
      String names = field(entry, new Key(role));
      if (!names.isEmpty()) {
        roles.put(role, CitationName.parseBibtexList(names, LatexText::toPlain));
      }
    }
    return roles;
  }

  private static int yearOf(BibTeXEntry entry, String key) {
    for (Key field : List.of(BibTeXEntry.KEY_YEAR, KEY_DATE)) {
      var matcher = YEAR_PATTERN.matcher(field(entry, field));
      if (matcher.find()) {
        return Integer.parseInt(matcher.group());
      }
    }
    throw new ValidationException("Invalid BibTeX entry", "No year in entry \"" + key + "\"");
  }

  private static String field(BibTeXEntry entry, Key key) {
    Value value = entry.getField(key);
    return value == null ? "" : value.toUserString().strip();
  }

  /** The entry alone, re-serialized as BibTeX. */
  private static String format(BibTeXEntry entry) {
    var single = new BibTeXDatabase();
    single.addObject(entry);
    var writer = new StringWriter();
    try {
      new BibTeXFormatter().format(single, writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return writer.toString().strip();
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
