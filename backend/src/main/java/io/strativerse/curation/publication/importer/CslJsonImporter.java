package io.strativerse.curation.publication.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.publication.Publication;
import io.strativerse.curation.publication.PublicationRepository;
import io.strativerse.curation.publication.PublicationService;
import io.strativerse.curation.publication.PublicationType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Imports CSL-JSON items. Items are matched to existing publications by DOI; everything else is
 * created.
 */
@Component
public class CslJsonImporter {

  private static final Logger log = LoggerFactory.getLogger(CslJsonImporter.class);

  public static final String META_TAG_TYPE = "meta";

  /** CSL name variables, in the order their authorships are written. */
  static final List<String> NAME_FIELDS =
      List.of(
          "author",
          "editor",
          "translator",
          "container-author",
          "collection-editor",
          "editorial-director",
          "composer",
          "director",
          "illustrator",
          "interviewer",
          "original-author",
          "recipient",
          "reviewed-author");

  private static final Set<String> MAPPED_FIELDS =
      Set.of("type", "title", "DOI", "URL", "abstract", "issued", "year");

  private static final Pattern YEAR_PATTERN = Pattern.compile("\\d{4}");
  private static final Pattern LETTERED_SLUG = Pattern.compile("^(.*\\d{2})[a-z]$");

  private final ObjectMapper objectMapper;
  private final PublicationRepository publicationRepository;
  private final PublicationService publicationService;
  private final AuthorResolver authorResolver;
  private final CitationSlugGenerator slugGenerator;
  private final AnnotationService annotationService;

  public CslJsonImporter(
      ObjectMapper objectMapper,
      PublicationRepository publicationRepository,
      PublicationService publicationService,
      AuthorResolver authorResolver,
      CitationSlugGenerator slugGenerator,
      AnnotationService annotationService) {
    this.objectMapper = objectMapper;
    this.publicationRepository = publicationRepository;
    this.publicationService = publicationService;
    this.authorResolver = authorResolver;
    this.slugGenerator = slugGenerator;
    this.annotationService = annotationService;
  }

  /**
   * Parses a CSL-JSON array (or a single item object) without touching the database.
   *
   * @throws ValidationException if the text is not JSON or an item is not an object
   */
  public List<ObjectNode> parse(String source) {
    if (source == null || source.isBlank()) {
      throw new ValidationException("Invalid CSL-JSON", "No CSL-JSON supplied");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(source);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Invalid CSL-JSON", e.getOriginalMessage(), e);
    }
    List<ObjectNode> items = new ArrayList<>();
    if (root.isObject()) {
      items.add((ObjectNode) root);
      return items;
    }
    if (!root.isArray()) {
      throw new ValidationException("Invalid CSL-JSON", "Expected an array of CSL items");
    }
    for (JsonNode node : root) {
      if (!node.isObject()) {
        throw new ValidationException(
            "Invalid CSL-JSON", "Expected a CSL item object but found " + node.getNodeType());
      }
      items.add((ObjectNode) node);
    }
    return items;
  }

  /**
   * Imports one item in the caller's transaction.
   *
   * @param updateAuthors replace the publication's authorships with the item's names
   * @param deduplicate fold a newly created publication into an older one with the same title whose
   *     slug differs only by the trailing disambiguation letter
   */
  public ImportedItem importItem(
      ObjectNode item, boolean updateAuthors, CslImportOptions options, boolean deduplicate) {
    String doi = text(item, "DOI");
    Optional<Publication> existing =
        doi.isEmpty() ? Optional.empty() : publicationRepository.findFirstByDoiIgnoreCase(doi);
    var publication = apply(item, existing.orElse(null), updateAuthors, options);
    if (existing.isPresent() || !deduplicate) {
      return new ImportedItem(publication, existing.isEmpty());
    }

    var duplicate = findNearDuplicate(publication);
    if (duplicate.isEmpty()) {
      return new ImportedItem(publication, true);
    }
    var target = duplicate.get();
    log.info(
        "Folding new publication into near duplicate: slug={}, existingSlug={}",
        publication.getSlug(),
        target.getSlug());
    publicationService.removeWithDependents(publication.getId());
    var refreshed = publicationRepository.findById(target.getId()).orElse(target);
    return new ImportedItem(apply(item, refreshed, updateAuthors, options), false);
  }

  private Publication apply(
      ObjectNode item, Publication target, boolean updateAuthors, CslImportOptions options) {
    boolean created = target == null;
    String title = text(item, "title").isEmpty() ? "Untitled" : text(item, "title");
    int year = yearOf(item);
    Map<String, List<CitationName>> names = namesByRole(item);

    String slug = created ? null : target.getSlug();
    if (options.regenerateSlugs()) {
      slug = slugGenerator.generate(surnames(names), year, title, created ? null : target.getId());
    } else if (created) {
      slug =
          unusedId(item)
              .orElseGet(() -> slugGenerator.generate(surnames(names), year, title, null));
    }

    var publication = created ? new Publication(slug, title, year) : target;
    if (!slug.equals(publication.getSlug())) {
      publication.setSlug(slug);
    }
    publication.updateBibliographic(
        title,
        year,
        text(item, "DOI"),
        text(item, "URL"),
        PublicationType.fromCsl(text(item, "type")),
        text(item, "abstract").isEmpty() ? null : text(item, "abstract"));
    publication.setSourceText(item.toString());
    publication = publicationRepository.save(publication);

    if (updateAuthors) {
      authorResolver.replaceAuthorships(publication.getId(), names);
    }
    if (options.tagResidual()) {
      annotationService.replaceTags(
          AnnotationOwner.publication(publication.getId()),
          META_TAG_TYPE,
          residualFields(item, publication.getSlug()));
    }
    log.debug("Applied CSL item: slug={}, id={}, created={}", slug, publication.getId(), created);
    return publication;
  }

  private Optional<Publication> findNearDuplicate(Publication publication) {
    Matcher matcher = LETTERED_SLUG.matcher(publication.getSlug());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return publicationRepository.findOtherByTitleAndSlug(
        publication.getTitle(), matcher.group(1), publication.getId());
  }

  private Optional<String> unusedId(ObjectNode item) {
    String id = text(item, "id");
    if (id.isEmpty()
        || id.length() > Publication.MAX_SLUG_LENGTH
        || publicationRepository.existsBySlug(id)) {
      return Optional.empty();
    }
    return Optional.of(id);
  }

  static Map<String, List<CitationName>> namesByRole(ObjectNode item) {
    Map<String, List<CitationName>> roles = new LinkedHashMap<>();
    for (String field : NAME_FIELDS) {
      JsonNode list = item.path(field);
      if (list.isArray() && !list.isEmpty()) {
        List<CitationName> names = new ArrayList<>();
        list.forEach(node -> names.add(CitationName.fromCsl(node)));
        roles.put(field, names);
      }
    }
    return roles;
  }

  /** Surnames of the authors, or of the first role present when there are no authors. */
  static List<String> surnames(Map<String, List<CitationName>> names) {
    var people = names.getOrDefault("author", List.of());
    if (people.isEmpty() && !names.isEmpty()) {
      people = names.values().iterator().next();
    }
    return people.stream().map(CitationName::surname).toList();
  }

  static int yearOf(ObjectNode item) {
    JsonNode issued = item.path("issued");
    JsonNode first = issued.path("date-parts").path(0).path(0);
    List<String> candidates = new ArrayList<>();
    if (!first.isMissingNode() && !first.isNull()) {
      candidates.add(first.asText());
    }
    candidates.add(issued.path("raw").asText(""));
    candidates.add(issued.path("literal").asText(""));
    candidates.add(item.path("year").asText(""));
    for (String candidate : candidates) {
      Matcher matcher = YEAR_PATTERN.matcher(candidate);
      if (matcher.find()) {
        return Integer.parseInt(matcher.group());
      }
    }
    String label = text(item, "id").isEmpty() ? text(item, "title") : text(item, "id");
    throw new ValidationException("Invalid CSL-JSON item", "No year in entry \"" + label + "\"");
  }

  /**
   * Fields the importer does not map, keyed by sanitized field name. Lists and objects are stored
   * as JSON behind a {@code list:} or {@code dict:} marker. The item {@code id} is residual unless
   * it became the publication's slug.
   */
  static Map<String, String> residualFields(ObjectNode item, String slug) {
    Map<String, String> residual = new LinkedHashMap<>();
    String id = text(item, "id");
    if (!id.isEmpty() && !id.equals(slug)) {
      residual.put("id", id);
    }
    Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
    while (fields.hasNext()) {
      var field = fields.next();
      String name = field.getKey();
      JsonNode value = field.getValue();
      if ("id".equals(name)
          || MAPPED_FIELDS.contains(name)
          || NAME_FIELDS.contains(name)
          || value.isNull()) {
        continue;
      }
      String key = metaKey(name);
      if (key.isEmpty()) {
        continue;
      }
      String text;
      if (value.isArray()) {
        text = "list:" + value;
      } else if (value.isObject()) {
        text = "dict:" + value;
      } else {
        text = value.asText();
      }
      residual.putIfAbsent(key, text);
    }
    return residual;
  }

  static String metaKey(String fieldName) {
    String key = fieldName.replaceAll("[^A-Za-z0-9_]", "_");
    return key.length() > AnnotationService.MAX_KEY_LENGTH
        ? key.substring(0, AnnotationService.MAX_KEY_LENGTH)
        : key;
  }

  private static String text(JsonNode item, String field) {
    JsonNode node = item.path(field);
    return node.isValueNode() ? node.asText("").strip() : "";
  }
}
