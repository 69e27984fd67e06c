package io.strativerse.curation.publication.importer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.ErrorResponseException;

/**
 * Entry point for bibliographic imports. A BibTeX import is a single transaction; a CSL-JSON import
 * is parsed up front and then written in chunks, one transaction and one audit event per chunk.
 */
@Service
@EnableConfigurationProperties(ImportProperties.class)
public class PublicationImportService {

  private static final Logger log = LoggerFactory.getLogger(PublicationImportService.class);

  private final BibtexImporter bibtexImporter;
  private final CslJsonImporter cslJsonImporter;
  private final AuditService auditService;
  private final ImportProperties properties;
  private final TransactionTemplate txTemplate;

  public PublicationImportService(
      BibtexImporter bibtexImporter,
      CslJsonImporter cslJsonImporter,
      AuditService auditService,
      ImportProperties properties,
      PlatformTransactionManager txManager) {
    this.bibtexImporter = bibtexImporter;
    this.cslJsonImporter = cslJsonImporter;
    this.auditService = auditService;
    this.properties = properties;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  @Transactional
  public List<ImportedItem> importBibtex(String text, String actor) {
    var items = bibtexImporter.importText(text);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("publication.imported")
            .entityType("publication")
            .actor(actor)
            .details(importDetails("bibtex", items))
            .build());
    log.info("Imported BibTeX: entries={}", items.size());
    return items;
  }

  /**
   * Imports CSL-JSON in chunks of {@code chunkSize} items.
   *
   * <p>A failing item rolls back its own chunk and the exception propagates; chunks before it
   * stay committed.
   *
   * @param chunkSize items per transaction; null or non-positive for the configured size
   * @throws ValidationException if the source does not parse (nothing is written) or an item is
   *     invalid
   */
  public List<ImportedItem> importCslJson(
      String source,
      boolean updateAuthors,
      String actor,
      Integer chunkSize,
      CslImportOptions options) {
    List<ObjectNode> parsed = cslJsonImporter.parse(source);
    int size = chunkSize != null && chunkSize > 0 ? chunkSize : properties.chunkSize();
    var effectiveOptions = options != null ? options : CslImportOptions.defaults();

    List<ImportedItem> imported = new ArrayList<>();
    for (int start = 0; start < parsed.size(); start += size) {
      var chunk = parsed.subList(start, Math.min(start + size, parsed.size()));
      int chunkNumber = start / size + 1;
      try {
        imported.addAll(
            txTemplate.execute(
                status -> importChunk(chunk, chunkNumber, updateAuthors, actor, effectiveOptions)));
      } catch (RuntimeException e) {
        log.warn(
            "CSL-JSON import stopped at chunk {} (items {}-{}): committed={}, remaining={},"
                + " reason={}",
            chunkNumber,
            start + 1,
            start + chunk.size(),
            imported.size(),
            parsed.size() - start,
            reasonOf(e));
        throw e;
      }
    }
    log.info("Imported CSL-JSON: items={}, chunkSize={}", imported.size(), size);
    return imported;
  }

  private static String reasonOf(RuntimeException e) {
    if (e instanceof ErrorResponseException problem && problem.getBody().getDetail() != null) {
      return problem.getBody().getDetail();
    }
    return e.toString();
  }

  private List<ImportedItem> importChunk(
      List<ObjectNode> chunk,
      int chunkNumber,
      boolean updateAuthors,
      String actor,
      CslImportOptions options) {
    List<ImportedItem> items = new ArrayList<>();
    for (ObjectNode item : chunk) {
      items.add(cslJsonImporter.importItem(item, updateAuthors, options, true));
    }
    var details = importDetails("csl-json", items);
    details.put("chunk", chunkNumber);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("publication.imported")
            .entityType("publication")
            .actor(actor)
            .details(details)
            .build());
    return items;
  }

  private static Map<String, Object> importDetails(String format, List<ImportedItem> items) {
    var details = new LinkedHashMap<String, Object>();
    details.put("format", format);
    details.put("slugs", items.stream().map(i -> i.publication().getSlug()).toList());
    details.put("created", items.stream().filter(ImportedItem::created).count());
    return details;
  }
}
