package io.strativerse.curation.publication.importer;

import io.strativerse.curation.config.CuratorLoggingFilter;
import io.strativerse.curation.publication.PublicationService;
import io.strativerse.curation.publication.dto.PublicationResponse;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/publications/import")
public class PublicationImportController {

  private final PublicationImportService importService;
  private final PublicationService publicationService;

  public PublicationImportController(
      PublicationImportService importService, PublicationService publicationService) {
    this.importService = importService;
    this.publicationService = publicationService;
  }

  @PostMapping(value = "/bibtex", consumes = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<List<PublicationResponse>> importBibtex(
      @RequestHeader(name = CuratorLoggingFilter.CURATOR_HEADER, required = false) String curator,
      @RequestBody String text) {
    return ResponseEntity.ok(describe(importService.importBibtex(text, curator)));
  }

  @PostMapping("/csl-json")
  public ResponseEntity<List<PublicationResponse>> importCslJson(
      @RequestHeader(name = CuratorLoggingFilter.CURATOR_HEADER, required = false) String curator,
      @RequestParam(defaultValue = "true") boolean updateAuthors,
      @RequestParam(defaultValue = "false") boolean regenerateSlugs,
      @RequestParam(defaultValue = "true") boolean tagResidual,
      @RequestParam(required = false) Integer chunkSize,
      @RequestBody String source) {
    var items =
        importService.importCslJson(
            source,
            updateAuthors,
            curator,
            chunkSize,
            new CslImportOptions(regenerateSlugs, tagResidual));
    return ResponseEntity.ok(describe(items));
  }

  private List<PublicationResponse> describe(List<ImportedItem> items) {
    return items.stream().map(i -> publicationService.describe(i.publication())).toList();
  }
}
