package io.strativerse.curation.publication.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.strativerse.curation.ServiceLayerTestConfiguration;
import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.annotation.Tag;
import io.strativerse.curation.audit.AuditEventRepository;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.publication.Authorship;
import io.strativerse.curation.publication.Publication;
import io.strativerse.curation.publication.PublicationRepository;
import io.strativerse.curation.publication.PublicationService;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(ServiceLayerTestConfiguration.class)
class CslJsonImportIntegrationTest {

  @Autowired private PublicationImportService importService;
  @Autowired private PublicationService publicationService;
  @Autowired private AnnotationService annotationService;
  @Autowired private PublicationRepository publicationRepository;
  @Autowired private AuditEventRepository auditEventRepository;

  @Test
  void importCslJson_disambiguatesSlugsByLetter() {
    var items =
        importService.importCslJson(
            """
            [
              {"type": "article-journal", "title": "Varves of Lake A",
               "author": [{"family": "Smith", "given": "Jo"}],
               "issued": {"date-parts": [[2019]]}},
              {"type": "article-journal", "title": "Varves of Lake B",
               "author": [{"family": "Smith", "given": "Jo"}],
               "issued": {"date-parts": [[2019]]}}
            ]
            """,
            true,
            "alice",
            null,
            CslImportOptions.defaults());

    assertThat(items)
        .extracting(item -> item.publication().getSlug())
        .containsExactly("smith19", "smith19a");
    var first = publicationService.getBySlug("smith19");
    var second = publicationService.getBySlug("smith19a");
    assertThat(publicationService.authorships(first.getId()).get(0).getPersonId())
        .isEqualTo(publicationService.authorships(second.getId()).get(0).getPersonId());
  }

  @Test
  void importCslJson_usesUnusedItemIdAsSlug() {
    importService.importCslJson(
        """
        [{"id": "berg2020", "title": "Tephra", "author": [{"family": "Berg", "given": "A"}],
          "issued": {"date-parts": [[2020]]}}]
        """,
        true,
        "alice",
        null,
        CslImportOptions.defaults());

    assertThat(publicationRepository.existsBySlug("berg2020")).isTrue();
  }

  @Test
  void importCslJson_storesUnmappedFieldsAsMetaTags() {
    importService.importCslJson(
        """
        [{"title": "Varves", "author": [{"family": "Smith", "given": "Jo"}],
          "issued": {"date-parts": [[2019]]}, "container-title": "Boreas", "volume": "12",
          "keyword": ["varves", "holocene"]}]
        """,
        true,
        "alice",
        null,
        CslImportOptions.defaults());

    var publication = publicationService.getBySlug("smith19");
    Map<String, String> meta =
        annotationService
            .listTags(
                AnnotationOwner.publication(publication.getId()), CslJsonImporter.META_TAG_TYPE)
            .stream()
            .collect(Collectors.toMap(Tag::getKey, Tag::getValue));
    assertThat(meta)
        .containsEntry("container_title", "Boreas")
        .containsEntry("volume", "12")
        .containsEntry("keyword", "list:[\"varves\",\"holocene\"]");
  }

  @Test
  void importCslJson_keepsItemIdAsMetaTagWhenSlugIsRegenerated() {
    importService.importCslJson(
        """
        [{"id": "berg2020", "title": "Tephra", "author": [{"family": "Berg", "given": "A"}],
          "issued": {"date-parts": [[2020]]}}]
        """,
        true,
        "alice",
        null,
        new CslImportOptions(true, true));

    var publication = publicationService.getBySlug("berg20");
    assertThat(metaTags(publication)).containsEntry("id", "berg2020");
  }

  @Test
  void importCslJson_doesNotTagItemIdUsedAsSlug() {
    importService.importCslJson(
        """
        [{"id": "berg2020", "title": "Tephra", "author": [{"family": "Berg", "given": "A"}],
          "issued": {"date-parts": [[2020]]}}]
        """,
        true,
        "alice",
        null,
        CslImportOptions.defaults());

    var publication = publicationService.getBySlug("berg2020");
    assertThat(metaTags(publication)).doesNotContainKey("id");
  }

  @Test
  void importCslJson_withoutResidualTaggingWritesNoMetaTags() {
    importService.importCslJson(
        """
        [{"title": "Varves", "author": [{"family": "Smith", "given": "Jo"}],
          "issued": {"date-parts": [[2019]]}, "volume": "12"}]
        """,
        true,
        "alice",
        null,
        new CslImportOptions(false, false));

    var publication = publicationService.getBySlug("smith19");
    assertThat(annotationService.listTags(AnnotationOwner.publication(publication.getId())))
        .isEmpty();
  }

  @Test
  void importCslJson_updatesExistingPublicationByDoi() {
    importService.importCslJson(
        """
        [{"title": "Draft title", "DOI": "10.5194/cp-1-2019",
          "author": [{"family": "Smith", "given": "Jo"}], "issued": {"date-parts": [[2019]]}}]
        """,
        true,
        "alice",
        null,
        CslImportOptions.defaults());

    var items =
        importService.importCslJson(
            """
            [{"title": "Final title", "DOI": "10.5194/CP-1-2019",
              "author": [{"family": "Smith", "given": "Jo"}], "issued": {"date-parts": [[2019]]}}]
            """,
            true,
            "alice",
            null,
            CslImportOptions.defaults());

    assertThat(items.get(0).created()).isFalse();
    assertThat(publicationRepository.count()).isEqualTo(1);
    assertThat(publicationService.getBySlug("smith19").getTitle()).isEqualTo("Final title");
  }

  @Test
  void importCslJson_foldsNearDuplicateIntoExistingPublication() {
    var source =
        """
        [{"title": "Holocene varves", "author": [{"family": "Smith", "given": "Jo"}],
          "issued": {"date-parts": [[2019]]}, "volume": "3"}]
        """;
    importService.importCslJson(source, true, "alice", null, CslImportOptions.defaults());

    var items =
        importService.importCslJson(source, true, "alice", null, CslImportOptions.defaults());

    assertThat(items.get(0).created()).isFalse();
    assertThat(items.get(0).publication().getSlug()).isEqualTo("smith19");
    assertThat(publicationRepository.count()).isEqualTo(1);
    assertThat(publicationRepository.existsBySlug("smith19a")).isFalse();
  }

  @Test
  void importCslJson_regeneratesSlugOnRequest() {
    var existing = publicationRepository.save(new Publication("custom_key", "Varves", 2019));
    existing.updateBibliographic("Varves", 2019, "10.1/abc", "", null, null);
    publicationRepository.save(existing);

    importService.importCslJson(
        """
        [{"title": "Varves", "DOI": "10.1/abc", "author": [{"family": "Berg", "given": "A"}],
          "issued": {"date-parts": [[2018]]}}]
        """,
        true,
        "alice",
        null,
        new CslImportOptions(true, true));

    assertThat(publicationRepository.existsBySlug("custom_key")).isFalse();
    assertThat(publicationRepository.existsBySlug("berg18")).isTrue();
  }

  @Test
  void importCslJson_withoutAuthorUpdateLeavesAuthorshipsAlone() {
    importService.importCslJson(
        """
        [{"title": "Varves", "author": [{"family": "Smith", "given": "Jo"}],
          "issued": {"date-parts": [[2019]]}}]
        """,
        false,
        "alice",
        null,
        CslImportOptions.defaults());

    var publication = publicationService.getBySlug("smith19");
    assertThat(publicationService.authorships(publication.getId())).isEmpty();
  }

  @Test
  void importCslJson_writesOneRevisionPerChunk() {
    var items =
        importService.importCslJson(
            """
            [
              {"title": "One", "author": [{"family": "Ng", "given": "B"}], "year": "2001"},
              {"title": "Two", "author": [{"family": "Ng", "given": "B"}], "year": "2002"},
              {"title": "Three", "author": [{"family": "Ng", "given": "B"}], "year": "2003"}
            ]
            """,
            true,
            "alice",
            2,
            CslImportOptions.defaults());

    assertThat(items).hasSize(3);
    var events = auditEventRepository.findByEventTypeOrderByOccurredAtAsc("publication.imported");
    assertThat(events).hasSize(2);
    assertThat(events).extracting(e -> e.getDetails().get("chunk")).containsExactlyInAnyOrder(1, 2);
  }

  @Test
  void importCslJson_malformedJsonWritesNothing() {
    assertThatThrownBy(
            () ->
                importService.importCslJson(
                    "[{\"title\": ", true, "alice", null, CslImportOptions.defaults()))
        .isInstanceOf(ValidationException.class);
    assertThat(publicationRepository.count()).isZero();
  }

  @Test
  void importCslJson_authorOrderFollowsTheItem() {
    importService.importCslJson(
        """
        [{"title": "Tephra", "issued": {"date-parts": [[2015]]},
          "author": [{"family": "Ng", "given": "B"}, {"family": "Berg", "given": "A"}],
          "editor": [{"literal": "Quaternary Research Association"}]}]
        """,
        true,
        "alice",
        null,
        CslImportOptions.defaults());

    var publication = publicationService.getBySlug("ng_and_berg15");
    assertThat(publicationService.authorships(publication.getId()))
        .extracting(Authorship::getRole, Authorship::getOrder)
        .containsExactly(
            tuple("author", 0),
            tuple("author", 1),
            tuple("editor", 0));
    assertThat(publicationService.authorDateKey(publication)).isEqualTo("Ng and Berg 2015");
  }

  private Map<String, String> metaTags(Publication publication) {
    return annotationService
        .listTags(AnnotationOwner.publication(publication.getId()), CslJsonImporter.META_TAG_TYPE)
        .stream()
        .collect(Collectors.toMap(Tag::getKey, Tag::getValue));
  }
}
