package io.strativerse.curation.person;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.strativerse.curation.ServiceLayerTestConfiguration;
import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.exception.ResourceConflictException;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.person.dto.CreatePersonRequest;
import io.strativerse.curation.publication.Authorship;
import io.strativerse.curation.publication.AuthorshipRepository;
import io.strativerse.curation.publication.Publication;
import io.strativerse.curation.publication.PublicationRepository;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(ServiceLayerTestConfiguration.class)
class PersonServiceIntegrationTest {

  @Autowired private PersonService personService;
  @Autowired private AnnotationService annotationService;
  @Autowired private PersonRepository personRepository;
  @Autowired private PublicationRepository publicationRepository;
  @Autowired private AuthorshipRepository authorshipRepository;

  @Test
  void addAlias_resolvesToExactlyOnePerson() {
    var jo = create("Jo", "Berg", "Berg, Jo");

    personService.addAlias(jo.getId(), "Berg, J.");

    assertThat(personService.findByAlias("Berg, J.").orElseThrow().getId()).isEqualTo(jo.getId());
    assertThat(personService.aliases(jo.getId())).containsExactly("Berg, J.", "Berg, Jo");
  }

  @Test
  void addAlias_isIdempotentForTheSamePerson() {
    var jo = create("Jo", "Berg", "Berg, Jo");

    var again = personService.addAlias(jo.getId(), "Berg, Jo");

    assertThat(again.getPersonId()).isEqualTo(jo.getId());
    assertThat(personService.aliases(jo.getId())).hasSize(1);
  }

  @Test
  void addAlias_rejectsAliasOwnedBySomeoneElse() {
    create("Jo", "Berg", "Berg, J.");
    var other = create("Jan", "Berg", "Berg, Jan");

    assertThatThrownBy(() -> personService.addAlias(other.getId(), "Berg, J."))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("already belongs");
  }

  @Test
  void create_rejectsDuplicateAliasAcrossPeople() {
    create("Jo", "Berg", "Berg, J.");

    assertThatThrownBy(() -> create("Jan", "Berg", "Berg, J."))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void removeAlias_failsForAliasOfAnotherPerson() {
    create("Jo", "Berg", "Berg, J.");
    var other = create("Jan", "Berg", "Berg, Jan");

    assertThatThrownBy(() -> personService.removeAlias(other.getId(), "Berg, J."))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void create_requiresLastName() {
    assertThatThrownBy(
            () -> personService.create(new CreatePersonRequest("Jo", " ", null, null, null)))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void delete_isBlockedWhileThePersonIsAnAuthor() {
    var jo = create("Jo", "Berg", "Berg, Jo");
    var publication = publicationRepository.save(new Publication("berg10", "Tephra", 2010));
    authorshipRepository.save(
        new Authorship(publication.getId(), jo.getId(), Authorship.AUTHOR_ROLE, 0));

    assertThatThrownBy(() -> personService.delete(jo.getId()))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("1 publication authorship(s)");
    assertThat(personRepository.existsById(jo.getId())).isTrue();
  }

  @Test
  void delete_removesAliasesContactsAndAnnotations() {
    var jo = create("Jo", "Berg", "Berg, Jo");
    personService.addContactInfo(
        jo.getId(), LocalDate.of(2020, 1, 1), "jo@example.org", null, null);
    annotationService.attachTag(AnnotationOwner.person(jo.getId()), "note", "lab", "GFZ", null);

    personService.delete(jo.getId());

    assertThat(personRepository.existsById(jo.getId())).isFalse();
    assertThat(personService.findByAlias("Berg, Jo")).isEmpty();
    assertThat(personService.contactInfo(jo.getId())).isEmpty();
    assertThat(annotationService.listTags(AnnotationOwner.person(jo.getId()))).isEmpty();
  }

  @Test
  void search_matchesAliases() {
    var jo = create("Jo", "Berg", "Bergström, Johanna");

    assertThat(personService.search("ström")).extracting(Person::getId).contains(jo.getId());
  }

  private Person create(String given, String last, String alias) {
    return personService.create(new CreatePersonRequest(given, last, null, null, List.of(alias)));
  }
}
