package io.strativerse.curation.person;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.annotation.TransferResult;
import io.strativerse.curation.audit.AuditEventRecord;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.publication.AuthorshipRepository;
import io.strativerse.curation.sample.RecordAuthorshipRepository;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PersonMergeServiceTest {

  @Mock private PersonRepository personRepository;
  @Mock private AliasRepository aliasRepository;
  @Mock private ContactInfoRepository contactInfoRepository;
  @Mock private AuthorshipRepository authorshipRepository;
  @Mock private RecordAuthorshipRepository recordAuthorshipRepository;
  @Mock private AnnotationService annotationService;
  @Mock private AuditService auditService;
  @InjectMocks private PersonMergeService service;

  @Test
  void combine_rejectsASinglePerson() {
    var outcome = service.combine(List.of(UUID.randomUUID()), "alice", null);

    assertThat(outcome.merged()).isFalse();
    assertThat(outcome.message()).isEqualTo(PersonMergeService.TOO_FEW_MESSAGE);
    verify(personRepository, never()).deleteById(any());
    verify(auditService, never()).log(any());
  }

  @Test
  void combine_countsRepeatedIdsOnce() {
    var id = UUID.randomUUID();

    var outcome = service.combine(List.of(id, id), "alice", null);

    assertThat(outcome.merged()).isFalse();
    verify(personRepository, never()).findById(any());
  }

  @Test
  void combine_rejectsEmptySelection() {
    assertThat(service.combine(null, "alice", null).merged()).isFalse();
  }

  @Test
  void combine_failsWhenACandidateIsGone() {
    var present = personWithId(UUID.randomUUID(), "Ann", "Smith");
    var goneId = UUID.randomUUID();
    when(personRepository.findById(present.getId())).thenReturn(Optional.of(present));
    when(personRepository.findById(goneId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.combine(List.of(present.getId(), goneId), "alice", null))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(personRepository, never()).deleteById(any());
    verify(auditService, never()).log(any());
  }

  @Test
  void combine_repointsEverythingAtThePersonWithMostAuthorships() {
    var loser = personWithId(UUID.randomUUID(), "A.", "Smith");
    var survivor = personWithId(UUID.randomUUID(), "Ann", "Smith");
    when(personRepository.findById(loser.getId())).thenReturn(Optional.of(loser));
    when(personRepository.findById(survivor.getId())).thenReturn(Optional.of(survivor));
    when(authorshipRepository.countByPersonId(loser.getId())).thenReturn(1L);
    when(authorshipRepository.countByPersonId(survivor.getId())).thenReturn(3L);
    when(aliasRepository.reassignPerson(loser.getId(), survivor.getId())).thenReturn(2);
    when(authorshipRepository.reassignPerson(loser.getId(), survivor.getId())).thenReturn(1);
    when(annotationService.transferAll(
            AnnotationOwner.person(loser.getId()), AnnotationOwner.person(survivor.getId())))
        .thenReturn(new TransferResult(1, 1));

    var outcome =
        service.combine(List.of(loser.getId(), survivor.getId()), "alice", "duplicate import");

    assertThat(outcome.merged()).isTrue();
    assertThat(outcome.survivor().getId()).isEqualTo(survivor.getId());
    assertThat(outcome.removedIds()).containsExactly(loser.getId());
    assertThat(outcome.annotations()).isEqualTo(new TransferResult(1, 1));
    verify(recordAuthorshipRepository).reassignPerson(loser.getId(), survivor.getId());
    verify(contactInfoRepository).reassignPerson(loser.getId(), survivor.getId());
    verify(personRepository).deleteById(loser.getId());
    verify(personRepository, never()).deleteById(survivor.getId());

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    var event = captor.getValue();
    assertThat(event.eventType()).isEqualTo("person.combined");
    assertThat(event.entityId()).isEqualTo(survivor.getId());
    assertThat(event.actor()).isEqualTo("alice");
    assertThat(event.comment()).isEqualTo("duplicate import");
    assertThat(event.details())
        .containsEntry("aliases_moved", 2)
        .containsEntry("authorships_moved", 1)
        .containsEntry("annotations_discarded", 1);
    assertThat((List<?>) event.details().get("combined")).hasSize(2);
  }

  @Test
  void selectSurvivor_prefersMostAuthorships() {
    var a = personWithId(UUID.randomUUID(), "A", "One");
    var b = personWithId(UUID.randomUUID(), "B", "Two");
    var counts = Map.of(a.getId(), 1L, b.getId(), 4L);

    assertThat(PersonMergeService.selectSurvivor(List.of(a, b), counts::get)).isSameAs(b);
  }

  @Test
  void selectSurvivor_earliestCandidateWinsATie() {
    var a = personWithId(UUID.randomUUID(), "A", "One");
    var b = personWithId(UUID.randomUUID(), "B", "Two");

    assertThat(PersonMergeService.selectSurvivor(List.of(a, b), id -> 2L)).isSameAs(a);
    assertThat(PersonMergeService.selectSurvivor(List.of(b, a), id -> 2L)).isSameAs(b);
  }

  /** Helper to create a Person with a specific ID via reflection. */
  private static Person personWithId(UUID id, String givenNames, String lastName) {
    var person = new Person(givenNames, lastName, "");
    try {
      var idField = Person.class.getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(person, id);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
    return person;
  }
}
