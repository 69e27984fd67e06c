package io.strativerse.curation.person;

import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.annotation.TransferResult;
import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.publication.AuthorshipRepository;
import io.strativerse.curation.sample.RecordAuthorshipRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Combines duplicate people. The candidate with the most publication authorships survives; every
 * other candidate's aliases, authorships, record authorships, contact info and annotations are
 * re-pointed at the survivor before the candidate is deleted. The whole combine is one transaction
 * and one audit event.
 */
@Service
public class PersonMergeService {

  private static final Logger log = LoggerFactory.getLogger(PersonMergeService.class);

  static final String TOO_FEW_MESSAGE = "Select two or more people to combine";

  private final PersonRepository personRepository;
  private final AliasRepository aliasRepository;
  private final ContactInfoRepository contactInfoRepository;
  private final AuthorshipRepository authorshipRepository;
  private final RecordAuthorshipRepository recordAuthorshipRepository;
  private final AnnotationService annotationService;
  private final AuditService auditService;

  public PersonMergeService(
      PersonRepository personRepository,
      AliasRepository aliasRepository,
      ContactInfoRepository contactInfoRepository,
      AuthorshipRepository authorshipRepository,
      RecordAuthorshipRepository recordAuthorshipRepository,
      AnnotationService annotationService,
      AuditService auditService) {
    this.personRepository = personRepository;
    this.aliasRepository = aliasRepository;
    this.contactInfoRepository = contactInfoRepository;
    this.authorshipRepository = authorshipRepository;
    this.recordAuthorshipRepository = recordAuthorshipRepository;
    this.annotationService = annotationService;
    this.auditService = auditService;
  }

  /**
   * Combines the given people into one.
   *
   * @param personIds candidates in curator order; duplicates are ignored
   * @param actor curator performing the combine; null for the request's curator
   * @param comment revision comment; a default naming all candidates is used when blank
   * @return the merged outcome, or a rejected outcome when fewer than two distinct people are given
   * @throws ResourceNotFoundException if a candidate no longer exists (e.g. removed by a concurrent
   *     combine); the caller may retry with the remaining people
   */
  @Transactional
  public MergeOutcome combine(List<UUID> personIds, String actor, String comment) {
    var distinctIds =
        personIds == null ? List.<UUID>of() : List.copyOf(new LinkedHashSet<>(personIds));
    if (distinctIds.size() < 2) {
      return MergeOutcome.rejected(TOO_FEW_MESSAGE);
    }

    List<Person> candidates = new ArrayList<>();
    for (UUID id : distinctIds) {
      candidates.add(
          personRepository
              .findById(id)
              .orElseThrow(() -> new ResourceNotFoundException("Person", id)));
    }
    Person survivor = selectSurvivor(candidates, authorshipRepository::countByPersonId);
    UUID survivorId = survivor.getId();
    var survivorOwner = AnnotationOwner.person(survivorId);

    var combined = new ArrayList<Map<String, Object>>();
    candidates.forEach(p -> combined.add(personSummary(p)));

    List<UUID> removedIds = new ArrayList<>();
    int aliases = 0;
    int authorships = 0;
    int recordAuthorships = 0;
    int contacts = 0;
    TransferResult annotations = new TransferResult(0, 0);
    for (Person loser : candidates) {
      UUID loserId = loser.getId();
      if (loserId.equals(survivorId)) {
        continue;
      }
      aliases += aliasRepository.reassignPerson(loserId, survivorId);
      authorships += authorshipRepository.reassignPerson(loserId, survivorId);
      recordAuthorships += recordAuthorshipRepository.reassignPerson(loserId, survivorId);
      contacts += contactInfoRepository.reassignPerson(loserId, survivorId);
      annotations =
          annotations.plus(
              annotationService.transferAll(AnnotationOwner.person(loserId), survivorOwner));
      personRepository.deleteById(loserId);
      removedIds.add(loserId);
    }
    personRepository.flush();

    String names = candidates.stream().map(Person::displayName).collect(Collectors.joining(", "));
    var details = new LinkedHashMap<String, Object>();
    details.put("survivor", personSummary(survivor));
    details.put("combined", combined);
    details.put("aliases_moved", aliases);
    details.put("authorships_moved", authorships);
    details.put("record_authorships_moved", recordAuthorships);
    details.put("contacts_moved", contacts);
    details.put("annotations_moved", annotations.moved());
    details.put("annotations_discarded", annotations.discarded());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("person.combined")
            .entityType("person")
            .entityId(survivorId)
            .actor(actor)
            .comment(comment == null || comment.isBlank() ? "Combined people: " + names : comment)
            .details(details)
            .build());

    log.info(
        "Combined people: survivor={}, removed={}, authorshipsMoved={}, annotationsDiscarded={}",
        survivorId,
        removedIds,
        authorships,
        annotations.discarded());

    var reloaded =
        personRepository
            .findById(survivorId)
            .orElseThrow(() -> new ResourceNotFoundException("Person", survivorId));
    return MergeOutcome.merged(reloaded, removedIds, annotations);
  }

  /** The candidate with the most authorships; the earliest candidate wins a tie. */
  static Person selectSurvivor(List<Person> candidates, ToLongFunction<UUID> authorshipCount) {
    Person best = null;
    long bestCount = -1;
    for (Person candidate : candidates) {
      long count = authorshipCount.applyAsLong(candidate.getId());
      if (count > bestCount) {
        best = candidate;
        bestCount = count;
      }
    }
    return best;
  }

  private static Map<String, Object> personSummary(Person person) {
    var summary = new LinkedHashMap<String, Object>();
    summary.put("id", person.getId().toString());
    summary.put("name", person.displayName());
    return summary;
  }
}
