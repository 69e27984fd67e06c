package io.strativerse.curation.person;

import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceConflictException;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.person.dto.CreatePersonRequest;
import io.strativerse.curation.person.dto.UpdatePersonRequest;
import io.strativerse.curation.publication.AuthorshipRepository;
import io.strativerse.curation.sample.RecordAuthorshipRepository;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PersonService {

  private static final Logger log = LoggerFactory.getLogger(PersonService.class);

  private final PersonRepository personRepository;
  private final AliasRepository aliasRepository;
  private final ContactInfoRepository contactInfoRepository;
  private final AuthorshipRepository authorshipRepository;
  private final RecordAuthorshipRepository recordAuthorshipRepository;
  private final AnnotationService annotationService;
  private final AuditService auditService;

  public PersonService(
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

  @Transactional(readOnly = true)
  public Person get(UUID id) {
    return personRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Person", id));
  }

  @Transactional(readOnly = true)
  public List<Person> search(String term) {
    if (term == null || term.isBlank()) {
      return personRepository.findAllOrdered();
    }
    return personRepository.search(term.trim());
  }

  @Transactional(readOnly = true)
  public Optional<Person> findByAlias(String alias) {
    return aliasRepository
        .findByAlias(alias)
        .flatMap(a -> personRepository.findById(a.getPersonId()));
  }

  @Transactional(readOnly = true)
  public List<String> aliases(UUID personId) {
    return aliasRepository.findByPersonIdOrderByAliasAsc(personId).stream()
        .map(Alias::getAlias)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<ContactInfo> contactInfo(UUID personId) {
    return contactInfoRepository.findByPersonIdOrderByUpdatedDesc(personId);
  }

  @Transactional
  public Person create(CreatePersonRequest request) {
    if (request.lastName() == null || request.lastName().isBlank()) {
      throw new ValidationException("Invalid person", "Last name must not be blank");
    }
    var person = new Person(request.givenNames(), request.lastName().strip(), request.suffix());
    person.setOrcid(request.orcid());
    person = personRepository.save(person);

    if (request.aliases() != null) {
      for (String alias : request.aliases()) {
        registerAlias(person.getId(), alias);
      }
    }

    log.info("Created person: id={}, name={}", person.getId(), person.displayName());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("person.created")
            .entityType("person")
            .entityId(person.getId())
            .details(Map.of("after", snapshot(person)))
            .build());
    return person;
  }

  @Transactional
  public Person update(UUID id, UpdatePersonRequest request) {
    var person = get(id);
    var before = snapshot(person);
    person.update(request.givenNames(), request.lastName(), request.suffix(), request.orcid());
    person = personRepository.save(person);

    log.info("Updated person: id={}, name={}", person.getId(), person.displayName());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("person.updated")
            .entityType("person")
            .entityId(person.getId())
            .details(Map.of("before", before, "after", snapshot(person)))
            .build());
    return person;
  }

  /**
   * Deletes a person with no authorships. People referenced by publications or records can only be
   * removed by combining them into another person.
   */
  @Transactional
  public void delete(UUID id) {
    var person = get(id);
    long authorships = authorshipRepository.countByPersonId(id);
    long recordAuthorships = recordAuthorshipRepository.countByPersonId(id);
    if (authorships > 0 || recordAuthorships > 0) {
      throw new ResourceConflictException(
          "Person in use",
          person.displayName()
              + " is referenced by "
              + authorships
              + " publication authorship(s) and "
              + recordAuthorships
              + " record authorship(s)");
    }
    var before = snapshot(person);
    aliasRepository.deleteByPersonId(id);
    contactInfoRepository.deleteByPersonId(id);
    annotationService.deleteAll(AnnotationOwner.person(id));
    personRepository.deleteById(id);

    log.info("Deleted person: id={}", id);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("person.deleted")
            .entityType("person")
            .entityId(id)
            .details(Map.of("before", before))
            .build());
  }

  /**
   * Registers an alias for a person. Adding an alias the person already owns is a no-op; an alias
   * owned by anyone else is a conflict.
   */
  @Transactional
  public Alias addAlias(UUID personId, String alias) {
    get(personId);
    var result = registerAlias(personId, alias);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("person.alias_added")
            .entityType("person")
            .entityId(personId)
            .details(Map.of("alias", result.getAlias()))
            .build());
    return result;
  }

  @Transactional
  public void removeAlias(UUID personId, String alias) {
    var existing =
        aliasRepository
            .findByAlias(alias)
            .filter(a -> a.getPersonId().equals(personId))
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Alias not found", "Person " + personId + " has no alias '" + alias + "'"));
    aliasRepository.delete(existing);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("person.alias_removed")
            .entityType("person")
            .entityId(personId)
            .details(Map.of("alias", alias))
            .build());
  }

  @Transactional
  public ContactInfo addContactInfo(
      UUID personId, LocalDate updated, String email, String telephone, String address) {
    get(personId);
    var info =
        contactInfoRepository.save(new ContactInfo(personId, updated, email, telephone, address));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("person.contact_added")
            .entityType("person")
            .entityId(personId)
            .details(Map.of("contact", info.summary()))
            .build());
    return info;
  }

  Alias registerAlias(UUID personId, String alias) {
    if (alias == null || alias.isBlank()) {
      throw new ValidationException("Invalid alias", "Alias must not be blank");
    }
    var existing = aliasRepository.findByAlias(alias);
    if (existing.isPresent()) {
      if (existing.get().getPersonId().equals(personId)) {
        return existing.get();
      }
      throw new ResourceConflictException(
          "Duplicate alias",
          "Alias '" + alias + "' already belongs to person " + existing.get().getPersonId());
    }
    try {
      return aliasRepository.saveAndFlush(new Alias(personId, alias));
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate alias", "Alias '" + alias + "' already belongs to another person");
    }
  }

  static Map<String, Object> snapshot(Person person) {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("given_names", person.getGivenNames());
    snapshot.put("last_name", person.getLastName());
    snapshot.put("suffix", person.getSuffix());
    snapshot.put("orcid", person.getOrcid() != null ? person.getOrcid() : "");
    return snapshot;
  }
}
