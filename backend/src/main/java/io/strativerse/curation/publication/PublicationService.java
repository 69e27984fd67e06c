package io.strativerse.curation.publication;

import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceConflictException;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.person.Person;
import io.strativerse.curation.person.PersonRepository;
import io.strativerse.curation.publication.dto.AuthorshipResponse;
import io.strativerse.curation.publication.dto.PublicationResponse;
import io.strativerse.curation.publication.dto.UpdatePublicationRequest;
import io.strativerse.curation.sample.RecordReferenceRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PublicationService {

  private static final Logger log = LoggerFactory.getLogger(PublicationService.class);

  static final String NO_AUTHORS = "<no authors>";

  private final PublicationRepository publicationRepository;
  private final AuthorshipRepository authorshipRepository;
  private final PersonRepository personRepository;
  private final RecordReferenceRepository recordReferenceRepository;
  private final AnnotationService annotationService;
  private final AuditService auditService;

  public PublicationService(
      PublicationRepository publicationRepository,
      AuthorshipRepository authorshipRepository,
      PersonRepository personRepository,
      RecordReferenceRepository recordReferenceRepository,
      AnnotationService annotationService,
      AuditService auditService) {
    this.publicationRepository = publicationRepository;
    this.authorshipRepository = authorshipRepository;
    this.personRepository = personRepository;
    this.recordReferenceRepository = recordReferenceRepository;
    this.annotationService = annotationService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public Publication get(UUID id) {
    return publicationRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Publication", id));
  }

  @Transactional(readOnly = true)
  public Publication getBySlug(String slug) {
    return publicationRepository
        .findBySlug(slug)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Publication not found", "No publication found with slug " + slug));
  }

  @Transactional(readOnly = true)
  public List<Publication> list() {
    return publicationRepository.findAllOrdered();
  }

  @Transactional(readOnly = true)
  public PublicationResponse describe(Publication publication) {
    var authorships = authorshipRepository.findByPublicationIdOrdered(publication.getId());
    var people = peopleById(authorships);
    var rows =
        authorships.stream()
            .map(
                a ->
                    new AuthorshipResponse(
                        a.getPersonId(),
                        nameOf(people.get(a.getPersonId())),
                        a.getRole(),
                        a.getOrder()))
            .toList();
    return PublicationResponse.from(
        publication, authorDateKey(publication, authorships, people), rows);
  }

  @Transactional(readOnly = true)
  public List<Authorship> authorships(UUID publicationId) {
    return authorshipRepository.findByPublicationIdOrdered(publicationId);
  }

  /**
   * Author-date key such as {@code Smith et al. 2019}, built from the {@code author} role (or from
   * every role when a publication has no authors proper).
   */
  @Transactional(readOnly = true)
  public String authorDateKey(Publication publication) {
    var authorships = authorshipRepository.findByPublicationIdOrdered(publication.getId());
    return authorDateKey(publication, authorships, peopleById(authorships));
  }

  /** Citation summary, e.g. {@code Smith and Jones 2019: "Holocene varves of the Ca..."}. */
  @Transactional(readOnly = true)
  public String summary(Publication publication) {
    return authorDateKey(publication) + ": \"" + publication.shortTitle() + "\"";
  }

  @Transactional
  public Publication update(UUID id, UpdatePublicationRequest request) {
    var publication = get(id);
    var before = snapshot(publication);

    if (request.slug() != null
        && !request.slug().isBlank()
        && !request.slug().equals(publication.getSlug())) {
      if (publicationRepository.existsBySlugAndIdNot(request.slug(), id)) {
        throw new ResourceConflictException(
            "Duplicate slug", "A publication with slug '" + request.slug() + "' already exists");
      }
      publication.setSlug(request.slug());
    }
    if (request.year() <= 0) {
      throw new ValidationException("Invalid publication", "Year must be a positive number");
    }
    publication.updateBibliographic(
        request.title(),
        request.year(),
        request.doi(),
        request.url(),
        request.type(),
        request.abstractText());
    publication = publicationRepository.save(publication);

    log.info("Updated publication: id={}, slug={}", publication.getId(), publication.getSlug());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("publication.updated")
            .entityType("publication")
            .entityId(publication.getId())
            .details(Map.of("before", before, "after", snapshot(publication)))
            .build());
    return publication;
  }

  @Transactional
  public void delete(UUID id) {
    var publication = get(id);
    var before = snapshot(publication);
    removeWithDependents(publication.getId());

    log.info("Deleted publication: id={}, slug={}", id, before.get("slug"));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("publication.deleted")
            .entityType("publication")
            .entityId(id)
            .details(Map.of("before", before))
            .build());
  }

  /** Removes a publication with its authorships, record references and annotations. */
  public void removeWithDependents(UUID publicationId) {
    authorshipRepository.deleteByPublicationId(publicationId);
    recordReferenceRepository.deleteByPublicationId(publicationId);
    annotationService.deleteAll(AnnotationOwner.publication(publicationId));
    publicationRepository.deleteById(publicationId);
    publicationRepository.flush();
  }

  private Map<UUID, Person> peopleById(List<Authorship> authorships) {
    var ids = authorships.stream().map(Authorship::getPersonId).distinct().toList();
    return personRepository.findAllById(ids).stream()
        .collect(Collectors.toMap(Person::getId, Function.identity()));
  }

  private static String authorDateKey(
      Publication publication, List<Authorship> authorships, Map<UUID, Person> people) {
    var authors =
        authorships.stream().filter(a -> Authorship.AUTHOR_ROLE.equals(a.getRole())).toList();
    if (authors.isEmpty()) {
      authors = authorships;
    }
    var surnames =
        authors.stream()
            .map(a -> people.get(a.getPersonId()))
            .map(PublicationService::surnameOf)
            .toList();
    return authorText(surnames) + " " + publication.getYear();
  }

  /** Author portion of an author-date key for the given surnames in citation order. */
  public static String authorText(List<String> surnames) {
    return switch (surnames.size()) {
      case 0 -> NO_AUTHORS;
      case 1 -> surnames.get(0);
      case 2 -> surnames.get(0) + " and " + surnames.get(1);
      default -> surnames.get(0) + " et al.";
    };
  }

  private static String surnameOf(Person person) {
    return person != null ? person.getLastName() : "?";
  }

  private static String nameOf(Person person) {
    return person != null ? person.displayName() : "?";
  }

  private static Map<String, Object> snapshot(Publication publication) {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("slug", publication.getSlug());
    snapshot.put("title", publication.getTitle());
    snapshot.put("year", publication.getYear());
    snapshot.put("doi", publication.getDoi());
    snapshot.put("url", publication.getUrl());
    snapshot.put("type", publication.getType().cslName());
    return snapshot;
  }
}
