package io.strativerse.curation.publication.importer;

import io.strativerse.curation.person.Alias;
import io.strativerse.curation.person.AliasRepository;
import io.strativerse.curation.person.Person;
import io.strativerse.curation.person.PersonRepository;
import io.strativerse.curation.publication.Authorship;
import io.strativerse.curation.publication.AuthorshipRepository;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves citation names to people by exact alias, registering a new person and alias for names
 * never seen before.
 */
@Component
public class AuthorResolver {

  private static final Logger log = LoggerFactory.getLogger(AuthorResolver.class);

  private final PersonRepository personRepository;
  private final AliasRepository aliasRepository;
  private final AuthorshipRepository authorshipRepository;

  public AuthorResolver(
      PersonRepository personRepository,
      AliasRepository aliasRepository,
      AuthorshipRepository authorshipRepository) {
    this.personRepository = personRepository;
    this.aliasRepository = aliasRepository;
    this.authorshipRepository = authorshipRepository;
  }

  public Person resolve(CitationName name) {
    String alias = name.alias();
    var existing =
        aliasRepository.findByAlias(alias).flatMap(a -> personRepository.findById(a.getPersonId()));
    if (existing.isPresent()) {
      return existing.get();
    }
    String given = name.literal().isEmpty() ? name.given() : "";
    var person = personRepository.save(new Person(given, name.lastName(), name.suffix()));
    aliasRepository.save(new Alias(person.getId(), alias));
    log.info("Created person from citation: id={}, alias={}", person.getId(), alias);
    return person;
  }

  /**
   * Replaces every authorship of a publication. Roles keep their source order and {@code order}
   * is the index within the role.
   */
  public List<Authorship> replaceAuthorships(
      UUID publicationId, Map<String, List<CitationName>> namesByRole) {
    Map<String, Person> resolved = new HashMap<>();
    List<Authorship> authorships = new ArrayList<>();
    for (var role : namesByRole.entrySet()) {
      List<CitationName> names = role.getValue();
      for (int i = 0; i < names.size(); i++) {
        var name = names.get(i);
        var person = resolved.get(name.alias());
        if (person == null) {
          person = resolve(name);
          resolved.put(name.alias(), person);
        }
        authorships.add(new Authorship(publicationId, person.getId(), role.getKey(), i));
      }
    }
    authorshipRepository.deleteByPublicationId(publicationId);
    return authorshipRepository.saveAll(authorships);
  }
}
