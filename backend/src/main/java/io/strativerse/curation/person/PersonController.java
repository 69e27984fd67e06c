package io.strativerse.curation.person;

import io.strativerse.curation.config.CuratorLoggingFilter;
import io.strativerse.curation.person.dto.AliasRequest;
import io.strativerse.curation.person.dto.CombinePeopleRequest;
import io.strativerse.curation.person.dto.CombinePeopleResponse;
import io.strativerse.curation.person.dto.ContactInfoRequest;
import io.strativerse.curation.person.dto.CreatePersonRequest;
import io.strativerse.curation.person.dto.PersonResponse;
import io.strativerse.curation.person.dto.UpdatePersonRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/people")
public class PersonController {

  private final PersonService personService;
  private final PersonMergeService personMergeService;

  public PersonController(PersonService personService, PersonMergeService personMergeService) {
    this.personService = personService;
    this.personMergeService = personMergeService;
  }

  @GetMapping
  public ResponseEntity<List<PersonResponse>> list(@RequestParam(required = false) String search) {
    return ResponseEntity.ok(personService.search(search).stream().map(this::toResponse).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<PersonResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(toResponse(personService.get(id)));
  }

  @PostMapping
  public ResponseEntity<PersonResponse> create(@Valid @RequestBody CreatePersonRequest request) {
    var person = personService.create(request);
    return ResponseEntity.created(URI.create("/api/people/" + person.getId()))
        .body(toResponse(person));
  }

  @PutMapping("/{id}")
  public ResponseEntity<PersonResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdatePersonRequest request) {
    return ResponseEntity.ok(toResponse(personService.update(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    personService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/aliases")
  public ResponseEntity<PersonResponse> addAlias(
      @PathVariable UUID id, @Valid @RequestBody AliasRequest request) {
    personService.addAlias(id, request.alias());
    return ResponseEntity.ok(toResponse(personService.get(id)));
  }

  @DeleteMapping("/{id}/aliases/{alias}")
  public ResponseEntity<Void> removeAlias(@PathVariable UUID id, @PathVariable String alias) {
    personService.removeAlias(id, alias);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/contact-info")
  public ResponseEntity<Void> addContactInfo(
      @PathVariable UUID id, @Valid @RequestBody ContactInfoRequest request) {
    personService.addContactInfo(
        id, request.updated(), request.email(), request.telephone(), request.address());
    return ResponseEntity.status(HttpStatus.CREATED).build();
  }

  /** Combines people; fewer than two distinct ids is answered with 422 and a message. */
  @PostMapping("/combine")
  public ResponseEntity<CombinePeopleResponse> combine(
      @RequestHeader(name = CuratorLoggingFilter.CURATOR_HEADER, required = false) String curator,
      @Valid @RequestBody CombinePeopleRequest request) {
    var outcome = personMergeService.combine(request.personIds(), curator, request.comment());
    if (!outcome.merged()) {
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(CombinePeopleResponse.from(outcome, List.of()));
    }
    var aliases = personService.aliases(outcome.survivor().getId());
    return ResponseEntity.ok(CombinePeopleResponse.from(outcome, aliases));
  }

  private PersonResponse toResponse(Person person) {
    return PersonResponse.from(person, personService.aliases(person.getId()));
  }
}
