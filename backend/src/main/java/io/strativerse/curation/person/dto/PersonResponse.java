package io.strativerse.curation.person.dto;

import io.strativerse.curation.person.Person;
import java.util.List;
import java.util.UUID;

public record PersonResponse(
    UUID id,
    String givenNames,
    String lastName,
    String suffix,
    String orcid,
    String displayName,
    List<String> aliases) {

  public static PersonResponse from(Person person, List<String> aliases) {
    return new PersonResponse(
        person.getId(),
        person.getGivenNames(),
        person.getLastName(),
        person.getSuffix(),
        person.getOrcid(),
        person.displayName(),
        aliases);
  }
}
