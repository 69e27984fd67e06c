package io.strativerse.curation.person.dto;

import io.strativerse.curation.person.MergeOutcome;
import java.util.List;
import java.util.UUID;

public record CombinePeopleResponse(
    boolean merged,
    String message,
    PersonResponse survivor,
    List<UUID> removedIds,
    int annotationsMoved,
    int annotationsDiscarded) {

  public static CombinePeopleResponse from(MergeOutcome outcome, List<String> survivorAliases) {
    return new CombinePeopleResponse(
        outcome.merged(),
        outcome.message(),
        outcome.merged() ? PersonResponse.from(outcome.survivor(), survivorAliases) : null,
        outcome.removedIds(),
        outcome.annotations().moved(),
        outcome.annotations().discarded());
  }
}
