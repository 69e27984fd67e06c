package io.strativerse.curation.annotation;

import java.util.Objects;
import java.util.UUID;

/** The (kind, id) pair that a tag or attachment hangs off. */
public record AnnotationOwner(EntityKind kind, UUID id) {

  public AnnotationOwner {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(id, "id");
  }

  public static AnnotationOwner person(UUID id) {
    return new AnnotationOwner(EntityKind.PERSON, id);
  }

  public static AnnotationOwner publication(UUID id) {
    return new AnnotationOwner(EntityKind.PUBLICATION, id);
  }

  public static AnnotationOwner feature(UUID id) {
    return new AnnotationOwner(EntityKind.FEATURE, id);
  }

  public static AnnotationOwner record(UUID id) {
    return new AnnotationOwner(EntityKind.RECORD, id);
  }

  public static AnnotationOwner parameter(UUID id) {
    return new AnnotationOwner(EntityKind.PARAMETER, id);
  }
}
