package io.strativerse.curation.annotation;

import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.feature.FeatureRepository;
import io.strativerse.curation.parameter.ParameterRepository;
import io.strativerse.curation.person.PersonRepository;
import io.strativerse.curation.publication.PublicationRepository;
import io.strativerse.curation.sample.SampleRecordRepository;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Dispatch table from {@link EntityKind} to an existence check. Annotation owners carry no foreign
 * key, so this is where a dangling (kind, id) pair is rejected.
 */
@Component
public class AnnotationOwnerRegistry {

  private final Map<EntityKind, Predicate<UUID>> existsByKind = new EnumMap<>(EntityKind.class);

  public AnnotationOwnerRegistry(
      PersonRepository personRepository,
      PublicationRepository publicationRepository,
      FeatureRepository featureRepository,
      SampleRecordRepository sampleRecordRepository,
      ParameterRepository parameterRepository) {
    existsByKind.put(EntityKind.PERSON, personRepository::existsById);
    existsByKind.put(EntityKind.PUBLICATION, publicationRepository::existsById);
    existsByKind.put(EntityKind.FEATURE, featureRepository::existsById);
    existsByKind.put(EntityKind.RECORD, sampleRecordRepository::existsById);
    existsByKind.put(EntityKind.PARAMETER, parameterRepository::existsById);
  }

  public boolean exists(AnnotationOwner owner) {
    return existsByKind.get(owner.kind()).test(owner.id());
  }

  public void requireExists(AnnotationOwner owner) {
    if (!exists(owner)) {
      throw new ResourceNotFoundException(capitalize(owner.kind().label()), owner.id());
    }
  }

  private static String capitalize(String label) {
    return Character.toUpperCase(label.charAt(0)) + label.substring(1);
  }
}
