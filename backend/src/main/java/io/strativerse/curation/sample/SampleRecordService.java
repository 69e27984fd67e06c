package io.strativerse.curation.sample;

import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceConflictException;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.feature.FeatureRepository;
import io.strativerse.curation.geometry.GeoFields;
import io.strativerse.curation.parameter.ParameterRepository;
import io.strativerse.curation.person.PersonRepository;
import io.strativerse.curation.publication.PublicationRepository;
import io.strativerse.curation.sample.dto.RecordAuthorshipRequest;
import io.strativerse.curation.sample.dto.RecordParameterRequest;
import io.strativerse.curation.sample.dto.SampleRecordRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SampleRecordService {

  private static final Logger log = LoggerFactory.getLogger(SampleRecordService.class);

  private final SampleRecordRepository recordRepository;
  private final RecordAuthorshipRepository authorshipRepository;
  private final RecordReferenceRepository referenceRepository;
  private final RecordParameterRepository recordParameterRepository;
  private final FeatureRepository featureRepository;
  private final PersonRepository personRepository;
  private final PublicationRepository publicationRepository;
  private final ParameterRepository parameterRepository;
  private final AnnotationService annotationService;
  private final AuditService auditService;

  public SampleRecordService(
      SampleRecordRepository recordRepository,
      RecordAuthorshipRepository authorshipRepository,
      RecordReferenceRepository referenceRepository,
      RecordParameterRepository recordParameterRepository,
      FeatureRepository featureRepository,
      PersonRepository personRepository,
      PublicationRepository publicationRepository,
      ParameterRepository parameterRepository,
      AnnotationService annotationService,
      AuditService auditService) {
    this.recordRepository = recordRepository;
    this.authorshipRepository = authorshipRepository;
    this.referenceRepository = referenceRepository;
    this.recordParameterRepository = recordParameterRepository;
    this.featureRepository = featureRepository;
    this.personRepository = personRepository;
    this.publicationRepository = publicationRepository;
    this.parameterRepository = parameterRepository;
    this.annotationService = annotationService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public SampleRecord get(UUID id) {
    return recordRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Record", id));
  }

  @Transactional(readOnly = true)
  public List<SampleRecord> listByFeature(UUID featureId) {
    return recordRepository.findByFeatureIdOrderByDateCollectedAsc(featureId);
  }

  @Transactional(readOnly = true)
  public List<RecordAuthorship> authorships(UUID recordId) {
    return authorshipRepository.findByRecordIdOrdered(recordId);
  }

  @Transactional(readOnly = true)
  public List<RecordReference> references(UUID recordId) {
    return referenceRepository.findByRecordId(recordId);
  }

  @Transactional(readOnly = true)
  public List<RecordParameter> parameters(UUID recordId) {
    return recordParameterRepository.findByRecordId(recordId);
  }

  @Transactional
  public SampleRecord create(SampleRecordRequest request) {
    validateYearRange(request.minYear(), request.maxYear());
    var geo = GeoFields.of(request.wkt());
    geo.updateUncertainty(request.error(), request.elevation(), request.elevationError());
    var record = new SampleRecord(request.name(), request.medium(), request.type(), geo);
    record.update(
        request.name(),
        request.dateCollected(),
        request.description(),
        request.medium(),
        request.type(),
        request.resolution());
    record.updateYearRange(request.minYear(), request.maxYear());
    record.linkFeature(requireFeature(request.featureId()));
    record = recordRepository.save(record);

    log.info("Created record: id={}, name={}", record.getId(), record.getName());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("record.created")
            .entityType("record")
            .entityId(record.getId())
            .details(Map.of("after", snapshot(record)))
            .build());
    return record;
  }

  @Transactional
  public SampleRecord update(UUID id, SampleRecordRequest request) {
    var record = get(id);
    var before = snapshot(record);
    validateYearRange(request.minYear(), request.maxYear());
    record.getGeo().updateWkt(request.wkt());
    record
        .getGeo()
        .updateUncertainty(request.error(), request.elevation(), request.elevationError());
    record.update(
        request.name(),
        request.dateCollected(),
        request.description(),
        request.medium(),
        request.type(),
        request.resolution());
    record.updateYearRange(request.minYear(), request.maxYear());
    record.linkFeature(requireFeature(request.featureId()));
    record = recordRepository.save(record);

    log.info("Updated record: id={}, name={}", record.getId(), record.getName());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("record.updated")
            .entityType("record")
            .entityId(record.getId())
            .details(Map.of("before", before, "after", snapshot(record)))
            .build());
    return record;
  }

  @Transactional
  public void delete(UUID id) {
    var record = get(id);
    var before = snapshot(record);
    authorshipRepository.deleteByRecordId(id);
    referenceRepository.deleteByRecordId(id);
    recordParameterRepository.deleteByRecordId(id);
    annotationService.deleteAll(AnnotationOwner.record(id));
    recordRepository.deleteById(id);

    log.info("Deleted record: id={}", id);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("record.deleted")
            .entityType("record")
            .entityId(id)
            .details(Map.of("before", before))
            .build());
  }

  /** Replaces the record's authorships; list position becomes the order. */
  @Transactional
  public List<RecordAuthorship> replaceAuthorships(
      UUID recordId, List<RecordAuthorshipRequest> authorships) {
    get(recordId);
    List<RecordAuthorship> rows = new ArrayList<>();
    for (int i = 0; i < authorships.size(); i++) {
      var request = authorships.get(i);
      if (!personRepository.existsById(request.personId())) {
        throw new ResourceNotFoundException("Person", request.personId());
      }
      rows.add(new RecordAuthorship(recordId, request.personId(), request.role(), i));
    }
    authorshipRepository.deleteByRecordId(recordId);
    var saved = authorshipRepository.saveAll(rows);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("record.authorships_replaced")
            .entityType("record")
            .entityId(recordId)
            .details(
                Map.of(
                    "authorships",
                    saved.stream()
                        .map(a -> a.getRole().name() + ":" + a.getPersonId())
                        .toList()))
            .build());
    return saved;
  }

  @Transactional
  public RecordReference addReference(UUID recordId, UUID publicationId, ReferenceType type) {
    get(recordId);
    if (!publicationRepository.existsById(publicationId)) {
      throw new ResourceNotFoundException("Publication", publicationId);
    }
    boolean exists =
        referenceRepository.existsByRecordIdAndPublicationIdAndType(recordId, publicationId, type);
    if (exists) {
      throw new ResourceConflictException(
          "Duplicate reference", "The record already " + type.label() + " this publication");
    }
    var reference = referenceRepository.save(new RecordReference(recordId, publicationId, type));

    log.info(
        "Added record reference: record={}, publication={}, type={}",
        recordId,
        publicationId,
        type);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("record.reference_added")
            .entityType("record")
            .entityId(recordId)
            .details(Map.of("publication_id", publicationId.toString(), "type", type.name()))
            .build());
    return reference;
  }

  @Transactional
  public void removeReference(UUID recordId, UUID referenceId) {
    var reference =
        referenceRepository
            .findById(referenceId)
            .filter(r -> r.getRecordId().equals(recordId))
            .orElseThrow(() -> new ResourceNotFoundException("Record reference", referenceId));
    referenceRepository.delete(reference);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("record.reference_removed")
            .entityType("record")
            .entityId(recordId)
            .details(
                Map.of(
                    "publication_id",
                    reference.getPublicationId().toString(),
                    "type",
                    reference.getType().name()))
            .build());
  }

  /** Adds the parameter to the record, or updates its units and summary when already present. */
  @Transactional
  public RecordParameter setParameter(UUID recordId, RecordParameterRequest request) {
    get(recordId);
    if (!parameterRepository.existsById(request.parameterId())) {
      throw new ResourceNotFoundException("Parameter", request.parameterId());
    }
    if (request.minValue() != null
        && request.maxValue() != null
        && request.minValue() > request.maxValue()) {
      throw new ValidationException(
          "Invalid parameter summary", "Minimum value must not exceed maximum value");
    }
    var row =
        recordParameterRepository
            .findByRecordIdAndParameterId(recordId, request.parameterId())
            .orElseGet(
                () -> new RecordParameter(recordId, request.parameterId(), request.units()));
    row.updateSummary(
        request.nValues(), request.minValue(), request.maxValue(), request.meanValue());
    row.updateUnits(request.units());
    row = recordParameterRepository.save(row);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("record.parameter_set")
            .entityType("record")
            .entityId(recordId)
            .details(
                Map.of(
                    "parameter_id",
                    request.parameterId().toString(),
                    "units",
                    row.getUnits() != null ? row.getUnits() : ""))
            .build());
    return row;
  }

  private UUID requireFeature(UUID featureId) {
    if (featureId != null && !featureRepository.existsById(featureId)) {
      throw new ResourceNotFoundException("Feature", featureId);
    }
    return featureId;
  }

  static void validateYearRange(Double minYear, Double maxYear) {
    if (minYear != null && maxYear != null && minYear > maxYear) {
      throw new ValidationException(
          "Invalid year range", "Minimum year " + minYear + " is after maximum year " + maxYear);
    }
  }

  private static Map<String, Object> snapshot(SampleRecord record) {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("name", record.getName());
    snapshot.put(
        "date_collected",
        record.getDateCollected() != null ? record.getDateCollected().toString() : "");
    snapshot.put("medium", record.getMedium().name());
    snapshot.put("type", record.getType().name());
    snapshot.put("wkt", record.getGeo().getWkt());
    snapshot.put(
        "feature_id", record.getFeatureId() != null ? record.getFeatureId().toString() : "");
    return snapshot;
  }
}
