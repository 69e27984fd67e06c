package io.strativerse.curation.parameter;

import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceConflictException;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.parameter.dto.ParameterRequest;
import io.strativerse.curation.sample.RecordParameterRepository;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ParameterService {

  private static final Logger log = LoggerFactory.getLogger(ParameterService.class);

  private final ParameterRepository parameterRepository;
  private final RecordParameterRepository recordParameterRepository;
  private final AnnotationService annotationService;
  private final AuditService auditService;

  public ParameterService(
      ParameterRepository parameterRepository,
      RecordParameterRepository recordParameterRepository,
      AnnotationService annotationService,
      AuditService auditService) {
    this.parameterRepository = parameterRepository;
    this.recordParameterRepository = recordParameterRepository;
    this.annotationService = annotationService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<Parameter> listAll() {
    return parameterRepository.findAllByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public Parameter get(UUID id) {
    return parameterRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Parameter", id));
  }

  @Transactional(readOnly = true)
  public Parameter getBySlug(String slug) {
    return parameterRepository
        .findBySlug(slug)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Parameter not found", "No parameter found with slug " + slug));
  }

  @Transactional
  public Parameter create(ParameterRequest request) {
    String baseSlug =
        request.slug() != null && !request.slug().isBlank()
            ? request.slug()
            : Parameter.generateSlug(request.name());
    String finalSlug = resolveUniqueSlug(baseSlug);

    var parameter = new Parameter(request.name(), finalSlug);
    parameter.updateMetadata(
        request.name(), request.description(), request.preparation(), request.instrumentation());
    try {
      parameter = parameterRepository.saveAndFlush(parameter);
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate slug", "A parameter with slug '" + finalSlug + "' already exists");
    }

    log.info(
        "Created parameter: id={}, name={}, slug={}",
        parameter.getId(),
        parameter.getName(),
        parameter.getSlug());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("parameter.created")
            .entityType("parameter")
            .entityId(parameter.getId())
            .details(Map.of("name", parameter.getName(), "slug", parameter.getSlug()))
            .build());
    return parameter;
  }

  /** Updates descriptive fields. The slug is stable once assigned. */
  @Transactional
  public Parameter update(UUID id, ParameterRequest request) {
    var parameter = get(id);
    String oldName = parameter.getName();
    parameter.updateMetadata(
        request.name(), request.description(), request.preparation(), request.instrumentation());
    parameter = parameterRepository.save(parameter);

    log.info("Updated parameter: id={}, name={}", parameter.getId(), parameter.getName());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("parameter.updated")
            .entityType("parameter")
            .entityId(parameter.getId())
            .details(Map.of("name", Map.of("from", oldName, "to", parameter.getName())))
            .build());
    return parameter;
  }

  @Transactional
  public void delete(UUID id) {
    var parameter = get(id);
    long uses = recordParameterRepository.countByParameterId(id);
    if (uses > 0) {
      throw new ResourceConflictException(
          "Parameter in use", parameter.getName() + " is measured on " + uses + " record(s)");
    }
    annotationService.deleteAll(AnnotationOwner.parameter(id));
    parameterRepository.delete(parameter);

    log.info("Deleted parameter: id={}, slug={}", parameter.getId(), parameter.getSlug());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("parameter.deleted")
            .entityType("parameter")
            .entityId(id)
            .details(Map.of("slug", parameter.getSlug()))
            .build());
  }

  private String resolveUniqueSlug(String baseSlug) {
    String finalSlug = baseSlug;
    int suffix = 2;
    while (parameterRepository.existsBySlug(finalSlug)) {
      finalSlug = baseSlug + "_" + suffix;
      suffix++;
    }
    return finalSlug;
  }
}
