package io.strativerse.curation.feature;

import io.strativerse.curation.annotation.AnnotationOwner;
import io.strativerse.curation.annotation.AnnotationService;
import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceConflictException;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.feature.dto.FeatureRequest;
import io.strativerse.curation.geometry.GeoFields;
import io.strativerse.curation.sample.SampleRecordRepository;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Features and their hierarchy. A feature's depth is the length of its parent chain; whenever a
 * parent link changes the depth of the whole subtree is recomputed in the same transaction.
 */
@Service
public class FeatureService {

  private static final Logger log = LoggerFactory.getLogger(FeatureService.class);

  private final FeatureRepository featureRepository;
  private final SampleRecordRepository sampleRecordRepository;
  private final AnnotationService annotationService;
  private final AuditService auditService;

  public FeatureService(
      FeatureRepository featureRepository,
      SampleRecordRepository sampleRecordRepository,
      AnnotationService annotationService,
      AuditService auditService) {
    this.featureRepository = featureRepository;
    this.sampleRecordRepository = sampleRecordRepository;
    this.annotationService = annotationService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public Feature get(UUID id) {
    return featureRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Feature", id));
  }

  @Transactional(readOnly = true)
  public List<Feature> children(UUID id) {
    return featureRepository.findByParentIdOrderByNameAsc(id);
  }

  /** Parent, grandparent and so on up to the root. */
  @Transactional(readOnly = true)
  public List<Feature> ancestors(UUID id) {
    var feature = get(id);
    List<Feature> ancestors = new ArrayList<>();
    Set<UUID> seen = new HashSet<>();
    seen.add(feature.getId());
    UUID parentId = feature.getParentId();
    while (parentId != null) {
      if (!seen.add(parentId)) {
        throw new ValidationException("Invalid feature hierarchy", "Parent chain contains a cycle");
      }
      var parent = get(parentId);
      ancestors.add(parent);
      parentId = parent.getParentId();
    }
    return ancestors;
  }

  @Transactional
  public Feature create(FeatureRequest request) {
    var geo = GeoFields.of(request.wkt());
    geo.updateUncertainty(request.error(), request.elevation(), request.elevationError());
    var feature = new Feature(request.name(), request.type(), geo);
    if (request.parentId() != null) {
      feature.placeUnder(request.parentId(), depthUnder(request.parentId()));
    }
    feature = featureRepository.save(feature);

    log.info(
        "Created feature: id={}, name={}, depth={}",
        feature.getId(),
        feature.getName(),
        feature.getRecursiveDepth());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("feature.created")
            .entityType("feature")
            .entityId(feature.getId())
            .details(Map.of("after", snapshot(feature)))
            .build());
    return feature;
  }

  @Transactional
  public Feature update(UUID id, FeatureRequest request) {
    var feature = get(id);
    var before = snapshot(feature);

    feature.update(request.name(), request.type());
    feature.getGeo().updateWkt(request.wkt());
    feature
        .getGeo()
        .updateUncertainty(request.error(), request.elevation(), request.elevationError());

    int cascaded = 0;
    if (!Objects.equals(feature.getParentId(), request.parentId())) {
      int depth = 0;
      if (request.parentId() != null) {
        rejectCycle(id, request.parentId());
        depth = depthUnder(request.parentId());
      }
      feature.placeUnder(request.parentId(), depth);
      feature = featureRepository.save(feature);
      cascaded = cascadeDepth(feature);
    } else {
      feature = featureRepository.save(feature);
    }

    log.info(
        "Updated feature: id={}, depth={}, descendantsUpdated={}",
        feature.getId(),
        feature.getRecursiveDepth(),
        cascaded);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("feature.updated")
            .entityType("feature")
            .entityId(feature.getId())
            .details(Map.of("before", before, "after", snapshot(feature)))
            .build());
    return feature;
  }

  @Transactional
  public void delete(UUID id) {
    var feature = get(id);
    long children = featureRepository.countByParentId(id);
    long records = sampleRecordRepository.countByFeatureId(id);
    if (children > 0 || records > 0) {
      throw new ResourceConflictException(
          "Feature in use",
          feature.getName()
              + " has "
              + children
              + " child feature(s) and "
              + records
              + " record(s)");
    }
    var before = snapshot(feature);
    annotationService.deleteAll(AnnotationOwner.feature(id));
    featureRepository.delete(feature);

    log.info("Deleted feature: id={}", id);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("feature.deleted")
            .entityType("feature")
            .entityId(id)
            .details(Map.of("before", before))
            .build());
  }

  /** Depth of a child placed under {@code parentId}, from the live parent chain. */
  private int depthUnder(UUID parentId) {
    int depth = 1;
    Set<UUID> seen = new HashSet<>();
    var current = get(parentId);
    while (current.getParentId() != null) {
      if (!seen.add(current.getId())) {
        throw new ValidationException("Invalid feature hierarchy", "Parent chain contains a cycle");
      }
      current = get(current.getParentId());
      depth++;
    }
    return depth;
  }

  private void rejectCycle(UUID featureId, UUID newParentId) {
    if (featureId.equals(newParentId)) {
      throw new ValidationException("Invalid parent", "A feature cannot be its own parent");
    }
    UUID cursor = newParentId;
    Set<UUID> seen = new HashSet<>();
    while (cursor != null && seen.add(cursor)) {
      if (cursor.equals(featureId)) {
        throw new ValidationException(
            "Invalid parent", "The new parent is a descendant of this feature");
      }
      cursor = get(cursor).getParentId();
    }
  }

  /** Recomputes descendant depths breadth-first. Returns the number of descendants visited. */
  private int cascadeDepth(Feature root) {
    int updated = 0;
    var queue = new ArrayDeque<Feature>();
    queue.add(root);
    while (!queue.isEmpty()) {
      var parent = queue.poll();
      for (Feature child : featureRepository.findByParentIdOrderByNameAsc(parent.getId())) {
        child.refreshDepth(parent.getRecursiveDepth() + 1);
        featureRepository.save(child);
        queue.add(child);
        updated++;
      }
    }
    return updated;
  }

  private static Map<String, Object> snapshot(Feature feature) {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("name", feature.getName());
    snapshot.put("type", feature.getType().name());
    snapshot.put("wkt", feature.getGeo().getWkt());
    snapshot.put(
        "parent_id", feature.getParentId() != null ? feature.getParentId().toString() : "");
    snapshot.put("recursive_depth", feature.getRecursiveDepth());
    return snapshot;
  }
}
