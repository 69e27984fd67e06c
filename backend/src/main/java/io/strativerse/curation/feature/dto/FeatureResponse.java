package io.strativerse.curation.feature.dto;

import io.strativerse.curation.feature.Feature;
import io.strativerse.curation.geometry.GeometryType;
import io.strativerse.curation.geometry.WktBounds;
import java.util.Locale;
import java.util.UUID;

public record FeatureResponse(
    UUID id,
    String name,
    String type,
    UUID parentId,
    int recursiveDepth,
    String wkt,
    GeometryType geometryType,
    WktBounds bounds) {

  public static FeatureResponse from(Feature feature) {
    return new FeatureResponse(
        feature.getId(),
        feature.getName(),
        feature.getType().name().toLowerCase(Locale.ROOT),
        feature.getParentId(),
        feature.getRecursiveDepth(),
        feature.getGeo().getWkt(),
        feature.getGeo().getGeometryType(),
        feature.getGeo().getBounds());
  }
}
