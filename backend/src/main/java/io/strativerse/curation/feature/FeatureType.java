package io.strativerse.curation.feature;

public enum FeatureType {
  WATER_BODY,
  GLACIER,
  BOG,
  GEOPOLITICAL_UNIT,
  REGION
}
