package io.strativerse.curation.sample;

public enum RecordMedium {
  LAKE_SEDIMENT,
  MARINE_SEDIMENT,
  PEAT,
  GLACIER_ICE,
  SPELEOTHEM,
  TREE,
  OTHER
}
