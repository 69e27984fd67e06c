package io.strativerse.curation.sample;

public enum RecordType {
  SEDIMENT_CORE,
  ICE_CORE,
  PEAT_CORE,
  OUTCROP,
  OTHER
}
