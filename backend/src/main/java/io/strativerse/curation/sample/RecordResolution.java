package io.strativerse.curation.sample;

public enum RecordResolution {
  ANNUAL,
  DECADAL,
  CENTENNIAL,
  MILLENNIAL,
  IRREGULAR,
  UNKNOWN
}
