package io.strativerse.curation.sample;

public enum RecordRole {
  ASSISTED,
  COLLECTED,
  FUNDED,
  ANALYZED,
  PUBLISHED,
  MAINTAINS
}
