package io.strativerse.curation.sample;

public enum ReferenceType {
  REFERS_TO("refers to"),
  CONTAINS_DATA_FROM("contains data from");

  private final String label;

  ReferenceType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
