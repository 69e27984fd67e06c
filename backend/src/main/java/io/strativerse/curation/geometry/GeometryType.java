package io.strativerse.curation.geometry;

/** Geometry kinds recognised by {@link Wkt#identifyGeometry(String)}. */
public enum GeometryType {
  EMPTY,
  POINT,
  LINESTRING,
  POLYGON,
  MULTIPOINT,
  MULTILINESTRING,
  MULTIPOLYGON
}
