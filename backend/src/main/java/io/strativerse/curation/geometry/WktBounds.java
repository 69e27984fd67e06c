package io.strativerse.curation.geometry;

/**
 * Bounding box of the coordinates found in a WKT string. All four values are null when the text
 * contains no coordinate.
 */
public record WktBounds(Double xmin, Double xmax, Double ymin, Double ymax) {

  private static final WktBounds EMPTY = new WktBounds(null, null, null, null);

  public static WktBounds empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return xmin == null;
  }
}
