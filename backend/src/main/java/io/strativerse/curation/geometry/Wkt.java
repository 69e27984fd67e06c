package io.strativerse.curation.geometry;

import io.strativerse.curation.exception.ValidationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Well-known text recognition and bounds extraction. The grammar is regular: each geometry keyword
 * wraps a parenthesised list of coordinate pairs, rings, or polygons.
 *
 * <p>Identification and bounds are independent. {@link #bounds(String)} only looks for coordinate
 * pairs and works on text that {@link #identifyGeometry(String)} rejects.
 */
public final class Wkt {

  static final String NUMBER = "[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?";

  static final String COORDINATE = "\\s*(" + NUMBER + ")\\s+(" + NUMBER + ")\\s*";

  private static final String COORDINATE_NC = "\\s*" + NUMBER + "\\s+" + NUMBER + "\\s*";

  private static final String COORDINATES =
      "\\((?:" + COORDINATE_NC + ")(?:," + COORDINATE_NC + ")*\\)";

  private static final String POINT_COORDINATE = "\\s*\\(" + COORDINATE_NC + "\\s*\\)";

  private static final String MULTIPOINT_COORDINATES =
      "\\((?:" + POINT_COORDINATE + ")(?:," + POINT_COORDINATE + ")*\\)";

  private static final String POLYGON_COORDINATES =
      "\\(\\s*" + COORDINATES + "\\s*(?:,\\s*" + COORDINATES + "\\s*)*\\)";

  private static final Pattern COORDINATE_PATTERN = Pattern.compile(COORDINATE);

  /** Checked in declaration order; the first full match wins. */
  private static final Map<GeometryType, Pattern> GRAMMAR = new LinkedHashMap<>();

  static {
    GRAMMAR.put(GeometryType.POINT, Pattern.compile("POINT\\s+\\(" + COORDINATE_NC + "\\)"));
    GRAMMAR.put(GeometryType.LINESTRING, Pattern.compile("LINESTRING\\s+" + COORDINATES));
    GRAMMAR.put(GeometryType.POLYGON, Pattern.compile("POLYGON\\s+" + POLYGON_COORDINATES));
    GRAMMAR.put(
        GeometryType.MULTIPOINT,
        Pattern.compile("MULTIPOINT\\s+(?:" + MULTIPOINT_COORDINATES + "|" + COORDINATES + ")"));
    GRAMMAR.put(
        GeometryType.MULTILINESTRING, Pattern.compile("MULTILINESTRING\\s+" + POLYGON_COORDINATES));
    GRAMMAR.put(
        GeometryType.MULTIPOLYGON,
        Pattern.compile(
            "MULTIPOLYGON\\s+\\(\\s*"
                + POLYGON_COORDINATES
                + "\\s*(?:,\\s*"
                + POLYGON_COORDINATES
                + "\\s*)*\\)"));
  }

  private Wkt() {}

  /**
   * Identifies the geometry type of a WKT string.
   *
   * @return {@link GeometryType#EMPTY} for null or blank input, the matching type when the whole
   *     string matches one geometry production, or empty when the text is not valid WKT
   */
  public static Optional<GeometryType> identifyGeometry(String text) {
    if (text == null || text.isBlank()) {
      return Optional.of(GeometryType.EMPTY);
    }
    for (var entry : GRAMMAR.entrySet()) {
      if (entry.getValue().matcher(text).matches()) {
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  /**
   * @throws ValidationException if the text is neither blank nor a recognised geometry
   */
  public static GeometryType validate(String text) {
    return identifyGeometry(text)
        .orElseThrow(
            () ->
                new ValidationException(
                    "Invalid geometry", "The value is not valid well-known text"));
  }

  /** Min/max over every coordinate pair anywhere in the text, geometry type notwithstanding. */
  public static WktBounds bounds(String text) {
    if (text == null || text.isEmpty()) {
      return WktBounds.empty();
    }
    Matcher matcher = COORDINATE_PATTERN.matcher(text);
    double xmin = Double.POSITIVE_INFINITY;
    double xmax = Double.NEGATIVE_INFINITY;
    double ymin = Double.POSITIVE_INFINITY;
    double ymax = Double.NEGATIVE_INFINITY;
    int found = 0;
    while (matcher.find()) {
      double x = Double.parseDouble(matcher.group(1));
      double y = Double.parseDouble(matcher.group(2));
      xmin = Math.min(xmin, x);
      xmax = Math.max(xmax, x);
      ymin = Math.min(ymin, y);
      ymax = Math.max(ymax, y);
      found++;
    }
    if (found == 0) {
      return WktBounds.empty();
    }
    return new WktBounds(xmin, xmax, ymin, ymax);
  }
}
