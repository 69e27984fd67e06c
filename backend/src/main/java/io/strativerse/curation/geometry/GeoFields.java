package io.strativerse.curation.geometry;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/**
 * Location capability embedded in entities that carry a WKT geometry. The bounding box and
 * geometry type are derived from {@code wkt} and only change through {@link #updateWkt(String)}.
 */
@Embeddable
public class GeoFields {

  @Column(name = "geo_wkt", columnDefinition = "TEXT")
  private String wkt;

  @Column(name = "geo_error", nullable = false)
  private double error;

  @Column(name = "geo_elev", nullable = false)
  private double elevation;

  @Column(name = "geo_elev_error", nullable = false)
  private double elevationError;

  @Column(name = "geo_xmin")
  private Double xmin;

  @Column(name = "geo_xmax")
  private Double xmax;

  @Column(name = "geo_ymin")
  private Double ymin;

  @Column(name = "geo_ymax")
  private Double ymax;

  @Enumerated(EnumType.STRING)
  @Column(name = "geo_type", length = 55)
  private GeometryType geometryType;

  protected GeoFields() {}

  /** Validates {@code wkt} and computes the derived cache. */
  public static GeoFields of(String wkt) {
    var geo = new GeoFields();
    geo.updateWkt(wkt);
    return geo;
  }

  public static GeoFields empty() {
    return of(null);
  }

  /**
   * Replaces the WKT text and recomputes bounds and geometry type.
   *
   * @throws io.strativerse.curation.exception.ValidationException if the text is not valid WKT
   */
  public void updateWkt(String wkt) {
    GeometryType type = Wkt.validate(wkt);
    WktBounds bounds = Wkt.bounds(wkt);
    this.wkt = wkt == null || wkt.isBlank() ? "" : wkt;
    this.geometryType = type;
    this.xmin = bounds.xmin();
    this.xmax = bounds.xmax();
    this.ymin = bounds.ymin();
    this.ymax = bounds.ymax();
  }

  public void updateUncertainty(double error, double elevation, double elevationError) {
    this.error = error;
    this.elevation = elevation;
    this.elevationError = elevationError;
  }

  public String getWkt() {
    return wkt;
  }

  public double getError() {
    return error;
  }

  public double getElevation() {
    return elevation;
  }

  public double getElevationError() {
    return elevationError;
  }

  public WktBounds getBounds() {
    return new WktBounds(xmin, xmax, ymin, ymax);
  }

  public GeometryType getGeometryType() {
    return geometryType;
  }
}
