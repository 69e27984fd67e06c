package io.strativerse.curation.geometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.strativerse.curation.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class WktTest {

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "POINT (1 2)|POINT",
        "POINT (-71.064544 42.28787)|POINT",
        "LINESTRING (30 10, 10 30, 40 40)|LINESTRING",
        "POLYGON ((30 10, 40 40, 20 40, 10 20, 30 10))|POLYGON",
        "POLYGON ((35 10, 45 45, 15 40, 10 20, 35 10), (20 30, 35 35, 30 20, 20 30))|POLYGON",
        "MULTIPOINT ((10 40), (40 30), (20 20), (30 10))|MULTIPOINT",
        "MULTIPOINT (10 40, 40 30, 20 20, 30 10)|MULTIPOINT",
        "MULTILINESTRING ((10 10, 20 20, 10 40), (40 40, 30 30, 40 20, 30 10))|MULTILINESTRING",
        "MULTIPOLYGON (((30 20, 45 40, 10 40, 30 20)), ((15 5, 40 10, 10 20, 5 10, 15 5)))"
            + "|MULTIPOLYGON"
      })
  void identifyGeometry_recognisesEachType(String wkt, GeometryType expected) {
    assertThat(Wkt.identifyGeometry(wkt)).contains(expected);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "POINT 1 2",
        "POINT (1)",
        "CIRCLE (1 2)",
        "LINESTRING (0 0, 4 4",
        "POLYGON (30 10, 40 40)",
        "POINT (1 2) trailing"
      })
  void identifyGeometry_rejectsMalformedText(String wkt) {
    assertThat(Wkt.identifyGeometry(wkt)).isEmpty();
  }

  @Test
  void identifyGeometry_blankIsEmptyGeometry() {
    assertThat(Wkt.identifyGeometry("")).contains(GeometryType.EMPTY);
    assertThat(Wkt.identifyGeometry("   ")).contains(GeometryType.EMPTY);
    assertThat(Wkt.identifyGeometry(null)).contains(GeometryType.EMPTY);
  }

  @Test
  void validate_throwsOnInvalidText() {
    assertThatThrownBy(() -> Wkt.validate("POINT (a b)"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("not valid well-known text");
  }

  @Test
  void bounds_ofEmptyTextAreAllNull() {
    var bounds = Wkt.bounds("");

    assertThat(bounds.isEmpty()).isTrue();
    assertThat(bounds.xmin()).isNull();
    assertThat(bounds.xmax()).isNull();
    assertThat(bounds.ymin()).isNull();
    assertThat(bounds.ymax()).isNull();
  }

  @Test
  void bounds_ofPointCollapseToThePoint() {
    assertThat(Wkt.bounds("POINT (1 2)")).isEqualTo(new WktBounds(1.0, 1.0, 2.0, 2.0));
  }

  @Test
  void bounds_ofLineStringSpanItsCoordinates() {
    assertThat(Wkt.bounds("LINESTRING (0 0, 4 4)")).isEqualTo(new WktBounds(0.0, 4.0, 0.0, 4.0));
  }

  @Test
  void bounds_coverEveryRingOfAPolygon() {
    var bounds = Wkt.bounds("POLYGON ((0 0, 10 0, 10 10, 0 0), (-5.5 2, 3 -7, 1 1, -5.5 2))");

    assertThat(bounds).isEqualTo(new WktBounds(-5.5, 10.0, -7.0, 10.0));
  }

  @Test
  void bounds_areComputedEvenWhenTheGeometryIsInvalid() {
    assertThat(Wkt.identifyGeometry("SHAPE (3 4, 5 6)")).isEmpty();
    assertThat(Wkt.bounds("SHAPE (3 4, 5 6)")).isEqualTo(new WktBounds(3.0, 5.0, 4.0, 6.0));
  }
}
