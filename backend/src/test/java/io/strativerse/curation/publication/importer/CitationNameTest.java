package io.strativerse.curation.publication.importer;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class CitationNameTest {

  @Test
  void parseBibtex_firstLast() {
    var name = CitationName.parseBibtex("John Smith");

    assertThat(name.given()).isEqualTo("John");
    assertThat(name.family()).isEqualTo("Smith");
    assertThat(name.alias()).isEqualTo("Smith, John");
  }

  @Test
  void parseBibtex_lastCommaFirst() {
    assertThat(CitationName.parseBibtex("Smith, John").alias()).isEqualTo("Smith, John");
  }

  @Test
  void parseBibtex_particleInFirstVonLastForm() {
    var name = CitationName.parseBibtex("Ludwig van Beethoven");

    assertThat(name.given()).isEqualTo("Ludwig");
    assertThat(name.particle()).isEqualTo("van");
    assertThat(name.family()).isEqualTo("Beethoven");
    assertThat(name.lastName()).isEqualTo("van Beethoven");
    assertThat(name.surname()).isEqualTo("Beethoven");
    assertThat(name.alias()).isEqualTo("van Beethoven, Ludwig");
  }

  @Test
  void parseBibtex_particleInVonLastFirstForm() {
    var name = CitationName.parseBibtex("van der Berg, Anna");

    assertThat(name.particle()).isEqualTo("van der");
    assertThat(name.family()).isEqualTo("Berg");
    assertThat(name.alias()).isEqualTo("van der Berg, Anna");
  }

  @Test
  void parseBibtex_suffix() {
    var name = CitationName.parseBibtex("Ford, Jr., Henry");

    assertThat(name.suffix()).isEqualTo("Jr.");
    assertThat(name.alias()).isEqualTo("Ford, Jr., Henry");
  }

  @Test
  void parseBibtex_singleWordIsFamilyName() {
    var name = CitationName.parseBibtex("Plato");

    assertThat(name.given()).isEmpty();
    assertThat(name.alias()).isEqualTo("Plato");
  }

  @Test
  void parseBibtex_fullyBracedNameIsLiteral() {
    var name = CitationName.parseBibtex("{Geological Survey of Canada}");

    assertThat(name.literal()).isEqualTo("Geological Survey of Canada");
    assertThat(name.alias()).isEqualTo("Geological Survey of Canada");
    assertThat(name.surname()).isEqualTo("Geological Survey of Canada");
  }

  @Test
  void parseBibtexList_splitsOnAndOutsideBraces() {
    var names =
        CitationName.parseBibtexList("Smith, John and Jane   Doe AND {Barnes and Noble}");

    assertThat(names)
        .extracting(CitationName::alias)
        .containsExactly("Smith, John", "Doe, Jane", "Barnes and Noble");
  }

  @Test
  void parseBibtexList_blankGivesNoNames() {
    assertThat(CitationName.parseBibtexList("  ")).isEmpty();
    assertThat(CitationName.parseBibtexList(null)).isEmpty();
  }

  @Test
  void parseBibtexList_decodesPartsAfterSplitting() {
    var names = CitationName.parseBibtexList("Smith, John", String::toUpperCase);

    assertThat(names.get(0).alias()).isEqualTo("SMITH, JOHN");
  }

  @Test
  void fromCsl_keepsNonDroppingParticleWithFamily() throws Exception {
    var node =
        new ObjectMapper()
            .readTree(
                """
                {"family": "Berg", "given": "Anna", "non-dropping-particle": "van der"}
                """);

    var name = CitationName.fromCsl(node);

    assertThat(name.lastName()).isEqualTo("van der Berg");
    assertThat(name.alias()).isEqualTo("van der Berg, Anna");
  }

  @Test
  void fromCsl_literalOverridesParts() throws Exception {
    var node = new ObjectMapper().readTree("{\"literal\": \"World Bank\"}");

    assertThat(CitationName.fromCsl(node).alias()).isEqualTo("World Bank");
  }

  @Test
  void constructor_stripsBracesAndCollapsesWhitespace() {
    var name = new CitationName(" J.  R. ", "", "{McDonald}", null, null);

    assertThat(name.alias()).isEqualTo("McDonald, J. R.");
  }
}
