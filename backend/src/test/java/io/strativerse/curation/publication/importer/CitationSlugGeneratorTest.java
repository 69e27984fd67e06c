package io.strativerse.curation.publication.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.publication.PublicationRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CitationSlugGeneratorTest {

  @Mock private PublicationRepository publicationRepository;
  @InjectMocks private CitationSlugGenerator generator;

  @Test
  void generate_singleAuthor() {
    assertThat(generator.generate(List.of("Smith"), 2019, "Varves", null)).isEqualTo("smith19");
  }

  @Test
  void generate_appendsLetterWhenTaken() {
    takenSlugs(Set.of("smith19"));

    assertThat(generator.generate(List.of("Smith"), 2019, "Varves", null)).isEqualTo("smith19a");
  }

  @Test
  void generate_skipsEveryTakenLetter() {
    takenSlugs(Set.of("smith19", "smith19a", "smith19b"));

    assertThat(generator.generate(List.of("Smith"), 2019, "Varves", null)).isEqualTo("smith19c");
  }

  @Test
  void generate_ignoresThePublicationBeingReslugged() {
    var id = UUID.randomUUID();
    when(publicationRepository.existsBySlugAndIdNot(anyString(), eq(id))).thenReturn(false);

    assertThat(generator.generate(List.of("Smith"), 2019, "Varves", id)).isEqualTo("smith19");
    verify(publicationRepository, never()).existsBySlug(anyString());
  }

  @Test
  void generate_failsWhenAllLettersAreTaken() {
    when(publicationRepository.existsBySlug(anyString())).thenReturn(true);

    assertThatThrownBy(() -> generator.generate(List.of("Smith"), 2019, "Varves", null))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("smith19");
  }

  @Test
  void baseSlug_twoAuthors() {
    assertThat(CitationSlugGenerator.baseSlug(List.of("Smith", "Jones"), 2019, "t"))
        .isEqualTo("smith_and_jones19");
  }

  @Test
  void baseSlug_threeOrMoreAuthors() {
    assertThat(CitationSlugGenerator.baseSlug(List.of("Smith", "Jones", "Ng"), 2019, "t"))
        .isEqualTo("smith_etal19");
  }

  @Test
  void baseSlug_stripsDiacriticsAndSpaces() {
    assertThat(CitationSlugGenerator.baseSlug(List.of("Müller"), 1987, "t"))
        .isEqualTo("muller87");
    assertThat(CitationSlugGenerator.baseSlug(List.of("De La Cruz"), 2005, "t"))
        .isEqualTo("delacruz05");
  }

  @Test
  void baseSlug_withoutAuthorsUsesFirstTitleWord() {
    assertThat(CitationSlugGenerator.baseSlug(List.of(), 2021, "Ébauche d'une carte"))
        .isEqualTo("ebauche21");
    assertThat(CitationSlugGenerator.baseSlug(List.of(), 2021, "")).isEqualTo("anon21");
  }

  @Test
  void baseSlug_leavesRoomForDisambiguationLetter() {
    var slug = CitationSlugGenerator.baseSlug(List.of("a".repeat(80)), 2019, "t");

    assertThat(slug).hasSize(54).endsWith("19");
  }

  private void takenSlugs(Set<String> taken) {
    var slugs = new HashSet<>(taken);
    when(publicationRepository.existsBySlug(anyString()))
        .thenAnswer(invocation -> slugs.contains(invocation.<String>getArgument(0)));
  }
}
