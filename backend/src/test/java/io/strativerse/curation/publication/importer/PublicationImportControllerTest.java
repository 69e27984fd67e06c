package io.strativerse.curation.publication.importer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.strativerse.curation.exception.GlobalExceptionHandler;
import io.strativerse.curation.exception.ValidationException;
import io.strativerse.curation.publication.Publication;
import io.strativerse.curation.publication.PublicationService;
import io.strativerse.curation.publication.dto.PublicationResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PublicationImportControllerTest {

  @Mock private PublicationImportService importService;
  @Mock private PublicationService publicationService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new PublicationImportController(importService, publicationService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void importBibtex_returnsDescribedPublications() throws Exception {
    var publication = new Publication("smith2019varves", "Holocene varves", 2019);
    when(importService.importBibtex(anyString(), eq("alice")))
        .thenReturn(List.of(new ImportedItem(publication, true)));
    when(publicationService.describe(publication))
        .thenReturn(PublicationResponse.from(publication, "Smith 2019", List.of()));

    mockMvc
        .perform(
            post("/api/publications/import/bibtex")
                .header("X-Curator", "alice")
                .contentType(MediaType.TEXT_PLAIN)
                .content("@article{smith2019varves, year = {2019}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].slug").value("smith2019varves"))
        .andExpect(jsonPath("$[0].authorDateKey").value("Smith 2019"));
  }

  @Test
  void importCslJson_passesOptionsThrough() throws Exception {
    when(importService.importCslJson(
            anyString(), eq(false), any(), eq(10), eq(new CslImportOptions(true, false))))
        .thenReturn(List.of());

    mockMvc
        .perform(
            post("/api/publications/import/csl-json")
                .param("updateAuthors", "false")
                .param("regenerateSlugs", "true")
                .param("tagResidual", "false")
                .param("chunkSize", "10")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[]"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  void importCslJson_invalidSourceIsBadRequest() throws Exception {
    when(importService.importCslJson(anyString(), eq(true), any(), any(), any()))
        .thenThrow(new ValidationException("Invalid CSL-JSON", "Unexpected end-of-input"));

    mockMvc
        .perform(
            post("/api/publications/import/csl-json")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid CSL-JSON"));
  }
}
