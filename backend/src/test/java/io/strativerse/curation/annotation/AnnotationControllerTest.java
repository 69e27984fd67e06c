package io.strativerse.curation.annotation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.strativerse.curation.exception.GlobalExceptionHandler;
import io.strativerse.curation.exception.ResourceConflictException;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AnnotationControllerTest {

  private static final UUID PERSON_ID = UUID.randomUUID();

  @Mock private AnnotationService annotationService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new AnnotationController(annotationService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void attachTag_returnsCreatedTag() throws Exception {
    var owner = AnnotationOwner.person(PERSON_ID);
    when(annotationService.attachTag(owner, "note", "lab", "GFZ", null))
        .thenReturn(new Tag(owner, "note", "lab", "GFZ", null));

    mockMvc
        .perform(
            post("/api/annotations/person/{id}/tags", PERSON_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "note", "key": "lab", "value": "GFZ"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(
            header().string("Location", "/api/annotations/person/" + PERSON_ID + "/tags/note/lab"))
        .andExpect(jsonPath("$.key").value("lab"))
        .andExpect(jsonPath("$.value").value("GFZ"));
  }

  @Test
  void attachTag_duplicateIsConflict() throws Exception {
    when(annotationService.attachTag(
            eq(AnnotationOwner.person(PERSON_ID)), eq("note"), eq("lab"), any(), isNull()))
        .thenThrow(new ResourceConflictException("Duplicate tag", "A note tag already exists"));

    mockMvc
        .perform(
            post("/api/annotations/person/{id}/tags", PERSON_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "note", "key": "lab", "value": "AWI"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Duplicate tag"));
  }

  @Test
  void attachTag_missingKeyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/annotations/person/{id}/tags", PERSON_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "note", "value": "GFZ"}
                    """))
        .andExpect(status().isBadRequest());
    verify(annotationService, never()).attachTag(any(), any(), any(), any(), any());
  }

  @Test
  void listTags_unknownKindIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/annotations/spaceship/{id}/tags", PERSON_ID))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Unknown entity kind"));
  }

  @Test
  void listTags_filtersByType() throws Exception {
    var owner = AnnotationOwner.feature(PERSON_ID);
    when(annotationService.listTags(owner, "meta"))
        .thenReturn(List.of(new Tag(owner, "meta", "volume", "12", null)));

    mockMvc
        .perform(get("/api/annotations/feature/{id}/tags", PERSON_ID).param("type", "meta"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].key").value("volume"));
  }

  @Test
  void deleteTag_returnsNoContent() throws Exception {
    mockMvc
        .perform(delete("/api/annotations/person/{id}/tags/note/lab", PERSON_ID))
        .andExpect(status().isNoContent());
    verify(annotationService).deleteTag(AnnotationOwner.person(PERSON_ID), "note", "lab");
  }
}
