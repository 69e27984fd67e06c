package io.strativerse.curation.geometry;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.strativerse.curation.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class GeometryControllerTest {

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new GeometryController())
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void identify_returnsTypeAndBounds() throws Exception {
    mockMvc
        .perform(
            post("/api/geometry/identify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"wkt": "LINESTRING (0 0, 4 4)"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(true))
        .andExpect(jsonPath("$.type").value("LINESTRING"))
        .andExpect(jsonPath("$.bounds.xmin").value(0.0))
        .andExpect(jsonPath("$.bounds.xmax").value(4.0))
        .andExpect(jsonPath("$.bounds.ymax").value(4.0));
  }

  @Test
  void identify_reportsInvalidTextWithoutFailing() throws Exception {
    mockMvc
        .perform(
            post("/api/geometry/identify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"wkt": "TRIANGLE (1 2, 3 4)"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(false))
        .andExpect(jsonPath("$.bounds.xmin").value(1.0))
        .andExpect(jsonPath("$.bounds.ymax").value(4.0));
  }
}
