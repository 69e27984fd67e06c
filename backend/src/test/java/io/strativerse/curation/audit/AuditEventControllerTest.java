package io.strativerse.curation.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AuditEventControllerTest {

  @Mock private AuditService auditService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new AuditEventController(auditService)).build();
  }

  @Test
  void listAuditEventsByEntity_filtersOnPathAndCapsPageSize() throws Exception {
    var personId = UUID.randomUUID();
    var event =
        new AuditEvent(
            new AuditEventRecord(
                "person.combined", "person", personId, "alice", "dupes", Map.of("moved", 2)));
    when(auditService.findEvents(any(), any()))
        .thenReturn(new PageImpl<>(List.of(event), PageRequest.of(0, 200), 1));

    mockMvc
        .perform(
            get("/api/audit-events/person/{id}", personId)
                .param("eventType", "person.")
                .param("size", "1000"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content[0].eventType").value("person.combined"))
        .andExpect(jsonPath("$.content[0].actor").value("alice"))
        .andExpect(jsonPath("$.content[0].details.moved").value(2))
        .andExpect(jsonPath("$.page.size").value(200))
        .andExpect(jsonPath("$.page.totalElements").value(1));

    var pageable = ArgumentCaptor.forClass(Pageable.class);
    verify(auditService)
        .findEvents(
            eq(new AuditEventFilter("person", personId, null, "person.")), pageable.capture());
    assertThat(pageable.getValue().getPageSize()).isEqualTo(200);
  }
}
