package io.strativerse.curation.audit;

import static org.assertj.core.api.Assertions.assertThat;

import io.strativerse.curation.ServiceLayerTestConfiguration;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

@DataJpaTest
@Import(ServiceLayerTestConfiguration.class)
class DatabaseAuditServiceIntegrationTest {

  private static final UUID PERSON_ID = UUID.randomUUID();

  @Autowired private AuditService auditService;

  @BeforeEach
  void setUp() {
    auditService.log(event("person.created", "person", PERSON_ID, "alice"));
    auditService.log(event("person.combined", "person", PERSON_ID, "bob"));
    auditService.log(event("feature.created", "feature", UUID.randomUUID(), "alice"));
  }

  @Test
  void findEvents_withoutFilterReturnsEverything() {
    var page = auditService.findEvents(new AuditEventFilter(null, null, null, null), firstPage());

    assertThat(page.getTotalElements()).isEqualTo(3);
  }

  @Test
  void findEvents_matchesEventTypePrefix() {
    var page =
        auditService.findEvents(new AuditEventFilter(null, null, null, "person."), firstPage());

    assertThat(page.getContent())
        .extracting(AuditEvent::getEventType)
        .containsExactlyInAnyOrder("person.created", "person.combined");
  }

  @Test
  void findEvents_combinesEntityAndActorFilters() {
    var page =
        auditService.findEvents(
            new AuditEventFilter("person", PERSON_ID, "bob", null), firstPage());

    assertThat(page.getContent())
        .singleElement()
        .extracting(AuditEvent::getEventType)
        .isEqualTo("person.combined");
  }

  private static AuditEventRecord event(
      String eventType, String entityType, UUID entityId, String actor) {
    return AuditEventBuilder.builder()
        .eventType(eventType)
        .entityType(entityType)
        .entityId(entityId)
        .actor(actor)
        .details(Map.of("source", "test"))
        .build();
  }

  private static PageRequest firstPage() {
    return PageRequest.of(0, 50);
  }
}
