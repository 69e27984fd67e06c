package io.strativerse.curation.sample;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SampleRecordRepository extends JpaRepository<SampleRecord, UUID> {

  List<SampleRecord> findByFeatureIdOrderByDateCollectedAsc(UUID featureId);

  long countByFeatureId(UUID featureId);
}
