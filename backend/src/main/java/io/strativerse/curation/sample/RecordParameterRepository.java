package io.strativerse.curation.sample;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecordParameterRepository extends JpaRepository<RecordParameter, UUID> {

  List<RecordParameter> findByRecordId(UUID recordId);

  Optional<RecordParameter> findByRecordIdAndParameterId(UUID recordId, UUID parameterId);

  long countByParameterId(UUID parameterId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM RecordParameter rp WHERE rp.recordId = :recordId")
  void deleteByRecordId(@Param("recordId") UUID recordId);
}
