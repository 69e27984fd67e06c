package io.strativerse.curation.sample;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecordAuthorshipRepository extends JpaRepository<RecordAuthorship, UUID> {

  @Query("SELECT ra FROM RecordAuthorship ra WHERE ra.recordId = :recordId ORDER BY ra.sortOrder")
  List<RecordAuthorship> findByRecordIdOrdered(@Param("recordId") UUID recordId);

  List<RecordAuthorship> findByPersonId(UUID personId);

  long countByPersonId(UUID personId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE RecordAuthorship ra SET ra.personId = :survivorId WHERE ra.personId = :loserId")
  int reassignPerson(@Param("loserId") UUID loserId, @Param("survivorId") UUID survivorId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM RecordAuthorship ra WHERE ra.recordId = :recordId")
  void deleteByRecordId(@Param("recordId") UUID recordId);
}
