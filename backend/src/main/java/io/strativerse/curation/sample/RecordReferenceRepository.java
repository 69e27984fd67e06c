package io.strativerse.curation.sample;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecordReferenceRepository extends JpaRepository<RecordReference, UUID> {

  List<RecordReference> findByRecordId(UUID recordId);

  List<RecordReference> findByPublicationId(UUID publicationId);

  boolean existsByRecordIdAndPublicationIdAndType(
      UUID recordId, UUID publicationId, ReferenceType type);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM RecordReference rr WHERE rr.recordId = :recordId")
  void deleteByRecordId(@Param("recordId") UUID recordId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM RecordReference rr WHERE rr.publicationId = :publicationId")
  void deleteByPublicationId(@Param("publicationId") UUID publicationId);
}
