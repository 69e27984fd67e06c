package io.strativerse.curation.annotation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AttachmentRepository extends JpaRepository<Attachment, UUID> {

  @Query(
      "SELECT a FROM Attachment a WHERE a.entityType = :entityType AND a.entityId = :entityId"
          + " ORDER BY a.annotationType, a.annotationKey")
  List<Attachment> findByOwner(
      @Param("entityType") EntityKind entityType, @Param("entityId") UUID entityId);

  @Query(
      "SELECT a FROM Attachment a WHERE a.entityType = :entityType AND a.entityId = :entityId"
          + " AND a.annotationType = :type ORDER BY a.annotationKey")
  List<Attachment> findByOwnerAndType(
      @Param("entityType") EntityKind entityType,
      @Param("entityId") UUID entityId,
      @Param("type") String type);

  @Query(
      "SELECT a FROM Attachment a WHERE a.entityType = :entityType AND a.entityId = :entityId"
          + " AND a.annotationType = :type AND a.annotationKey = :key")
  Optional<Attachment> findByOwnerAndTypeAndKey(
      @Param("entityType") EntityKind entityType,
      @Param("entityId") UUID entityId,
      @Param("type") String type,
      @Param("key") String key);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "DELETE FROM Attachment a WHERE a.entityType = :entityType AND a.entityId = :entityId"
          + " AND a.annotationType = :type")
  int deleteByOwnerAndType(
      @Param("entityType") EntityKind entityType,
      @Param("entityId") UUID entityId,
      @Param("type") String type);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM Attachment a WHERE a.entityType = :entityType AND a.entityId = :entityId")
  int deleteByOwner(
      @Param("entityType") EntityKind entityType, @Param("entityId") UUID entityId);
}
