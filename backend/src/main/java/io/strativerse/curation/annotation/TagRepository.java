package io.strativerse.curation.annotation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TagRepository extends JpaRepository<Tag, UUID> {

  @Query(
      "SELECT t FROM Tag t WHERE t.entityType = :entityType AND t.entityId = :entityId"
          + " ORDER BY t.annotationType, t.annotationKey")
  List<Tag> findByOwner(
      @Param("entityType") EntityKind entityType, @Param("entityId") UUID entityId);

  @Query(
      "SELECT t FROM Tag t WHERE t.entityType = :entityType AND t.entityId = :entityId"
          + " AND t.annotationType = :type ORDER BY t.annotationKey")
  List<Tag> findByOwnerAndType(
      @Param("entityType") EntityKind entityType,
      @Param("entityId") UUID entityId,
      @Param("type") String type);

  @Query(
      "SELECT t FROM Tag t WHERE t.entityType = :entityType AND t.entityId = :entityId"
          + " AND t.annotationType = :type AND t.annotationKey = :key")
  Optional<Tag> findByOwnerAndTypeAndKey(
      @Param("entityType") EntityKind entityType,
      @Param("entityId") UUID entityId,
      @Param("type") String type,
      @Param("key") String key);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "DELETE FROM Tag t WHERE t.entityType = :entityType AND t.entityId = :entityId"
          + " AND t.annotationType = :type")
  int deleteByOwnerAndType(
      @Param("entityType") EntityKind entityType,
      @Param("entityId") UUID entityId,
      @Param("type") String type);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM Tag t WHERE t.entityType = :entityType AND t.entityId = :entityId")
  int deleteByOwner(
      @Param("entityType") EntityKind entityType, @Param("entityId") UUID entityId);
}
