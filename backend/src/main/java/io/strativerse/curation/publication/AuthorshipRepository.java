package io.strativerse.curation.publication;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuthorshipRepository extends JpaRepository<Authorship, UUID> {

  @Query(
      "SELECT a FROM Authorship a WHERE a.publicationId = :publicationId"
          + " ORDER BY a.role, a.sortOrder")
  List<Authorship> findByPublicationIdOrdered(@Param("publicationId") UUID publicationId);

  List<Authorship> findByPersonId(UUID personId);

  long countByPersonId(UUID personId);

  long countByPublicationId(UUID publicationId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM Authorship a WHERE a.publicationId = :publicationId")
  void deleteByPublicationId(@Param("publicationId") UUID publicationId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE Authorship a SET a.personId = :survivorId WHERE a.personId = :loserId")
  int reassignPerson(@Param("loserId") UUID loserId, @Param("survivorId") UUID survivorId);
}
