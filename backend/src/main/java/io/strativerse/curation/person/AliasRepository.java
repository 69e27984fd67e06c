package io.strativerse.curation.person;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AliasRepository extends JpaRepository<Alias, UUID> {

  Optional<Alias> findByAlias(String alias);

  List<Alias> findByPersonIdOrderByAliasAsc(UUID personId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE Alias a SET a.personId = :survivorId WHERE a.personId = :loserId")
  int reassignPerson(@Param("loserId") UUID loserId, @Param("survivorId") UUID survivorId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM Alias a WHERE a.personId = :personId")
  void deleteByPersonId(@Param("personId") UUID personId);
}
