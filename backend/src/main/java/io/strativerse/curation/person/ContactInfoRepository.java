package io.strativerse.curation.person;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContactInfoRepository extends JpaRepository<ContactInfo, UUID> {

  List<ContactInfo> findByPersonIdOrderByUpdatedDesc(UUID personId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE ContactInfo c SET c.personId = :survivorId WHERE c.personId = :loserId")
  int reassignPerson(@Param("loserId") UUID loserId, @Param("survivorId") UUID survivorId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM ContactInfo c WHERE c.personId = :personId")
  void deleteByPersonId(@Param("personId") UUID personId);
}
