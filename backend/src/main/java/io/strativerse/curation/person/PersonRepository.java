package io.strativerse.curation.person;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PersonRepository extends JpaRepository<Person, UUID> {

  @Query("SELECT p FROM Person p ORDER BY p.lastName, p.givenNames")
  List<Person> findAllOrdered();

  @Query(
      """
      SELECT DISTINCT p FROM Person p
      WHERE LOWER(p.lastName) LIKE LOWER(CONCAT('%', :term, '%'))
         OR LOWER(p.givenNames) LIKE LOWER(CONCAT('%', :term, '%'))
         OR p.id IN (SELECT a.personId FROM Alias a
                     WHERE LOWER(a.alias) LIKE LOWER(CONCAT('%', :term, '%')))
      ORDER BY p.lastName, p.givenNames
      """)
  List<Person> search(@Param("term") String term);
}
