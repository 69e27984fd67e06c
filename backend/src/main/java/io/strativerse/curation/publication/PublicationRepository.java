package io.strativerse.curation.publication;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PublicationRepository extends JpaRepository<Publication, UUID> {

  Optional<Publication> findBySlug(String slug);

  boolean existsBySlug(String slug);

  boolean existsBySlugAndIdNot(String slug, UUID id);

  Optional<Publication> findFirstByDoiIgnoreCase(String doi);

  @Query(
      "SELECT p FROM Publication p"
          + " WHERE p.title = :title AND p.slug = :slug AND p.id <> :excludeId")
  Optional<Publication> findOtherByTitleAndSlug(
      @Param("title") String title, @Param("slug") String slug, @Param("excludeId") UUID excludeId);

  @Query("SELECT p FROM Publication p ORDER BY p.year, p.slug")
  List<Publication> findAllOrdered();
}
