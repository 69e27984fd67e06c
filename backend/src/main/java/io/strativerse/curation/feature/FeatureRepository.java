package io.strativerse.curation.feature;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FeatureRepository extends JpaRepository<Feature, UUID> {

  List<Feature> findByParentIdOrderByNameAsc(UUID parentId);

  long countByParentId(UUID parentId);
}
