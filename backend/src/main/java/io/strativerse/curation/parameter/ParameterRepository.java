package io.strativerse.curation.parameter;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ParameterRepository extends JpaRepository<Parameter, UUID> {

  Optional<Parameter> findBySlug(String slug);

  boolean existsBySlug(String slug);

  List<Parameter> findAllByOrderByNameAsc();
}
