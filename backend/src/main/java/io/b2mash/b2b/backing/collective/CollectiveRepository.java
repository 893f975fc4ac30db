package io.b2mash.b2b.backing.collective;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CollectiveRepository extends JpaRepository<Collective, UUID> {

  Optional<Collective> findBySlug(String slug);

  boolean existsBySlug(String slug);
}
