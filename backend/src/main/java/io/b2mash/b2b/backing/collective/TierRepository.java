package io.b2mash.b2b.backing.collective;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TierRepository extends JpaRepository<Tier, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Tier t WHERE t.id = :id")
  Optional<Tier> findByIdForUpdate(@Param("id") UUID id);
}
