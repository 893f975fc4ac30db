package io.b2mash.b2b.backing.user;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, UUID> {

  Optional<User> findByEmail(String email);

  @Query("SELECT u FROM User u WHERE u.collectiveId IN :collectiveIds")
  List<User> findByCollectiveIdIn(@Param("collectiveIds") Collection<UUID> collectiveIds);
}
