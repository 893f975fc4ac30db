package io.b2mash.b2b.backing.activity;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ActivityRepository extends JpaRepository<Activity, UUID> {

  List<Activity> findByOrderId(UUID orderId);
}
