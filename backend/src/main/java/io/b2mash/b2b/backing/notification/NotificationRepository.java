package io.b2mash.b2b.backing.notification;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  Optional<Notification> findByUserIdAndCollectiveIdAndType(
      UUID userId, UUID collectiveId, String type);

  Optional<Notification> findByUserIdAndCollectiveIdAndChannel(
      UUID userId, UUID collectiveId, String channel);

  @Query(
      """
      SELECT n.userId FROM Notification n
      WHERE n.collectiveId = :collectiveId AND n.channel = :channel AND n.active = false
      """)
  List<UUID> findOptedOutUserIdsForChannel(
      @Param("collectiveId") UUID collectiveId, @Param("channel") String channel);

  @Query(
      """
      SELECT n.userId FROM Notification n
      WHERE n.collectiveId = :collectiveId AND n.type = :type AND n.active = false
      """)
  List<UUID> findOptedOutUserIdsForType(
      @Param("collectiveId") UUID collectiveId, @Param("type") String type);

  boolean existsByUserIdAndCollectiveIdAndTypeAndActiveFalse(
      UUID userId, UUID collectiveId, String type);
}
