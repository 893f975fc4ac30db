package io.b2mash.b2b.backing.notification;

import java.time.Instant;
import java.util.UUID;

public record NotificationView(
    UUID id, UUID collectiveId, String type, String channel, boolean active, Instant updatedAt) {

  public static NotificationView of(Notification notification) {
    return new NotificationView(
        notification.getId(),
        notification.getCollectiveId(),
        notification.getType(),
        notification.getChannel(),
        notification.isActive(),
        notification.getUpdatedAt());
  }
}
