package io.b2mash.b2b.backing.notification;

import io.b2mash.b2b.backing.collective.CollectiveLookup;
import io.b2mash.b2b.backing.exception.ForbiddenException;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import io.b2mash.b2b.backing.security.Actor;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Per-user subscription toggles. Each toggle upserts a single row per (user, collective, type) or
 * (user, collective, channel), so repeating a call leaves the state unchanged.
 */
@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final CollectiveLookup collectiveLookup;
  private final NotificationRepository notificationRepository;
  private final TransactionTemplate requiresNewTx;

  public NotificationService(
      CollectiveLookup collectiveLookup,
      NotificationRepository notificationRepository,
      PlatformTransactionManager transactionManager) {
    this.collectiveLookup = collectiveLookup;
    this.notificationRepository = notificationRepository;
    this.requiresNewTx = new TransactionTemplate(transactionManager);
    this.requiresNewTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public NotificationView unsubscribe(Actor actor, UUID collectiveId, String activityType) {
    return toggleType(actor, collectiveId, activityType, false);
  }

  public NotificationView resubscribe(Actor actor, UUID collectiveId, String activityType) {
    return toggleType(actor, collectiveId, activityType, true);
  }

  public NotificationView unsubscribeFromChannel(Actor actor, UUID collectiveId, String channel) {
    return toggleChannel(actor, collectiveId, MailingChannel.normalize(channel), false);
  }

  public NotificationView subscribeToChannel(Actor actor, UUID collectiveId, String channel) {
    return toggleChannel(actor, collectiveId, MailingChannel.normalize(channel), true);
  }

  private NotificationView toggleType(
      Actor actor, UUID collectiveId, String activityType, boolean active) {
    requireActor(actor);
    if (activityType == null || activityType.isBlank()) {
      throw new ValidationFailedException("An activity type is required");
    }
    collectiveLookup.require(collectiveId);
    String type = activityType.trim();
    return upsert(
        () ->
            notificationRepository
                .findByUserIdAndCollectiveIdAndType(actor.userId(), collectiveId, type)
                .orElseGet(
                    () ->
                        Notification.forActivityType(actor.userId(), collectiveId, type, active)),
        active,
        actor.userId(),
        collectiveId);
  }

  private NotificationView toggleChannel(
      Actor actor, UUID collectiveId, String channelKey, boolean active) {
    requireActor(actor);
    collectiveLookup.require(collectiveId);
    return upsert(
        () ->
            notificationRepository
                .findByUserIdAndCollectiveIdAndChannel(actor.userId(), collectiveId, channelKey)
                .orElseGet(
                    () ->
                        Notification.forChannel(actor.userId(), collectiveId, channelKey, active)),
        active,
        actor.userId(),
        collectiveId);
  }

  private NotificationView upsert(
      Supplier<Notification> finder,
      boolean active,
      UUID userId,
      UUID collectiveId) {
    try {
      return requiresNewTx.execute(status -> save(finder.get(), active));
    } catch (DataIntegrityViolationException e) {
      // Race: a concurrent toggle inserted the row first; update it instead
      log.debug("Concurrent toggle for user {} on {}, retrying as update", userId, collectiveId);
      return requiresNewTx.execute(status -> save(finder.get(), active));
    }
  }

  private NotificationView save(Notification notification, boolean active) {
    notification.setActive(active);
    var saved = notificationRepository.save(notification);
    log.info(
        "User {} {} {} on collective {}",
        saved.getUserId(),
        active ? "subscribed to" : "unsubscribed from",
        saved.getType() != null ? saved.getType() : saved.getChannel(),
        saved.getCollectiveId());
    return NotificationView.of(saved);
  }

  private static void requireActor(Actor actor) {
    if (actor == null) {
      throw new ForbiddenException(
          "Authentication required", "You need to be logged in to change your subscriptions");
    }
  }
}
