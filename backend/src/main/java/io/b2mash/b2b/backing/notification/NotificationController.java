package io.b2mash.b2b.backing.notification;

import io.b2mash.b2b.backing.collective.CollectiveLookup;
import io.b2mash.b2b.backing.exception.ForbiddenException;
import io.b2mash.b2b.backing.member.CollectivePermissions;
import io.b2mash.b2b.backing.security.ActorContext;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/collectives")
public class NotificationController {

  private final NotificationService notificationService;
  private final SubscriberResolver subscriberResolver;
  private final CollectiveLookup collectiveLookup;
  private final CollectivePermissions permissions;

  public NotificationController(
      NotificationService notificationService,
      SubscriberResolver subscriberResolver,
      CollectiveLookup collectiveLookup,
      CollectivePermissions permissions) {
    this.notificationService = notificationService;
    this.subscriberResolver = subscriberResolver;
    this.collectiveLookup = collectiveLookup;
    this.permissions = permissions;
  }

  @PostMapping("/{collectiveId}/activities/{type}/unsubscribe")
  public ResponseEntity<NotificationView> unsubscribeFromActivity(
      @PathVariable UUID collectiveId, @PathVariable String type) {
    return ResponseEntity.ok(
        notificationService.unsubscribe(ActorContext.getCurrentActor(), collectiveId, type));
  }

  @PostMapping("/{collectiveId}/activities/{type}/subscribe")
  public ResponseEntity<NotificationView> subscribeToActivity(
      @PathVariable UUID collectiveId, @PathVariable String type) {
    return ResponseEntity.ok(
        notificationService.resubscribe(ActorContext.getCurrentActor(), collectiveId, type));
  }

  @PostMapping("/{collectiveId}/mailinglists/{channel}/unsubscribe")
  public ResponseEntity<NotificationView> unsubscribeFromChannel(
      @PathVariable UUID collectiveId, @PathVariable String channel) {
    return ResponseEntity.ok(
        notificationService.unsubscribeFromChannel(
            ActorContext.getCurrentActor(), collectiveId, channel));
  }

  @PostMapping("/{collectiveId}/mailinglists/{channel}/subscribe")
  public ResponseEntity<NotificationView> subscribeToChannel(
      @PathVariable UUID collectiveId, @PathVariable String channel) {
    return ResponseEntity.ok(
        notificationService.subscribeToChannel(
            ActorContext.getCurrentActor(), collectiveId, channel));
  }

  @GetMapping("/{slug}/subscribers")
  public ResponseEntity<SubscribersResponse> listSubscribers(
      @PathVariable String slug, @RequestParam(required = false) String channel) {
    var collective = collectiveLookup.requireBySlug(slug);
    if (!permissions.canEdit(ActorContext.getCurrentActor(), collective)) {
      throw new ForbiddenException(
          "Cannot list subscribers",
          "You need to be logged in as a core contributor or as a host of the "
              + collective.getName()
              + " collective");
    }
    var key = MailingChannel.normalize(channel);
    var userIds = List.copyOf(subscriberResolver.resolve(collective, key));
    return ResponseEntity.ok(new SubscribersResponse(key, userIds.size(), userIds));
  }

  public record SubscribersResponse(String channel, int count, List<UUID> userIds) {}
}
