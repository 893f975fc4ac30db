package io.b2mash.b2b.backing.activity;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.collective.TierRepository;
import io.b2mash.b2b.backing.member.Member;
import io.b2mash.b2b.backing.notification.SubscriberResolver;
import io.b2mash.b2b.backing.notification.channel.NotificationDispatcher;
import io.b2mash.b2b.backing.notification.channel.Recipient;
import io.b2mash.b2b.backing.order.Order;
import io.b2mash.b2b.backing.subscription.Subscription;
import io.b2mash.b2b.backing.subscription.SubscriptionRepository;
import io.b2mash.b2b.backing.user.User;
import io.b2mash.b2b.backing.user.UserRepository;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Records an activity and notifies its audience. Each recipient is notified at most once per
 * activity; recipients who turned the activity type off on the collective are skipped, and a
 * failed delivery does not stop the others.
 */
@Service
public class ActivityEmitter {

  private static final Logger log = LoggerFactory.getLogger(ActivityEmitter.class);
  private static final String ADMINS_CHANNEL = "admins";

  private final ActivityRepository activityRepository;
  private final SubscriberResolver subscriberResolver;
  private final NotificationDispatcher dispatcher;
  private final CollectiveRepository collectiveRepository;
  private final TierRepository tierRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final UserRepository userRepository;
  private final ObjectMapper objectMapper;

  public ActivityEmitter(
      ActivityRepository activityRepository,
      SubscriberResolver subscriberResolver,
      NotificationDispatcher dispatcher,
      CollectiveRepository collectiveRepository,
      TierRepository tierRepository,
      SubscriptionRepository subscriptionRepository,
      UserRepository userRepository,
      ObjectMapper objectMapper) {
    this.activityRepository = activityRepository;
    this.subscriberResolver = subscriberResolver;
    this.dispatcher = dispatcher;
    this.collectiveRepository = collectiveRepository;
    this.tierRepository = tierRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.userRepository = userRepository;
    this.objectMapper = objectMapper;
  }

  /**
   * @return the number of recipients the activity was delivered to
   */
  public int emit(ActivityType type, Collective collective, Order order, Member member) {
    Tier tier =
        order.getTierId() != null ? tierRepository.findById(order.getTierId()).orElse(null) : null;
    if (type == ActivityType.TICKET_CONFIRMED && (tier == null || !tier.isTicket())) {
      log.debug("Order {} is not for a ticket, skipping {}", order.getId(), type.value());
      return 0;
    }

    Collective backer = collectiveRepository.findById(order.getFromCollectiveId()).orElse(null);
    Subscription subscription =
        order.getSubscriptionId() != null
            ? subscriptionRepository.findById(order.getSubscriptionId()).orElse(null)
            : null;
    var payload = buildPayload(collective, order, member, backer, tier, subscription);
    activityRepository.save(
        new Activity(
            type.value(),
            collective.getId(),
            order.getCreatedByUserId(),
            order.getId(),
            toJson(payload)));

    Set<UUID> audience =
        switch (type) {
          case COLLECTIVE_MEMBER_CREATED -> subscriberResolver.resolve(collective, ADMINS_CHANNEL);
          case TICKET_CONFIRMED -> Set.of(order.getCreatedByUserId());
        };
    String subject = subjectFor(type, collective, order, member, backer);

    int delivered = 0;
    for (User user : userRepository.findAllById(audience)) {
      if (!subscriberResolver.isActivityTypeEnabled(
          user.getId(), collective.getId(), type.value())) {
        log.debug(
            "User {} opted out of {} on {}", user.getId(), type.value(), collective.getSlug());
        continue;
      }
      try {
        if (dispatcher.dispatch(
            new Recipient(user.getId(), user.getEmail(), user.getName()), subject, payload)) {
          delivered++;
        }
      } catch (RuntimeException e) {
        log.warn("Failed to notify user {} of {}: {}", user.getId(), type.value(), e.getMessage());
      }
    }
    log.info(
        "Emitted {} for order {} to {}/{} recipient(s)",
        type.value(),
        order.getId(),
        delivered,
        audience.size());
    return delivered;
  }

  static String subjectFor(
      ActivityType type, Collective collective, Order order, Member member, Collective backer) {
    return switch (type) {
      case COLLECTIVE_MEMBER_CREATED ->
          (backer != null ? backer.getName() : "anonymous")
              + " joined "
              + collective.getName()
              + " as "
              + member.getRole().name().toLowerCase();
      case TICKET_CONFIRMED ->
          order.getQuantity()
              + (order.getQuantity() == 1 ? " ticket" : " tickets")
              + " confirmed for "
              + collective.getName();
    };
  }

  private Map<String, Object> buildPayload(
      Collective collective,
      Order order,
      Member member,
      Collective backer,
      Tier tier,
      Subscription subscription) {
    var collectiveData = new LinkedHashMap<String, Object>();
    collectiveData.put("id", collective.getId());
    collectiveData.put("slug", collective.getSlug());
    collectiveData.put("name", collective.getName());
    collectiveData.put("type", collective.getKind().name());

    var memberData = new LinkedHashMap<String, Object>();
    memberData.put("id", member != null ? member.getId() : null);
    memberData.put("role", member != null ? member.getRole().name() : null);
    if (backer != null) {
      var backerData = new LinkedHashMap<String, Object>();
      backerData.put("id", backer.getId());
      backerData.put("slug", backer.getSlug());
      backerData.put("name", backer.getName());
      backerData.put("type", backer.getKind().name());
      memberData.put("memberCollective", backerData);
    }

    var orderData = new LinkedHashMap<String, Object>();
    orderData.put("id", order.getId());
    orderData.put("quantity", order.getQuantity());
    orderData.put("totalAmount", order.getTotalAmount());
    orderData.put("currency", order.getCurrency());
    orderData.put("publicMessage", order.getPublicMessage());
    if (subscription != null) {
      orderData.put("subscription", Map.of("interval", subscription.getInterval().value()));
    }

    var payload = new LinkedHashMap<String, Object>();
    payload.put("collective", collectiveData);
    payload.put("member", memberData);
    payload.put("order", orderData);
    if (tier != null) {
      var tierData = new LinkedHashMap<String, Object>();
      tierData.put("id", tier.getId());
      tierData.put("name", tier.getName());
      tierData.put("type", tier.getKind().name());
      payload.put("tier", tierData);
    }
    return payload;
  }

  private String toJson(Map<String, Object> payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JacksonException e) {
      log.warn("Could not serialize activity payload: {}", e.getMessage());
      return null;
    }
  }
}
