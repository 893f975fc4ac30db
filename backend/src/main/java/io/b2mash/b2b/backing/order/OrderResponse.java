package io.b2mash.b2b.backing.order;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.member.MemberRole;
import io.b2mash.b2b.backing.subscription.Subscription;
import io.b2mash.b2b.backing.user.User;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record OrderResponse(
    UUID id,
    OrderStatus status,
    OrderStage stage,
    CollectiveSummary collective,
    CollectiveSummary fromCollective,
    UserSummary createdByUser,
    TierSummary tier,
    int quantity,
    long totalAmount,
    String currency,
    String publicMessage,
    Instant processedAt,
    SubscriptionSummary subscription,
    MemberSummary member,
    List<String> warnings) {

  public record CollectiveSummary(UUID id, String slug, String name, String type) {

    static CollectiveSummary of(Collective collective) {
      return new CollectiveSummary(
          collective.getId(),
          collective.getSlug(),
          collective.getName(),
          collective.getKind().name());
    }
  }

  /** {@code email} is null unless the viewer is this user or administers the collective. */
  public record UserSummary(UUID id, String name, String email) {}

  public record TierSummary(
      UUID id, String name, String type, long totalOrders, Integer availableQuantity) {}

  public record SubscriptionSummary(
      UUID id, long amount, String currency, String interval, boolean isActive) {

    static SubscriptionSummary of(Subscription subscription) {
      return new SubscriptionSummary(
          subscription.getId(),
          subscription.getAmount(),
          subscription.getCurrency(),
          subscription.getInterval().value(),
          subscription.isActive());
    }
  }

  public record MemberSummary(UUID id, MemberRole role) {}

  static OrderResponse of(OrderResult result, TierStats stats, boolean showEmail) {
    var order = result.order();
    Tier tier = result.tier();
    User user = result.createdBy();
    return new OrderResponse(
        order.getId(),
        order.getStatus(),
        result.stage(),
        CollectiveSummary.of(result.collective()),
        CollectiveSummary.of(result.fromCollective()),
        new UserSummary(user.getId(), user.getName(), showEmail ? user.getEmail() : null),
        tier != null
            ? new TierSummary(
                tier.getId(),
                tier.getName(),
                tier.getKind().name(),
                stats.totalOrders(),
                stats.availableQuantity())
            : null,
        order.getQuantity(),
        order.getTotalAmount(),
        order.getCurrency(),
        order.getPublicMessage(),
        order.getProcessedAt(),
        result.subscription() != null ? SubscriptionSummary.of(result.subscription()) : null,
        result.member() != null
            ? new MemberSummary(result.member().getId(), result.member().getRole())
            : null,
        result.warnings());
  }
}
