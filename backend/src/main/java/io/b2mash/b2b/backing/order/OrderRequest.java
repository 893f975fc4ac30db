package io.b2mash.b2b.backing.order;

import io.b2mash.b2b.backing.member.OrganizationInput;
import io.b2mash.b2b.backing.payment.PaymentMethod;
import java.util.UUID;

/**
 * A contribution request. Without a tier the order is a donation of {@code totalAmount} (minor
 * units) in {@code currency}.
 */
public record OrderRequest(
    CollectiveRef collective,
    TierRef tier,
    Integer quantity,
    Long totalAmount,
    String currency,
    UserInput user,
    OrganizationInput fromCollective,
    PaymentMethod paymentMethod,
    String publicMessage) {

  public record CollectiveRef(UUID id, String slug) {}

  public record TierRef(UUID id) {}

  public record UserInput(String email, String name) {}

  public int quantityOrDefault() {
    return quantity != null ? quantity : 1;
  }

  public UUID tierId() {
    return tier != null ? tier.id() : null;
  }
}
