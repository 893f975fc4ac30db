package io.b2mash.b2b.backing.payment;

import io.b2mash.b2b.backing.collective.BillingInterval;
import java.util.Map;
import java.util.UUID;

/**
 * A single charge against a gateway. {@code amount} is in the currency's minor units; {@code
 * interval} is set for recurring charges only.
 */
public record ChargeRequest(
    UUID orderId,
    long amount,
    String currency,
    String description,
    String customerEmail,
    BillingInterval interval,
    UUID subscriptionId,
    PaymentMethod paymentMethod,
    Map<String, String> metadata) {

  public ChargeRequest {
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }

  public boolean isRecurring() {
    return interval != null;
  }
}
