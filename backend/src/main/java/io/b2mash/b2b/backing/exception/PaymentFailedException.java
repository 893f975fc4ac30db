package io.b2mash.b2b.backing.exception;

import java.util.List;

/**
 * A payment gateway declined or could not process a charge. The gateway message is passed through
 * unchanged.
 */
public class PaymentFailedException extends BackingException {

  private final String provider;

  public PaymentFailedException(String provider, String gatewayMessage) {
    super(
        ErrorKind.PAYMENT_ERROR,
        "Payment failed",
        List.of(gatewayMessage != null ? gatewayMessage : "Payment failed"));
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
