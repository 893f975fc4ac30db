package io.b2mash.b2b.backing.payment;

import io.b2mash.b2b.backing.security.Actor;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Settles zero-amount charges without contacting any provider. */
@Component
@PaymentProvider(slug = PaymentGatewayRegistry.FREE)
public class FreePaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(FreePaymentGateway.class);

  @Override
  public String providerId() {
    return PaymentGatewayRegistry.FREE;
  }

  @Override
  public CompletableFuture<ChargeResult> execute(Actor actor, ChargeRequest request) {
    if (request.amount() != 0) {
      return CompletableFuture.completedFuture(
          ChargeResult.failure("The free gateway cannot charge " + request.amount()));
    }
    log.debug("Free gateway settled order {}", request.orderId());
    return CompletableFuture.completedFuture(ChargeResult.success(null));
  }
}
