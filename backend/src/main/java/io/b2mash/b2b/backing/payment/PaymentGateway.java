package io.b2mash.b2b.backing.payment;

import io.b2mash.b2b.backing.security.Actor;
import java.util.concurrent.CompletableFuture;

/**
 * Port for charging a payment method. Implementations run the remote call on their own executor;
 * declines complete the future with a failed {@link ChargeResult}, transport errors may complete
 * it exceptionally.
 */
public interface PaymentGateway {

  String providerId();

  CompletableFuture<ChargeResult> execute(Actor actor, ChargeRequest request);
}
