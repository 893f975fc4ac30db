package io.b2mash.b2b.backing.payment;

import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.collective.TierRepository;
import io.b2mash.b2b.backing.exception.PaymentFailedException;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import io.b2mash.b2b.backing.order.Order;
import io.b2mash.b2b.backing.order.OrderRepository;
import io.b2mash.b2b.backing.security.Actor;
import io.b2mash.b2b.backing.subscription.Subscription;
import io.b2mash.b2b.backing.subscription.SubscriptionManager;
import io.b2mash.b2b.backing.user.User;
import io.b2mash.b2b.backing.user.UserRepository;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Charges a pending order and records the outcome. The gateway call runs outside any database
 * transaction; the order is updated afterwards in its own short transaction. A failed charge flags
 * the order {@code PAYMENT_FAILED}, which releases its tier capacity, and deactivates any
 * subscription created for it. Charges are never retried.
 */
@Service
public class PaymentExecutor {

  private static final Logger log = LoggerFactory.getLogger(PaymentExecutor.class);

  private final PaymentGatewayRegistry gatewayRegistry;
  private final SubscriptionManager subscriptionManager;
  private final OrderRepository orderRepository;
  private final TierRepository tierRepository;
  private final UserRepository userRepository;
  private final TransactionTemplate transactionTemplate;

  public PaymentExecutor(
      PaymentGatewayRegistry gatewayRegistry,
      SubscriptionManager subscriptionManager,
      OrderRepository orderRepository,
      TierRepository tierRepository,
      UserRepository userRepository,
      PlatformTransactionManager transactionManager) {
    this.gatewayRegistry = gatewayRegistry;
    this.subscriptionManager = subscriptionManager;
    this.orderRepository = orderRepository;
    this.tierRepository = tierRepository;
    this.userRepository = userRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public SettledOrder execute(Actor actor, Order order, PaymentMethod paymentMethod) {
    String provider = gatewayRegistry.providerFor(paymentMethod, order.getTotalAmount());
    PaymentGateway gateway;
    try {
      gateway = gatewayRegistry.resolveBySlug(provider);
    } catch (IllegalArgumentException e) {
      markFailed(order.getId(), provider, null);
      throw new PaymentFailedException(provider, "Unsupported payment provider: " + provider);
    }

    Tier tier =
        order.getTierId() != null ? tierRepository.findById(order.getTierId()).orElse(null) : null;
    Subscription subscription =
        tier != null && tier.isRecurring() ? subscriptionManager.createFromTier(tier) : null;

    var request = buildRequest(actor, order, tier, subscription, paymentMethod);
    ChargeResult result = awaitCharge(gateway, actor, request);

    if (!result.success()) {
      log.warn(
          "Payment for order {} via {} failed: {}", order.getId(), provider, result.errorMessage());
      markFailed(order.getId(), provider, subscription);
      throw new PaymentFailedException(provider, result.errorMessage());
    }

    UUID subscriptionId = subscription != null ? subscription.getId() : null;
    Order processed =
        transactionTemplate.execute(
            status -> {
              var managed = requireOrder(order.getId());
              managed.markProcessed(
                  provider, result.chargeReference(), subscriptionId, Instant.now());
              return managed;
            });
    log.info(
        "Order {} processed via {} (reference={})",
        order.getId(),
        provider,
        result.chargeReference());
    return new SettledOrder(processed, subscription);
  }

  private ChargeRequest buildRequest(
      Actor actor, Order order, Tier tier, Subscription subscription, PaymentMethod paymentMethod) {
    String email =
        actor != null
            ? actor.email()
            : userRepository
                .findById(order.getCreatedByUserId())
                .map(User::getEmail)
                .orElse(null);
    String description = tier != null ? tier.getName() : "Contribution";
    return new ChargeRequest(
        order.getId(),
        order.getTotalAmount(),
        order.getCurrency(),
        description,
        email,
        subscription != null ? subscription.getInterval() : null,
        subscription != null ? subscription.getId() : null,
        paymentMethod,
        Map.of(
            "orderId", order.getId().toString(),
            "collectiveId", order.getCollectiveId().toString()));
  }

  private ChargeResult awaitCharge(PaymentGateway gateway, Actor actor, ChargeRequest request) {
    try {
      var result = gateway.execute(actor, request).join();
      return result != null ? result : ChargeResult.failure("Payment gateway returned no result");
    } catch (CompletionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      log.error("Payment gateway {} raised: {}", gateway.providerId(), cause.getMessage(), cause);
      return ChargeResult.failure(cause.getMessage());
    } catch (RuntimeException e) {
      log.error("Payment gateway {} raised: {}", gateway.providerId(), e.getMessage(), e);
      return ChargeResult.failure(e.getMessage());
    }
  }

  private void markFailed(UUID orderId, String provider, Subscription subscription) {
    transactionTemplate.executeWithoutResult(
        status -> requireOrder(orderId).markPaymentFailed(provider));
    if (subscription != null) {
      subscriptionManager.deactivate(subscription.getId());
    }
  }

  private Order requireOrder(UUID orderId) {
    return orderRepository
        .findById(orderId)
        .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
  }
}
