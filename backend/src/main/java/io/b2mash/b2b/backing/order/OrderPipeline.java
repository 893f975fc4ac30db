package io.b2mash.b2b.backing.order;

import io.b2mash.b2b.backing.activity.ActivityEmitter;
import io.b2mash.b2b.backing.activity.ActivityType;
import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveLookup;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.exception.PaymentFailedException;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import io.b2mash.b2b.backing.member.BackerIdentity;
import io.b2mash.b2b.backing.member.Member;
import io.b2mash.b2b.backing.member.MembershipProvisioner;
import io.b2mash.b2b.backing.payment.PaymentExecutor;
import io.b2mash.b2b.backing.payment.PaymentGatewayRegistry;
import io.b2mash.b2b.backing.security.Actor;
import io.b2mash.b2b.backing.subscription.Subscription;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Validates, reserves, charges, provisions and notifies, in that order. Capacity check, creation
 * of an inline organization and order insertion share one transaction; the charge runs outside
 * any transaction. Provisioning and
 * notification are best effort: their failures become warnings on the result and never undo a
 * paid order.
 */
@Service
public class OrderPipeline {

  private static final Logger log = LoggerFactory.getLogger(OrderPipeline.class);
  private static final String DEFAULT_CURRENCY = "USD";

  private final CollectiveLookup collectiveLookup;
  private final CapacityGuard capacityGuard;
  private final OrderRepository orderRepository;
  private final PaymentExecutor paymentExecutor;
  private final MembershipProvisioner provisioner;
  private final ActivityEmitter activityEmitter;
  private final TransactionTemplate transactionTemplate;

  public OrderPipeline(
      CollectiveLookup collectiveLookup,
      CapacityGuard capacityGuard,
      OrderRepository orderRepository,
      PaymentExecutor paymentExecutor,
      MembershipProvisioner provisioner,
      ActivityEmitter activityEmitter,
      PlatformTransactionManager transactionManager) {
    this.collectiveLookup = collectiveLookup;
    this.capacityGuard = capacityGuard;
    this.orderRepository = orderRepository;
    this.paymentExecutor = paymentExecutor;
    this.provisioner = provisioner;
    this.activityEmitter = activityEmitter;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public OrderResult createOrder(Actor actor, OrderRequest request) {
    validate(actor, request);
    int quantity = request.quantityOrDefault();
    var ref = request.collective();
    Collective collective = collectiveLookup.require(ref.id(), ref.slug());
    Tier tier =
        request.tierId() != null ? capacityGuard.requireTier(collective, request.tierId()) : null;

    long amount = tier != null ? totalFor(tier, quantity) : nullToZero(request.totalAmount());
    String currency = resolveCurrency(tier, request.currency());
    if (amount > 0 && request.paymentMethod() == null) {
      throw new ValidationFailedException("This order requires a payment method");
    }

    BackerIdentity identity =
        provisioner.resolveFromCollective(
            actor,
            request.user() != null ? request.user().email() : null,
            request.user() != null ? request.user().name() : null,
            request.fromCollective());

    var inserted = reserveAndInsert(collective, request, identity, quantity, amount, currency);
    Order order = inserted.order();
    BackerIdentity backer = inserted.backer();
    log.info(
        "Order {} created for collective {} (tier={}, quantity={}, amount={} {})",
        order.getId(),
        collective.getSlug(),
        order.getTierId(),
        quantity,
        amount,
        currency);

    OrderStage stage = OrderStage.CREATED;
    Subscription subscription = null;
    if (amount == 0) {
      order = markFree(order.getId());
    } else {
      stage = OrderStage.PAYMENT_PENDING;
      try {
        var settled = paymentExecutor.execute(actor, order, request.paymentMethod());
        order = settled.order();
        subscription = settled.subscription();
      } catch (PaymentFailedException e) {
        log.info("Order {} left {} as {}", order.getId(), stage, OrderStage.PAYMENT_FAILED);
        e.getBody().setProperty("orderId", order.getId());
        e.getBody().setProperty("stage", OrderStage.PAYMENT_FAILED);
        throw e;
      }
    }
    stage = OrderStage.PROCESSED;

    Collective target =
        order.getCollectiveId().equals(collective.getId())
            ? collective
            : collectiveLookup.require(order.getCollectiveId());
    var warnings = new ArrayList<String>();
    Member member = null;
    try {
      member = provisioner.provision(order, tier);
      stage = OrderStage.MEMBER_PROVISIONED;
    } catch (RuntimeException e) {
      log.warn("Provisioning failed for processed order {}: {}", order.getId(), e.getMessage(), e);
      warnings.add("Membership could not be created: " + e.getMessage());
    }

    int notified = 0;
    if (member != null) {
      try {
        notified = notify(target, order, member, tier);
        stage = OrderStage.NOTIFIED;
      } catch (RuntimeException e) {
        log.warn("Notification failed for order {}: {}", order.getId(), e.getMessage(), e);
        warnings.add("Notifications could not be sent: " + e.getMessage());
      }
    }

    return new OrderResult(
        order,
        target,
        tier,
        backer.user(),
        backer.fromCollective(),
        subscription,
        member,
        stage,
        notified,
        List.copyOf(warnings));
  }

  private void validate(Actor actor, OrderRequest request) {
    var problems = new ArrayList<String>();
    var ref = request.collective();
    if (ref == null || (ref.id() == null && (ref.slug() == null || ref.slug().isBlank()))) {
      problems.add("A collective id or slug is required");
    }
    if (request.quantity() != null && request.quantity() < 1) {
      problems.add("Quantity must be at least 1");
    }
    if (request.totalAmount() != null && request.totalAmount() < 0) {
      problems.add("Total amount cannot be negative");
    }
    if (actor == null
        && (request.user() == null
            || request.user().email() == null
            || request.user().email().isBlank())) {
      problems.add("An email is required when ordering without logging in");
    }
    var organization = request.fromCollective();
    if (organization != null
        && !organization.isExisting()
        && (organization.name() == null || organization.name().isBlank())) {
      problems.add("A name is required to create an organization");
    }
    if (!problems.isEmpty()) {
      throw new ValidationFailedException(problems);
    }
  }

  private Inserted reserveAndInsert(
      Collective collective,
      OrderRequest request,
      BackerIdentity identity,
      int quantity,
      long amount,
      String currency) {
    return transactionTemplate.execute(
        status -> {
          UUID targetCollectiveId = collective.getId();
          if (request.tierId() != null) {
            var reservation = capacityGuard.reserve(collective, request.tierId(), quantity);
            targetCollectiveId = reservation.tier().getCollectiveId();
          }
          BackerIdentity backer = provisioner.createPendingOrganization(identity);
          var order =
              orderRepository.save(
                  new Order(
                      targetCollectiveId,
                      backer.fromCollective().getId(),
                      backer.user().getId(),
                      request.tierId(),
                      quantity,
                      amount,
                      currency,
                      request.publicMessage()));
          return new Inserted(order, backer);
        });
  }

  private record Inserted(Order order, BackerIdentity backer) {}

  private Order markFree(UUID orderId) {
    return transactionTemplate.execute(
        status -> {
          var order = orderRepository.findById(orderId).orElseThrow();
          order.markProcessed(PaymentGatewayRegistry.FREE, null, null, Instant.now());
          return order;
        });
  }

  private int notify(Collective collective, Order order, Member member, Tier tier) {
    int notified =
        activityEmitter.emit(ActivityType.COLLECTIVE_MEMBER_CREATED, collective, order, member);
    if (tier != null && tier.isTicket()) {
      notified += activityEmitter.emit(ActivityType.TICKET_CONFIRMED, collective, order, member);
    }
    return notified;
  }

  private static String resolveCurrency(Tier tier, String requested) {
    if (tier != null) {
      return tier.getCurrency();
    }
    return requested != null && !requested.isBlank() ? requested : DEFAULT_CURRENCY;
  }

  private static long totalFor(Tier tier, int quantity) {
    try {
      return Math.multiplyExact(tier.getAmount(), (long) quantity);
    } catch (ArithmeticException e) {
      throw new ValidationFailedException(
          "Quantity " + quantity + " of " + tier.getName() + " exceeds the maximum order total");
    }
  }

  private static long nullToZero(Long value) {
    return value != null ? value : 0L;
  }
}
