package io.b2mash.b2b.backing.subscription;

import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SubscriptionManager {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

  private final SubscriptionRepository subscriptionRepository;

  public SubscriptionManager(SubscriptionRepository subscriptionRepository) {
    this.subscriptionRepository = subscriptionRepository;
  }

  /** Copies amount, currency and interval from a recurring tier into a new active subscription. */
  @Transactional
  public Subscription createFromTier(Tier tier) {
    if (!tier.isRecurring()) {
      throw new ValidationFailedException(
          "Tier " + tier.getName() + " has no interval and cannot back a subscription");
    }
    var subscription =
        subscriptionRepository.save(
            new Subscription(tier.getAmount(), tier.getCurrency(), tier.getInterval()));
    log.info(
        "Created subscription {} from tier {} ({} {} per {})",
        subscription.getId(),
        tier.getId(),
        subscription.getAmount(),
        subscription.getCurrency(),
        subscription.getInterval().value());
    return subscription;
  }

  @Transactional
  public Subscription deactivate(UUID subscriptionId) {
    var subscription =
        subscriptionRepository
            .findById(subscriptionId)
            .orElseThrow(() -> new ResourceNotFoundException("Subscription", subscriptionId));
    subscription.deactivate();
    log.info("Deactivated subscription {}", subscriptionId);
    return subscription;
  }
}
