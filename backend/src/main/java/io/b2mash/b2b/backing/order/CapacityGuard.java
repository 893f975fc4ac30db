package io.b2mash.b2b.backing.order;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.collective.TierRepository;
import io.b2mash.b2b.backing.exception.CapacityExceededException;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Enforces {@code maxQuantity} on tiers. {@link #reserve} must run in the transaction that inserts
 * the order: the tier row stays write-locked until that transaction ends, so concurrent
 * reservations for the same tier are serialized.
 */
@Service
public class CapacityGuard {

  private static final Logger log = LoggerFactory.getLogger(CapacityGuard.class);

  private final TierRepository tierRepository;
  private final OrderRepository orderRepository;
  private final CollectiveRepository collectiveRepository;

  public CapacityGuard(
      TierRepository tierRepository,
      OrderRepository orderRepository,
      CollectiveRepository collectiveRepository) {
    this.tierRepository = tierRepository;
    this.orderRepository = orderRepository;
    this.collectiveRepository = collectiveRepository;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Reservation reserve(Collective collective, UUID tierId, int quantity) {
    if (quantity < 1) {
      throw new ValidationFailedException("Quantity must be at least 1");
    }
    Tier tier =
        tierRepository
            .findByIdForUpdate(tierId)
            .filter(t -> belongsTo(t, collective))
            .orElseThrow(() -> tierNotFound(collective, tierId));

    if (tier.getMaxQuantity() == null) {
      return new Reservation(tier, quantity, null);
    }

    long held = orderRepository.sumCapacityHoldingQuantity(tier.getId());
    long available = tier.getMaxQuantity() - held;
    if (quantity > available) {
      log.info(
          "Capacity exceeded for tier {}: requested={}, available={}",
          tier.getId(),
          quantity,
          available);
      throw new CapacityExceededException(tier.getName());
    }
    return new Reservation(tier, quantity, (int) (available - quantity));
  }

  /** Loads a tier of the collective (or of one of its events) without locking it. */
  @Transactional(readOnly = true)
  public Tier requireTier(Collective collective, UUID tierId) {
    return tierRepository
        .findById(tierId)
        .filter(t -> belongsTo(t, collective))
        .orElseThrow(() -> tierNotFound(collective, tierId));
  }

  @Transactional(readOnly = true)
  public TierStats stats(Tier tier) {
    long totalOrders =
        orderRepository.countByTierIdAndStatusNot(tier.getId(), OrderStatus.PAYMENT_FAILED);
    if (tier.getMaxQuantity() == null) {
      return new TierStats(totalOrders, null);
    }
    long held = orderRepository.sumCapacityHoldingQuantity(tier.getId());
    return new TierStats(totalOrders, (int) Math.max(0, tier.getMaxQuantity() - held));
  }

  private static ResourceNotFoundException tierNotFound(Collective collective, UUID tierId) {
    return ResourceNotFoundException.withDetail(
        "Tier not found",
        "No tier found with tier id: " + tierId + " for collective slug " + collective.getSlug());
  }

  /** A tier belongs to the collective itself or to one of its EVENT children. */
  private boolean belongsTo(Tier tier, Collective collective) {
    if (tier.getCollectiveId().equals(collective.getId())) {
      return true;
    }
    return collectiveRepository
        .findById(tier.getCollectiveId())
        .filter(Collective::isEvent)
        .map(owner -> collective.getId().equals(owner.getParentCollectiveId()))
        .orElse(false);
  }
}
