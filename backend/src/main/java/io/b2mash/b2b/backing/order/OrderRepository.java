package io.b2mash.b2b.backing.order;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrderRepository extends JpaRepository<Order, UUID> {

  @Query(
      """
      SELECT COALESCE(SUM(o.quantity), 0) FROM CollectiveOrder o
      WHERE o.tierId = :tierId AND o.status <> :excluded
      """)
  long sumQuantityExcludingStatus(
      @Param("tierId") UUID tierId, @Param("excluded") OrderStatus excluded);

  /** Quantity held against a tier by every order whose payment has not failed. */
  default long sumCapacityHoldingQuantity(UUID tierId) {
    return sumQuantityExcludingStatus(tierId, OrderStatus.PAYMENT_FAILED);
  }

  long countByTierIdAndStatusNot(UUID tierId, OrderStatus status);
}
