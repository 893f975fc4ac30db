package io.b2mash.b2b.backing.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

// ORDER is a reserved word in JPQL
@Entity(name = "CollectiveOrder")
@Table(name = "orders")
public class Order {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "collective_id", nullable = false)
  private UUID collectiveId;

  @Column(name = "from_collective_id", nullable = false)
  private UUID fromCollectiveId;

  @Column(name = "created_by_user_id", nullable = false)
  private UUID createdByUserId;

  @Column(name = "tier_id")
  private UUID tierId;

  @Column(name = "quantity", nullable = false)
  private int quantity;

  @Column(name = "total_amount", nullable = false)
  private long totalAmount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "public_message", length = 1000)
  private String publicMessage;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OrderStatus status;

  @Column(name = "payment_provider", length = 30)
  private String paymentProvider;

  @Column(name = "charge_reference", length = 255)
  private String chargeReference;

  @Column(name = "processed_at")
  private Instant processedAt;

  @Column(name = "subscription_id", unique = true)
  private UUID subscriptionId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Order() {}

  public Order(
      UUID collectiveId,
      UUID fromCollectiveId,
      UUID createdByUserId,
      UUID tierId,
      int quantity,
      long totalAmount,
      String currency,
      String publicMessage) {
    this.collectiveId = collectiveId;
    this.fromCollectiveId = fromCollectiveId;
    this.createdByUserId = createdByUserId;
    this.tierId = tierId;
    this.quantity = quantity;
    this.totalAmount = totalAmount;
    this.currency = currency.toUpperCase();
    this.publicMessage = publicMessage;
    this.status = OrderStatus.PENDING;
    this.createdAt = Instant.now();
  }

  public void markProcessed(
      String paymentProvider, String chargeReference, UUID subscriptionId, Instant processedAt) {
    if (status != OrderStatus.PENDING) {
      throw new IllegalStateException("Order " + id + " is " + status + ", expected PENDING");
    }
    this.status = OrderStatus.PROCESSED;
    this.paymentProvider = paymentProvider;
    this.chargeReference = chargeReference;
    this.subscriptionId = subscriptionId;
    this.processedAt = processedAt;
  }

  public void markPaymentFailed(String paymentProvider) {
    this.status = OrderStatus.PAYMENT_FAILED;
    this.paymentProvider = paymentProvider;
    this.processedAt = null;
  }

  public boolean isProcessed() {
    return status == OrderStatus.PROCESSED;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCollectiveId() {
    return collectiveId;
  }

  public UUID getFromCollectiveId() {
    return fromCollectiveId;
  }

  public UUID getCreatedByUserId() {
    return createdByUserId;
  }

  public UUID getTierId() {
    return tierId;
  }

  public int getQuantity() {
    return quantity;
  }

  public long getTotalAmount() {
    return totalAmount;
  }

  public String getCurrency() {
    return currency;
  }

  public String getPublicMessage() {
    return publicMessage;
  }

  public OrderStatus getStatus() {
    return status;
  }

  public String getPaymentProvider() {
    return paymentProvider;
  }

  public String getChargeReference() {
    return chargeReference;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }

  public UUID getSubscriptionId() {
    return subscriptionId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
