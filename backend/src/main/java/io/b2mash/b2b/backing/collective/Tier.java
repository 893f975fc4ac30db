package io.b2mash.b2b.backing.collective;

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

@Entity
@Table(name = "tiers")
public class Tier {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "collective_id", nullable = false)
  private UUID collectiveId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", length = 1000)
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 20)
  private TierKind kind;

  /** Price per unit in the currency's minor units. */
  @Column(name = "amount", nullable = false)
  private long amount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Enumerated(EnumType.STRING)
  @Column(name = "billing_interval", length = 10)
  private BillingInterval interval;

  @Column(name = "max_quantity")
  private Integer maxQuantity;

  @Column(name = "goal")
  private Long goal;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Tier() {}

  public Tier(
      UUID collectiveId,
      String name,
      TierKind kind,
      long amount,
      String currency,
      BillingInterval interval,
      Integer maxQuantity) {
    this.collectiveId = collectiveId;
    this.name = name;
    this.kind = kind;
    this.amount = amount;
    this.currency = currency.toUpperCase();
    this.interval = interval;
    this.maxQuantity = maxQuantity;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCollectiveId() {
    return collectiveId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public TierKind getKind() {
    return kind;
  }

  public long getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public BillingInterval getInterval() {
    return interval;
  }

  public Integer getMaxQuantity() {
    return maxQuantity;
  }

  public Long getGoal() {
    return goal;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isRecurring() {
    return interval != null;
  }

  public boolean isTicket() {
    return kind == TierKind.TICKET;
  }

  public void updatePricing(long amount, String currency, BillingInterval interval) {
    this.amount = amount;
    this.currency = currency.toUpperCase();
    this.interval = interval;
    this.updatedAt = Instant.now();
  }

  public void updateDetails(String name, String description, Integer maxQuantity, Long goal) {
    this.name = name;
    this.description = description;
    this.maxQuantity = maxQuantity;
    this.goal = goal;
    this.updatedAt = Instant.now();
  }
}
