package io.b2mash.b2b.backing.subscription;

import io.b2mash.b2b.backing.collective.BillingInterval;
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

/**
 * Snapshot of a recurring tier's price taken when an order is placed. Later edits to the tier do
 * not change existing subscriptions.
 */
@Entity
@Table(name = "subscriptions")
public class Subscription {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "amount", nullable = false)
  private long amount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Enumerated(EnumType.STRING)
  @Column(name = "billing_interval", nullable = false, length = 10)
  private BillingInterval interval;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "deactivated_at")
  private Instant deactivatedAt;

  protected Subscription() {}

  public Subscription(long amount, String currency, BillingInterval interval) {
    this.amount = amount;
    this.currency = currency;
    this.interval = interval;
    this.active = true;
    this.createdAt = Instant.now();
  }

  public void deactivate() {
    if (!active) {
      return;
    }
    this.active = false;
    this.deactivatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
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

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getDeactivatedAt() {
    return deactivatedAt;
  }
}
