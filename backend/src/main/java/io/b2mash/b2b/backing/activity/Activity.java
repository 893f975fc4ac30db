package io.b2mash.b2b.backing.activity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "activities")
public class Activity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "type", nullable = false, length = 100)
  private String type;

  @Column(name = "collective_id", nullable = false)
  private UUID collectiveId;

  @Column(name = "user_id")
  private UUID userId;

  @Column(name = "order_id")
  private UUID orderId;

  /** Payload as JSON. */
  @Column(name = "data", columnDefinition = "TEXT")
  private String data;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Activity() {}

  public Activity(String type, UUID collectiveId, UUID userId, UUID orderId, String data) {
    this.type = type;
    this.collectiveId = collectiveId;
    this.userId = userId;
    this.orderId = orderId;
    this.data = data;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getType() {
    return type;
  }

  public UUID getCollectiveId() {
    return collectiveId;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public String getData() {
    return data;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
