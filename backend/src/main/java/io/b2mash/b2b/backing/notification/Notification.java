package io.b2mash.b2b.backing.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's subscription toggle on a collective, scoped either to an activity type or to a mailing
 * channel (exactly one of the two is set). Absence of a row means subscribed.
 */
@Entity
@Table(name = "notifications")
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "collective_id", nullable = false)
  private UUID collectiveId;

  @Column(name = "type", length = 100)
  private String type;

  @Column(name = "channel", length = 100)
  private String channel;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Notification() {}

  private Notification(
      UUID userId, UUID collectiveId, String type, String channel, boolean active) {
    this.userId = userId;
    this.collectiveId = collectiveId;
    this.type = type;
    this.channel = channel;
    this.active = active;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public static Notification forActivityType(
      UUID userId, UUID collectiveId, String type, boolean active) {
    return new Notification(userId, collectiveId, type, null, active);
  }

  public static Notification forChannel(
      UUID userId, UUID collectiveId, String channel, boolean active) {
    return new Notification(userId, collectiveId, null, channel, active);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getCollectiveId() {
    return collectiveId;
  }

  public String getType() {
    return type;
  }

  public String getChannel() {
    return channel;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    if (this.active != active) {
      this.active = active;
      this.updatedAt = Instant.now();
    }
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
