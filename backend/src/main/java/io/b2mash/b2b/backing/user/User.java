package io.b2mash.b2b.backing.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users")
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", nullable = false, unique = true, length = 255)
  private String email;

  @Column(name = "name", length = 255)
  private String name;

  /** The user's personal PERSON collective, used as the backing identity for individual orders. */
  @Column(name = "collective_id", nullable = false)
  private UUID collectiveId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected User() {}

  public User(String email, String name, UUID collectiveId) {
    this.email = email.toLowerCase();
    this.name = name;
    this.collectiveId = collectiveId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public UUID getCollectiveId() {
    return collectiveId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
