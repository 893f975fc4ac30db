package io.b2mash.b2b.backing.member;

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

/** A role held by one collective (person or organization) in another. */
@Entity
@Table(name = "members")
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "collective_id", nullable = false)
  private UUID collectiveId;

  @Column(name = "member_collective_id", nullable = false)
  private UUID memberCollectiveId;

  @Column(name = "created_by_user_id", nullable = false)
  private UUID createdByUserId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private MemberRole role;

  @Column(name = "tier_id")
  private UUID tierId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Member() {}

  public Member(
      UUID collectiveId,
      UUID memberCollectiveId,
      UUID createdByUserId,
      MemberRole role,
      UUID tierId) {
    this.collectiveId = collectiveId;
    this.memberCollectiveId = memberCollectiveId;
    this.createdByUserId = createdByUserId;
    this.role = role;
    this.tierId = tierId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCollectiveId() {
    return collectiveId;
  }

  public UUID getMemberCollectiveId() {
    return memberCollectiveId;
  }

  public UUID getCreatedByUserId() {
    return createdByUserId;
  }

  public MemberRole getRole() {
    return role;
  }

  public UUID getTierId() {
    return tierId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
