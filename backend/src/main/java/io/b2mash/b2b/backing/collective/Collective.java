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
@Table(name = "collectives")
public class Collective {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "slug", nullable = false, unique = true, length = 255)
  private String slug;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 20)
  private CollectiveKind kind;

  @Column(name = "parent_collective_id")
  private UUID parentCollectiveId;

  @Column(name = "host_collective_id")
  private UUID hostCollectiveId;

  @Column(name = "website", length = 500)
  private String website;

  @Column(name = "twitter_handle", length = 100)
  private String twitterHandle;

  @Column(name = "created_by_user_id")
  private UUID createdByUserId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Collective() {}

  public Collective(String slug, String name, CollectiveKind kind) {
    this.slug = slug.toLowerCase();
    this.name = name;
    this.kind = kind;
    this.createdAt = Instant.now();
  }

  /** Creates an EVENT hosted under the given parent collective. */
  public static Collective event(String slug, String name, UUID parentCollectiveId) {
    var event = new Collective(slug, name, CollectiveKind.EVENT);
    event.parentCollectiveId = parentCollectiveId;
    return event;
  }

  public UUID getId() {
    return id;
  }

  public String getSlug() {
    return slug;
  }

  public String getName() {
    return name;
  }

  public CollectiveKind getKind() {
    return kind;
  }

  public UUID getParentCollectiveId() {
    return parentCollectiveId;
  }

  public UUID getHostCollectiveId() {
    return hostCollectiveId;
  }

  public String getWebsite() {
    return website;
  }

  public String getTwitterHandle() {
    return twitterHandle;
  }

  public UUID getCreatedByUserId() {
    return createdByUserId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isEvent() {
    return kind == CollectiveKind.EVENT;
  }

  public void setHostCollectiveId(UUID hostCollectiveId) {
    this.hostCollectiveId = hostCollectiveId;
  }

  public void setCreatedByUserId(UUID createdByUserId) {
    this.createdByUserId = createdByUserId;
  }

  public void updateContactDetails(String website, String twitterHandle) {
    this.website = website;
    this.twitterHandle = twitterHandle;
  }
}
