package io.b2mash.b2b.backing.collective;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import java.time.Duration;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves collectives by id or slug. Slugs are immutable once assigned, so the slug to id mapping
 * is cached.
 */
@Service
public class CollectiveLookup {

  private final CollectiveRepository collectiveRepository;
  private final Cache<String, UUID> slugCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(1)).build();

  public CollectiveLookup(CollectiveRepository collectiveRepository) {
    this.collectiveRepository = collectiveRepository;
  }

  @Transactional(readOnly = true)
  public Collective require(UUID id) {
    return collectiveRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Collective", id));
  }

  @Transactional(readOnly = true)
  public Collective requireBySlug(String slug) {
    String key = slug.toLowerCase();
    UUID cachedId = slugCache.getIfPresent(key);
    if (cachedId != null) {
      var cached = collectiveRepository.findById(cachedId);
      if (cached.isPresent()) {
        return cached.get();
      }
      slugCache.invalidate(key);
    }
    var collective =
        collectiveRepository
            .findBySlug(key)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Collective not found", "No collective found with slug: " + slug));
    slugCache.put(key, collective.getId());
    return collective;
  }

  /** Resolves by id when present, otherwise by slug. */
  @Transactional(readOnly = true)
  public Collective require(UUID id, String slug) {
    if (id != null) {
      return require(id);
    }
    return requireBySlug(slug);
  }

  /** Resolves a path reference that is either a UUID or a slug. */
  @Transactional(readOnly = true)
  public Collective requireByReference(String reference) {
    try {
      return require(UUID.fromString(reference));
    } catch (IllegalArgumentException e) {
      return requireBySlug(reference);
    }
  }
}
