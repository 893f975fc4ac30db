package io.b2mash.b2b.backing.user;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveKind;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Finds users by email, creating them (with a personal PERSON collective and no password) on first
 * contact.
 */
@Service
public class IdentityResolver {

  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);
  private static final int MAX_SLUG_ATTEMPTS = 50;

  private final UserRepository userRepository;
  private final CollectiveRepository collectiveRepository;
  private final TransactionTemplate requiresNewTx;

  public IdentityResolver(
      UserRepository userRepository,
      CollectiveRepository collectiveRepository,
      PlatformTransactionManager transactionManager) {
    this.userRepository = userRepository;
    this.collectiveRepository = collectiveRepository;
    this.requiresNewTx = new TransactionTemplate(transactionManager);
    this.requiresNewTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public User findOrCreateByEmail(String email, String name) {
    if (email == null || email.isBlank() || !email.contains("@")) {
      throw new ValidationFailedException("A valid email is required");
    }
    String normalized = email.trim().toLowerCase();
    var existing = userRepository.findByEmail(normalized);
    if (existing.isPresent()) {
      return existing.get();
    }
    try {
      return requiresNewTx.execute(status -> createUser(normalized, name));
    } catch (DataIntegrityViolationException e) {
      // Race: a concurrent request created the same email first
      log.debug("User {} created concurrently, re-reading", normalized);
      return userRepository
          .findByEmail(normalized)
          .orElseThrow(
              () ->
                  new IllegalStateException(
                      "User not found after constraint violation for: " + normalized));
    }
  }

  private User createUser(String email, String name) {
    String slug = uniqueSlug(SlugGenerator.forPerson(name, email), email);
    String displayName = name != null && !name.isBlank() ? name : slug;
    var collective =
        collectiveRepository.save(new Collective(slug, displayName, CollectiveKind.PERSON));
    var user = userRepository.save(new User(email, name, collective.getId()));
    collective.setCreatedByUserId(user.getId());
    log.info("Created user {} with personal collective {}", user.getId(), slug);
    return user;
  }

  /** Appends a hash suffix, then a counter, until the slug is free. */
  public String uniqueSlug(String base, String seed) {
    if (!collectiveRepository.existsBySlug(base)) {
      return base;
    }
    String candidate = base + "-" + SlugGenerator.suffix(seed);
    for (int attempt = 1; collectiveRepository.existsBySlug(candidate); attempt++) {
      if (attempt > MAX_SLUG_ATTEMPTS) {
        throw new IllegalStateException("Unable to allocate a unique slug for " + base);
      }
      candidate = base + "-" + SlugGenerator.suffix(seed) + "-" + attempt;
    }
    return candidate;
  }
}
