package io.b2mash.b2b.backing.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.backing.user.IdentityResolver;
import io.b2mash.b2b.backing.user.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the {@link Actor} for bearer-authenticated requests. The JWT subject is the user id; a
 * token for an unknown subject that carries an {@code email} claim resolves (or creates) the user
 * by email.
 */
@Component
public class ActorFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(ActorFilter.class);

  private final UserRepository userRepository;
  private final IdentityResolver identityResolver;
  private final Cache<String, Actor> actorCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofMinutes(30)).build();

  public ActorFilter(UserRepository userRepository, IdentityResolver identityResolver) {
    this.userRepository = userRepository;
    this.identityResolver = identityResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Actor actor = resolveActor();
    if (actor == null) {
      filterChain.doFilter(request, response);
      return;
    }
    try {
      ActorContext.setCurrentActor(actor);
      filterChain.doFilter(request, response);
    } finally {
      ActorContext.clear();
    }
  }

  public void evictFromCache(String subject) {
    actorCache.invalidate(subject);
  }

  private Actor resolveActor() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }
    Jwt jwt = jwtAuth.getToken();
    String subject = jwt.getSubject();
    if (subject == null) {
      return null;
    }
    try {
      return actorCache.get(subject, k -> lookupActor(jwt));
    } catch (RuntimeException e) {
      log.warn("Failed to resolve actor for subject {}: {}", subject, e.getMessage());
      return null;
    }
  }

  private Actor lookupActor(Jwt jwt) {
    var byId = parseUuid(jwt.getSubject()).flatMap(userRepository::findById);
    if (byId.isPresent()) {
      return Actor.of(byId.get());
    }
    String email = jwt.getClaimAsString("email");
    if (email == null) {
      log.debug("No user for subject {} and no email claim", jwt.getSubject());
      return null;
    }
    return Actor.of(identityResolver.findOrCreateByEmail(email, jwt.getClaimAsString("name")));
  }

  private static Optional<UUID> parseUuid(String value) {
    try {
      return Optional.of(UUID.fromString(value));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
