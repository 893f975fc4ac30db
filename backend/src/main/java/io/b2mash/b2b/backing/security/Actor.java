package io.b2mash.b2b.backing.security;

import io.b2mash.b2b.backing.user.User;
import java.util.UUID;

/** The authenticated user on whose behalf an operation runs. */
public record Actor(UUID userId, String email, String name, UUID collectiveId) {

  public static Actor of(User user) {
    return new Actor(user.getId(), user.getEmail(), user.getName(), user.getCollectiveId());
  }
}
