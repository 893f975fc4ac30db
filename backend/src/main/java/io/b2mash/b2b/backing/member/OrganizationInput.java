package io.b2mash.b2b.backing.member;

import java.util.UUID;

/**
 * Organization an order is placed on behalf of: either an existing one by {@code id}, or a new one
 * described inline.
 */
public record OrganizationInput(UUID id, String name, String website, String twitterHandle) {

  public boolean isExisting() {
    return id != null;
  }
}
