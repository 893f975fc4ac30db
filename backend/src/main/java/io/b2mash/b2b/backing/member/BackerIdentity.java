package io.b2mash.b2b.backing.member;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.user.User;

/**
 * The ordering user and the collective that will hold the resulting membership. When an order
 * names a new organization, {@code fromCollective} stays null and {@code pendingOrganization}
 * holds its details until the order is reserved.
 */
public record BackerIdentity(
    User user, Collective fromCollective, OrganizationInput pendingOrganization) {

  public BackerIdentity(User user, Collective fromCollective) {
    this(user, fromCollective, null);
  }

  public static BackerIdentity pending(User user, OrganizationInput organization) {
    return new BackerIdentity(user, null, organization);
  }

  public boolean isPending() {
    return fromCollective == null && pendingOrganization != null;
  }
}
