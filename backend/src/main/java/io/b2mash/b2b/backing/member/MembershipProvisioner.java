package io.b2mash.b2b.backing.member;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveKind;
import io.b2mash.b2b.backing.collective.CollectiveLookup;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.exception.ForbiddenException;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import io.b2mash.b2b.backing.order.Order;
import io.b2mash.b2b.backing.security.Actor;
import io.b2mash.b2b.backing.user.IdentityResolver;
import io.b2mash.b2b.backing.user.SlugGenerator;
import io.b2mash.b2b.backing.user.User;
import io.b2mash.b2b.backing.user.UserRepository;
import java.util.EnumSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns processed orders into memberships and resolves who the backer is. Provisioning is not
 * idempotent: each call inserts a new row.
 */
@Service
public class MembershipProvisioner {

  private static final Logger log = LoggerFactory.getLogger(MembershipProvisioner.class);

  private final MemberRepository memberRepository;
  private final CollectiveRepository collectiveRepository;
  private final CollectiveLookup collectiveLookup;
  private final UserRepository userRepository;
  private final IdentityResolver identityResolver;
  private final CollectivePermissions permissions;

  public MembershipProvisioner(
      MemberRepository memberRepository,
      CollectiveRepository collectiveRepository,
      CollectiveLookup collectiveLookup,
      UserRepository userRepository,
      IdentityResolver identityResolver,
      CollectivePermissions permissions) {
    this.memberRepository = memberRepository;
    this.collectiveRepository = collectiveRepository;
    this.collectiveLookup = collectiveLookup;
    this.userRepository = userRepository;
    this.identityResolver = identityResolver;
    this.permissions = permissions;
  }

  /** Ticket tiers grant ATTENDEE; every other order (tier or donation) grants BACKER. */
  public static MemberRole roleFor(Tier tier) {
    return tier != null && tier.isTicket() ? MemberRole.ATTENDEE : MemberRole.BACKER;
  }

  @Transactional
  public Member provision(Order order, Tier tier) {
    if (!order.isProcessed()) {
      throw new IllegalStateException(
          "Order " + order.getId() + " must be processed before provisioning, was "
              + order.getStatus());
    }
    var role = roleFor(tier);
    var member =
        memberRepository.save(
            new Member(
                order.getCollectiveId(),
                order.getFromCollectiveId(),
                order.getCreatedByUserId(),
                role,
                tier != null ? tier.getId() : null));
    log.info(
        "Provisioned {} membership {} in collective {} for order {}",
        role,
        member.getId(),
        order.getCollectiveId(),
        order.getId());
    return member;
  }

  /**
   * Resolves the ordering user (the actor, or a user found or created by email) and the collective
   * that backs on their behalf: their personal collective or an existing organization they
   * administer. A new organization described inline is returned pending and is only created by
   * {@link #createPendingOrganization}.
   */
  @Transactional
  public BackerIdentity resolveFromCollective(
      Actor actor, String email, String name, OrganizationInput organization) {
    if (organization != null && organization.isExisting()) {
      var existing = collectiveLookup.require(organization.id());
      if (!permissions.isAdminOf(actor, existing)) {
        throw new ForbiddenException(
            "Cannot order on behalf of organization",
            "You need to be logged in as an admin of the " + existing.getName() + " collective");
      }
      return new BackerIdentity(requireUser(actor), existing);
    }

    User user =
        actor != null ? requireUser(actor) : identityResolver.findOrCreateByEmail(email, name);
    if (organization == null) {
      return new BackerIdentity(user, collectiveLookup.require(user.getCollectiveId()));
    }
    return BackerIdentity.pending(user, organization);
  }

  /**
   * Creates the inline organization of a pending identity with the ordering user as ADMIN. Runs in
   * the caller's transaction so a rejected reservation leaves neither row behind.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public BackerIdentity createPendingOrganization(BackerIdentity identity) {
    if (!identity.isPending()) {
      return identity;
    }
    return new BackerIdentity(
        identity.user(), createOrganization(identity.user(), identity.pendingOrganization()));
  }

  private Collective createOrganization(User user, OrganizationInput input) {
    String base = SlugGenerator.slugify(input.name(), "organization");
    String slug = identityResolver.uniqueSlug(base, input.name() + ":" + user.getId());
    var organization = new Collective(slug, input.name(), CollectiveKind.ORGANIZATION);
    organization.updateContactDetails(input.website(), input.twitterHandle());
    organization.setCreatedByUserId(user.getId());
    organization = collectiveRepository.save(organization);
    addMemberIfAbsent(organization.getId(), user.getCollectiveId(), user.getId(), MemberRole.ADMIN);
    log.info("Created organization {} with admin {}", organization.getSlug(), user.getId());
    return organization;
  }

  @Transactional
  public Member addMember(
      UUID collectiveId, UUID memberCollectiveId, UUID createdByUserId, MemberRole role) {
    var member =
        memberRepository.save(
            new Member(collectiveId, memberCollectiveId, createdByUserId, role, null));
    log.info("Added {} {} to collective {}", role, memberCollectiveId, collectiveId);
    return member;
  }

  private void addMemberIfAbsent(
      UUID collectiveId, UUID memberCollectiveId, UUID createdByUserId, MemberRole role) {
    if (!memberRepository.existsByCollectiveIdAndMemberCollectiveIdAndRoleIn(
        collectiveId, memberCollectiveId, EnumSet.of(role))) {
      addMember(collectiveId, memberCollectiveId, createdByUserId, role);
    }
  }

  private User requireUser(Actor actor) {
    if (actor == null) {
      throw new ForbiddenException(
          "Authentication required", "You need to be logged in to order for an organization");
    }
    return userRepository
        .findById(actor.userId())
        .orElseThrow(() -> new ResourceNotFoundException("User", actor.userId()));
  }
}
