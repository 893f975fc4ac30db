package io.b2mash.b2b.backing.member;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveLookup;
import io.b2mash.b2b.backing.exception.ForbiddenException;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import io.b2mash.b2b.backing.security.Actor;
import io.b2mash.b2b.backing.user.IdentityResolver;
import io.b2mash.b2b.backing.user.User;
import io.b2mash.b2b.backing.user.UserRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Direct membership management outside the order flow. */
@Service
public class MemberService {

  private static final Logger log = LoggerFactory.getLogger(MemberService.class);

  private final CollectiveLookup collectiveLookup;
  private final IdentityResolver identityResolver;
  private final MembershipProvisioner provisioner;
  private final MemberRepository memberRepository;
  private final UserRepository userRepository;
  private final CollectivePermissions permissions;

  public MemberService(
      CollectiveLookup collectiveLookup,
      IdentityResolver identityResolver,
      MembershipProvisioner provisioner,
      MemberRepository memberRepository,
      UserRepository userRepository,
      CollectivePermissions permissions) {
    this.collectiveLookup = collectiveLookup;
    this.identityResolver = identityResolver;
    this.provisioner = provisioner;
    this.memberRepository = memberRepository;
    this.userRepository = userRepository;
    this.permissions = permissions;
  }

  /**
   * Adds the user identified by {@code email} to a collective. Anyone may register a FOLLOWER;
   * other roles require the actor to administer the collective.
   */
  @Transactional
  public MemberView createMember(
      Actor actor, String email, String name, String collectiveRef, MemberRole role) {
    Collective collective = collectiveLookup.requireByReference(collectiveRef);
    if (role != MemberRole.FOLLOWER && !permissions.canEdit(actor, collective)) {
      throw new ForbiddenException(
          "Cannot add member",
          "You need to be logged in as a core contributor or as a host of the "
              + collective.getName()
              + " collective");
    }
    User user = identityResolver.findOrCreateByEmail(email, name);
    UUID createdBy = actor != null ? actor.userId() : user.getId();
    var member =
        provisioner.addMember(collective.getId(), user.getCollectiveId(), createdBy, role);
    boolean showEmail = permissions.canSeeEmail(actor, user.getId(), collective);
    return MemberView.of(member, collective, user, showEmail);
  }

  /**
   * Removes every membership of {@code role} held by the user's personal collective. The user
   * themselves or an administrator of the collective may do so.
   *
   * @return the number of rows removed
   */
  @Transactional
  public int removeMember(Actor actor, UUID memberUserId, UUID collectiveId, MemberRole role) {
    Collective collective = collectiveLookup.require(collectiveId);
    User user =
        userRepository
            .findById(memberUserId)
            .orElseThrow(
                () -> ResourceNotFoundException.withDetail("Member not found", "Member not found"));
    boolean self = actor != null && actor.userId().equals(memberUserId);
    if (!self && !permissions.canEdit(actor, collective)) {
      throw new ForbiddenException(
          "Cannot remove member",
          "You need to be logged in as this user or as a core contributor or as a host of the"
              + " collective id "
              + collectiveId);
    }
    var memberships =
        memberRepository.findByCollectiveIdAndMemberCollectiveIdAndRole(
            collective.getId(), user.getCollectiveId(), role);
    if (memberships.isEmpty()) {
      throw ResourceNotFoundException.withDetail("Member not found", "Member not found");
    }
    memberRepository.deleteAll(memberships);
    log.info(
        "Removed {} {} membership(s) of user {} from collective {}",
        memberships.size(),
        role,
        memberUserId,
        collectiveId);
    return memberships.size();
  }
}
