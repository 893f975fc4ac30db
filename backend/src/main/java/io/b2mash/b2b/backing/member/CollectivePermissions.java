package io.b2mash.b2b.backing.member;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.security.Actor;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers the few authorization questions the pipeline needs: whether an actor administers a
 * collective (creator, the collective itself, or an ADMIN/HOST member, inherited from the parent
 * for events).
 */
@Service
public class CollectivePermissions {

  private static final Set<MemberRole> EDITOR_ROLES = EnumSet.of(MemberRole.ADMIN, MemberRole.HOST);

  private final MemberRepository memberRepository;

  public CollectivePermissions(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Transactional(readOnly = true)
  public boolean canEdit(Actor actor, Collective collective) {
    if (actor == null) {
      return false;
    }
    if (actor.userId().equals(collective.getCreatedByUserId())
        || actor.collectiveId().equals(collective.getId())) {
      return true;
    }
    if (memberRepository.existsByCollectiveIdAndMemberCollectiveIdAndRoleIn(
        collective.getId(), actor.collectiveId(), EDITOR_ROLES)) {
      return true;
    }
    return collective.isEvent()
        && collective.getParentCollectiveId() != null
        && memberRepository.existsByCollectiveIdAndMemberCollectiveIdAndRoleIn(
            collective.getParentCollectiveId(), actor.collectiveId(), EDITOR_ROLES);
  }

  /** Whether the actor may act on behalf of an organization (creator or ADMIN member). */
  @Transactional(readOnly = true)
  public boolean isAdminOf(Actor actor, Collective organization) {
    if (actor == null) {
      return false;
    }
    return actor.userId().equals(organization.getCreatedByUserId())
        || memberRepository.existsByCollectiveIdAndMemberCollectiveIdAndRoleIn(
            organization.getId(), actor.collectiveId(), EnumSet.of(MemberRole.ADMIN));
  }

  /** Whether {@code viewer} may see contact details of {@code subjectUserId}. */
  public boolean canSeeEmail(Actor viewer, UUID subjectUserId, Collective collective) {
    if (viewer == null) {
      return false;
    }
    return viewer.userId().equals(subjectUserId) || canEdit(viewer, collective);
  }
}
