package io.b2mash.b2b.backing.member;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.user.User;
import java.time.Instant;
import java.util.UUID;

/** Membership as shown to a viewer. {@code email} is null unless the viewer may see it. */
public record MemberView(
    UUID id,
    MemberRole role,
    String collectiveSlug,
    UUID memberCollectiveId,
    UUID userId,
    String name,
    String email,
    Instant createdAt) {

  public static MemberView of(Member member, Collective collective, User user, boolean showEmail) {
    return new MemberView(
        member.getId(),
        member.getRole(),
        collective.getSlug(),
        member.getMemberCollectiveId(),
        user.getId(),
        user.getName(),
        showEmail ? user.getEmail() : null,
        member.getCreatedAt());
  }
}
