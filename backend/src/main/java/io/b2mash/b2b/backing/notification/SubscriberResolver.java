package io.b2mash.b2b.backing.notification;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveLookup;
import io.b2mash.b2b.backing.member.MemberRepository;
import io.b2mash.b2b.backing.member.MemberRole;
import io.b2mash.b2b.backing.user.User;
import io.b2mash.b2b.backing.user.UserRepository;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Computes who receives messages on a collective's mailing channel. A user is reached when their
 * personal collective holds a member role the channel targets, unless they turned that exact
 * channel off on that collective. Organizations holding a role are not expanded to their admins.
 */
@Service
public class SubscriberResolver {

  private static final Logger log = LoggerFactory.getLogger(SubscriberResolver.class);

  private final CollectiveLookup collectiveLookup;
  private final MemberRepository memberRepository;
  private final UserRepository userRepository;
  private final NotificationRepository notificationRepository;

  public SubscriberResolver(
      CollectiveLookup collectiveLookup,
      MemberRepository memberRepository,
      UserRepository userRepository,
      NotificationRepository notificationRepository) {
    this.collectiveLookup = collectiveLookup;
    this.memberRepository = memberRepository;
    this.userRepository = userRepository;
    this.notificationRepository = notificationRepository;
  }

  @Transactional(readOnly = true)
  public Set<UUID> resolve(String collectiveSlug, String channel) {
    return resolve(collectiveLookup.requireBySlug(collectiveSlug), channel);
  }

  @Transactional(readOnly = true)
  public Set<UUID> resolve(Collective collective, String channel) {
    String key = MailingChannel.normalize(channel);
    var memberCollectiveIds =
        new HashSet<>(
            memberRepository.findMemberCollectiveIds(
                collective.getId(), MailingChannel.rolesFor(key, collective.getKind())));

    if (collective.isEvent()
        && collective.getParentCollectiveId() != null
        && MailingChannel.includesParentAdmins(key)) {
      memberCollectiveIds.addAll(
          memberRepository.findMemberCollectiveIds(
              collective.getParentCollectiveId(), EnumSet.of(MemberRole.ADMIN, MemberRole.HOST)));
    }

    if (memberCollectiveIds.isEmpty()) {
      return Set.of();
    }

    var optedOut =
        new HashSet<>(
            notificationRepository.findOptedOutUserIdsForChannel(collective.getId(), key));
    var recipients = new LinkedHashSet<UUID>();
    for (User user : userRepository.findByCollectiveIdIn(memberCollectiveIds)) {
      if (!optedOut.contains(user.getId())) {
        recipients.add(user.getId());
      }
    }
    log.debug(
        "Resolved {} subscriber(s) for {} on {} ({} opted out)",
        recipients.size(),
        key,
        collective.getSlug(),
        optedOut.size());
    return recipients;
  }

  /** Users receive an activity type unless they hold an inactive row for it on the collective. */
  @Transactional(readOnly = true)
  public boolean isActivityTypeEnabled(UUID userId, UUID collectiveId, String activityType) {
    return !notificationRepository.existsByUserIdAndCollectiveIdAndTypeAndActiveFalse(
        userId, collectiveId, activityType);
  }
}
