package io.b2mash.b2b.backing.notification;

import io.b2mash.b2b.backing.collective.CollectiveKind;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import io.b2mash.b2b.backing.member.MemberRole;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mailing channel keys and the member roles each one reaches. Keys are {@code mailinglist} (the
 * default audience) or {@code mailinglist.<suffix>}.
 */
public final class MailingChannel {

  public static final String DEFAULT = "mailinglist";
  private static final String PREFIX = DEFAULT + ".";

  private static final Map<String, Set<MemberRole>> ROLES_BY_SUFFIX =
      Map.of(
          "backers", EnumSet.of(MemberRole.BACKER),
          "attendees", EnumSet.of(MemberRole.ATTENDEE),
          "followers", EnumSet.of(MemberRole.FOLLOWER),
          "admins", EnumSet.of(MemberRole.ADMIN, MemberRole.HOST),
          "hosts", EnumSet.of(MemberRole.HOST));

  private MailingChannel() {}

  /**
   * Normalizes a channel to its stored key: blank means the default list and a bare suffix such as
   * {@code backers} becomes {@code mailinglist.backers}.
   *
   * @throws ValidationFailedException for unknown suffixes
   */
  public static String normalize(String channel) {
    if (channel == null || channel.isBlank()) {
      return DEFAULT;
    }
    String key = channel.trim().toLowerCase(Locale.ROOT);
    if (key.equals(DEFAULT)) {
      return DEFAULT;
    }
    String suffix = key.startsWith(PREFIX) ? key.substring(PREFIX.length()) : key;
    if (!ROLES_BY_SUFFIX.containsKey(suffix)) {
      throw new ValidationFailedException("Unknown mailing list: " + channel);
    }
    return PREFIX + suffix;
  }

  /** Roles reached by a normalized key on a collective of the given kind. */
  public static Set<MemberRole> rolesFor(String key, CollectiveKind kind) {
    if (DEFAULT.equals(key)) {
      return kind == CollectiveKind.EVENT
          ? EnumSet.of(MemberRole.FOLLOWER, MemberRole.ATTENDEE)
          : EnumSet.of(MemberRole.ADMIN, MemberRole.HOST);
    }
    return EnumSet.copyOf(ROLES_BY_SUFFIX.get(key.substring(PREFIX.length())));
  }

  /** Whether an event's audience on this key also includes its parent's admins and hosts. */
  public static boolean includesParentAdmins(String key) {
    return DEFAULT.equals(key) || (PREFIX + "admins").equals(key);
  }
}
