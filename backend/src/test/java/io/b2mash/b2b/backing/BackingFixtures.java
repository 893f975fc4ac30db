package io.b2mash.b2b.backing;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;

import io.b2mash.b2b.backing.collective.BillingInterval;
import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveKind;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.collective.TierKind;
import io.b2mash.b2b.backing.collective.TierRepository;
import io.b2mash.b2b.backing.member.Member;
import io.b2mash.b2b.backing.member.MemberRepository;
import io.b2mash.b2b.backing.member.MemberRole;
import io.b2mash.b2b.backing.user.User;
import io.b2mash.b2b.backing.user.UserRepository;
import java.util.UUID;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;

/** Persists collectives, users, tiers and memberships with unique slugs and emails. */
public final class BackingFixtures {

  private final CollectiveRepository collectiveRepository;
  private final UserRepository userRepository;
  private final TierRepository tierRepository;
  private final MemberRepository memberRepository;

  public BackingFixtures(
      CollectiveRepository collectiveRepository,
      UserRepository userRepository,
      TierRepository tierRepository,
      MemberRepository memberRepository) {
    this.collectiveRepository = collectiveRepository;
    this.userRepository = userRepository;
    this.tierRepository = tierRepository;
    this.memberRepository = memberRepository;
  }

  public static String unique(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
  }

  public static JwtRequestPostProcessor jwtFor(User user) {
    return jwt().jwt(j -> j.subject(user.getId().toString()).claim("email", user.getEmail()));
  }

  public Collective collective(String name) {
    return collectiveRepository.save(
        new Collective(unique("collective"), name, CollectiveKind.COLLECTIVE));
  }

  public Collective event(Collective parent, String name) {
    return collectiveRepository.save(Collective.event(unique("event"), name, parent.getId()));
  }

  public User user(String name) {
    var personal =
        collectiveRepository.save(new Collective(unique("person"), name, CollectiveKind.PERSON));
    var user =
        userRepository.save(new User(unique("user") + "@example.com", name, personal.getId()));
    personal.setCreatedByUserId(user.getId());
    collectiveRepository.save(personal);
    return user;
  }

  public Tier ticket(Collective collective, String name, long amount, Integer maxQuantity) {
    return tierRepository.save(
        new Tier(collective.getId(), name, TierKind.TICKET, amount, "USD", null, maxQuantity));
  }

  public Tier recurring(Collective collective, String name, long amount, BillingInterval interval) {
    return tierRepository.save(
        new Tier(collective.getId(), name, TierKind.TIER, amount, "USD", interval, null));
  }

  public Member member(Collective collective, User user, MemberRole role) {
    return memberRepository.save(
        new Member(collective.getId(), user.getCollectiveId(), user.getId(), role, null));
  }
}
