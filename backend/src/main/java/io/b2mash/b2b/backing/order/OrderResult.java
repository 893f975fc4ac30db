package io.b2mash.b2b.backing.order;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.member.Member;
import io.b2mash.b2b.backing.subscription.Subscription;
import io.b2mash.b2b.backing.user.User;
import java.util.List;

/**
 * Outcome of a successful order. {@code member} is null and {@code warnings} explain why when
 * provisioning failed after payment; the order itself stands.
 */
public record OrderResult(
    Order order,
    Collective collective,
    Tier tier,
    User createdBy,
    Collective fromCollective,
    Subscription subscription,
    Member member,
    OrderStage stage,
    int notifiedRecipients,
    List<String> warnings) {}
