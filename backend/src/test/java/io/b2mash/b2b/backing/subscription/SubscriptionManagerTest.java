package io.b2mash.b2b.backing.subscription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.backing.collective.BillingInterval;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.collective.TierKind;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubscriptionManagerTest {

  @Mock private SubscriptionRepository subscriptionRepository;
  @InjectMocks private SubscriptionManager subscriptionManager;

  @Test
  void createFromTier_snapshots_pricing() {
    var tier =
        new Tier(
            UUID.randomUUID(), "Monthly", TierKind.TIER, 1000, "eur", BillingInterval.MONTH, null);
    when(subscriptionRepository.save(any(Subscription.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var subscription = subscriptionManager.createFromTier(tier);
    tier.updatePricing(5000, "USD", BillingInterval.YEAR);

    assertThat(subscription.getAmount()).isEqualTo(1000);
    assertThat(subscription.getCurrency()).isEqualTo("EUR");
    assertThat(subscription.getInterval()).isEqualTo(BillingInterval.MONTH);
    assertThat(subscription.isActive()).isTrue();
    assertThat(subscription.getDeactivatedAt()).isNull();
  }

  @Test
  void createFromTier_rejects_one_off_tier() {
    var tier = new Tier(UUID.randomUUID(), "Ticket", TierKind.TICKET, 1000, "USD", null, 10);

    assertThatThrownBy(() -> subscriptionManager.createFromTier(tier))
        .isInstanceOf(ValidationFailedException.class);
    verify(subscriptionRepository, never()).save(any());
  }

  @Test
  void deactivate_marks_subscription_inactive() {
    var subscription = new Subscription(1000, "USD", BillingInterval.YEAR);
    var id = UUID.randomUUID();
    when(subscriptionRepository.findById(id)).thenReturn(Optional.of(subscription));

    var deactivated = subscriptionManager.deactivate(id);

    assertThat(deactivated.isActive()).isFalse();
    assertThat(deactivated.getDeactivatedAt()).isNotNull();
  }

  @Test
  void deactivate_unknown_subscription_is_not_found() {
    var id = UUID.randomUUID();
    when(subscriptionRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> subscriptionManager.deactivate(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
