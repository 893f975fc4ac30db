package io.b2mash.b2b.backing.order;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveKind;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.collective.Tier;
import io.b2mash.b2b.backing.collective.TierKind;
import io.b2mash.b2b.backing.collective.TierRepository;
import io.b2mash.b2b.backing.exception.CapacityExceededException;
import io.b2mash.b2b.backing.exception.ErrorKind;
import io.b2mash.b2b.backing.exception.ResourceNotFoundException;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CapacityGuardTest {

  @Mock private TierRepository tierRepository;
  @Mock private OrderRepository orderRepository;
  @Mock private CollectiveRepository collectiveRepository;

  private CapacityGuard guard;
  private Collective collective;

  @BeforeEach
  void setUp() {
    guard = new CapacityGuard(tierRepository, orderRepository, collectiveRepository);
    collective = withId(new Collective("jan-meetup", "January meetup", CollectiveKind.COLLECTIVE));
  }

  @Test
  void reserve_succeeds_when_quantity_fits() {
    var tier = tier(collective.getId(), 10);
    when(tierRepository.findByIdForUpdate(tier.getId())).thenReturn(Optional.of(tier));
    when(orderRepository.sumCapacityHoldingQuantity(tier.getId())).thenReturn(2L);

    var reservation = guard.reserve(collective, tier.getId(), 2);

    assertThat(reservation.tier()).isSameAs(tier);
    assertThat(reservation.quantity()).isEqualTo(2);
    assertThat(reservation.remaining()).isEqualTo(6);
  }

  @Test
  void reserve_allows_taking_exactly_the_last_slots() {
    var tier = tier(collective.getId(), 10);
    when(tierRepository.findByIdForUpdate(tier.getId())).thenReturn(Optional.of(tier));
    when(orderRepository.sumCapacityHoldingQuantity(tier.getId())).thenReturn(8L);

    var reservation = guard.reserve(collective, tier.getId(), 2);

    assertThat(reservation.remaining()).isZero();
  }

  @Test
  void reserve_rejects_quantity_above_availability() {
    var tier = tier(collective.getId(), 10);
    when(tierRepository.findByIdForUpdate(tier.getId())).thenReturn(Optional.of(tier));
    when(orderRepository.sumCapacityHoldingQuantity(tier.getId())).thenReturn(9L);

    assertThatThrownBy(() -> guard.reserve(collective, tier.getId(), 2))
        .isInstanceOf(CapacityExceededException.class)
        .satisfies(
            ex -> {
              var capacity = (CapacityExceededException) ex;
              assertThat(capacity.getKind()).isEqualTo(ErrorKind.CAPACITY_EXCEEDED);
              assertThat(capacity.getErrors())
                  .singleElement()
                  .satisfies(
                      error -> {
                        assertThat(error.kind()).isEqualTo("CapacityExceeded");
                        assertThat(error.message())
                            .isEqualTo("No more tickets left for Early bird");
                      });
            });
  }

  @Test
  void reserve_skips_counting_for_unlimited_tiers() {
    var tier = tier(collective.getId(), null);
    when(tierRepository.findByIdForUpdate(tier.getId())).thenReturn(Optional.of(tier));

    var reservation = guard.reserve(collective, tier.getId(), 500);

    assertThat(reservation.remaining()).isNull();
    verify(orderRepository, never()).sumCapacityHoldingQuantity(tier.getId());
  }

  @Test
  void reserve_rejects_unknown_tier_with_collective_slug_in_message() {
    var tierId = UUID.randomUUID();
    when(tierRepository.findByIdForUpdate(tierId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> guard.reserve(collective, tierId, 1))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("No tier found with tier id: " + tierId + " for collective slug jan-meetup");
  }

  @Test
  void reserve_rejects_tier_of_an_unrelated_collective() {
    var other = withId(new Collective("other", "Other", CollectiveKind.COLLECTIVE));
    var tier = tier(other.getId(), 10);
    when(tierRepository.findByIdForUpdate(tier.getId())).thenReturn(Optional.of(tier));
    when(collectiveRepository.findById(other.getId())).thenReturn(Optional.of(other));

    assertThatThrownBy(() -> guard.reserve(collective, tier.getId(), 1))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void reserve_accepts_tier_of_an_event_child() {
    var event = withId(Collective.event("jan-meetup-2026", "Meetup", collective.getId()));
    var tier = tier(event.getId(), 5);
    when(tierRepository.findByIdForUpdate(tier.getId())).thenReturn(Optional.of(tier));
    when(collectiveRepository.findById(event.getId())).thenReturn(Optional.of(event));
    when(orderRepository.sumCapacityHoldingQuantity(tier.getId())).thenReturn(0L);

    var reservation = guard.reserve(collective, tier.getId(), 1);

    assertThat(reservation.tier().getCollectiveId()).isEqualTo(event.getId());
  }

  @Test
  void reserve_rejects_non_positive_quantity() {
    assertThatThrownBy(() -> guard.reserve(collective, UUID.randomUUID(), 0))
        .isInstanceOf(ValidationFailedException.class)
        .hasMessage("Quantity must be at least 1");
  }

  @Test
  void stats_reports_remaining_capacity() {
    var tier = tier(collective.getId(), 100);
    when(orderRepository.countByTierIdAndStatusNot(tier.getId(), OrderStatus.PAYMENT_FAILED))
        .thenReturn(1L);
    when(orderRepository.sumCapacityHoldingQuantity(tier.getId())).thenReturn(2L);

    var stats = guard.stats(tier);

    assertThat(stats.totalOrders()).isEqualTo(1);
    assertThat(stats.availableQuantity()).isEqualTo(98);
  }

  @Test
  void stats_reports_null_availability_for_unlimited_tiers() {
    var tier = tier(collective.getId(), null);
    lenient()
        .when(orderRepository.countByTierIdAndStatusNot(tier.getId(), OrderStatus.PAYMENT_FAILED))
        .thenReturn(3L);

    assertThat(guard.stats(tier).availableQuantity()).isNull();
  }

  private static Tier tier(UUID collectiveId, Integer maxQuantity) {
    var tier =
        new Tier(collectiveId, "Early bird", TierKind.TICKET, 2000, "USD", null, maxQuantity);
    ReflectionTestUtils.setField(tier, "id", UUID.randomUUID());
    return tier;
  }

  private static Collective withId(Collective collective) {
    ReflectionTestUtils.setField(collective, "id", UUID.randomUUID());
    return collective;
  }
}
