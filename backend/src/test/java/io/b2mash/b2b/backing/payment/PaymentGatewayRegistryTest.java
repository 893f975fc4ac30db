package io.b2mash.b2b.backing.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;

class PaymentGatewayRegistryTest {

  private ApplicationContext applicationContext;
  private FreePaymentGateway freeGateway;
  private StripePaymentGateway stripeGateway;

  @BeforeEach
  void setUp() {
    applicationContext = mock(ApplicationContext.class);
    freeGateway = new FreePaymentGateway();
    stripeGateway = mock(StripePaymentGateway.class);
  }

  @Test
  void registers_gateways_by_annotation_slug() {
    var registry = registry(Map.of("freePaymentGateway", freeGateway, "stripe", stripeGateway));

    assertThat(registry.registeredSlugs()).containsExactlyInAnyOrder("free", "stripe");
    assertThat(registry.resolveBySlug("stripe")).isSameAs(stripeGateway);
  }

  @Test
  void zero_amount_always_resolves_to_free_gateway() {
    var registry = registry(Map.of("freePaymentGateway", freeGateway, "stripe", stripeGateway));

    var gateway = registry.resolve(new PaymentMethod("stripe", "tok_visa", null), 0);

    assertThat(gateway).isSameAs(freeGateway);
  }

  @Test
  void missing_provider_falls_back_to_default() {
    var registry = registry(Map.of("freePaymentGateway", freeGateway, "stripe", stripeGateway));

    assertThat(registry.providerFor(null, 1000)).isEqualTo("stripe");
    assertThat(registry.providerFor(new PaymentMethod(" ", "tok", null), 1000))
        .isEqualTo("stripe");
    assertThat(registry.providerFor(new PaymentMethod("PayPal", "tok", null), 1000))
        .isEqualTo("paypal");
  }

  @Test
  void unknown_slug_is_rejected() {
    var registry = registry(Map.of("freePaymentGateway", freeGateway));

    assertThatThrownBy(() -> registry.resolveBySlug("bitcoin"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("bitcoin");
  }

  @Test
  void duplicate_slugs_fail_fast() {
    var otherFree = new FreePaymentGateway();
    var beans = new LinkedHashMap<String, Object>();
    beans.put("freePaymentGateway", freeGateway);
    beans.put("otherFreeGateway", otherFree);

    assertThatThrownBy(() -> registry(beans))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate @PaymentProvider: slug=free");
  }

  private PaymentGatewayRegistry registry(Map<String, Object> beans) {
    when(applicationContext.getBeansWithAnnotation(PaymentProvider.class)).thenReturn(beans);
    beans.forEach(
        (name, bean) -> {
          var type =
              bean instanceof StripePaymentGateway
                  ? StripePaymentGateway.class
                  : FreePaymentGateway.class;
          when(applicationContext.findAnnotationOnBean(name, PaymentProvider.class))
              .thenReturn(type.getAnnotation(PaymentProvider.class));
        });
    return new PaymentGatewayRegistry(applicationContext, new PaymentProperties(null, null, null));
  }
}
