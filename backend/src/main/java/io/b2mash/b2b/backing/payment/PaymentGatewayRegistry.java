package io.b2mash.b2b.backing.payment;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class PaymentGatewayRegistry {

  public static final String FREE = "free";

  // Built at startup: slug -> gateway bean
  private final Map<String, PaymentGateway> gateways = new ConcurrentHashMap<>();
  private final String defaultProvider;

  public PaymentGatewayRegistry(
      ApplicationContext applicationContext, PaymentProperties paymentProperties) {
    this.defaultProvider = paymentProperties.defaultProvider();

    // Fail fast if two gateways register the same slug
    applicationContext
        .getBeansWithAnnotation(PaymentProvider.class)
        .forEach(
            (name, bean) -> {
              var annotation = applicationContext.findAnnotationOnBean(name, PaymentProvider.class);
              if (!(bean instanceof PaymentGateway gateway)) {
                throw new IllegalStateException(
                    "@PaymentProvider bean " + name + " does not implement PaymentGateway");
              }
              var existing = gateways.putIfAbsent(annotation.slug(), gateway);
              if (existing != null) {
                throw new IllegalStateException(
                    "Duplicate @PaymentProvider: slug="
                        + annotation.slug()
                        + " registered by both "
                        + existing.getClass().getName()
                        + " and "
                        + bean.getClass().getName());
              }
            });
  }

  /**
   * Picks the gateway for a charge: {@code free} for zero amounts, otherwise the payment method's
   * provider, falling back to the configured default.
   *
   * @throws IllegalArgumentException if no gateway is registered for the resolved slug
   */
  public PaymentGateway resolve(PaymentMethod paymentMethod, long amount) {
    return resolveBySlug(providerFor(paymentMethod, amount));
  }

  public String providerFor(PaymentMethod paymentMethod, long amount) {
    if (amount == 0) {
      return FREE;
    }
    if (paymentMethod == null
        || paymentMethod.provider() == null
        || paymentMethod.provider().isBlank()) {
      return defaultProvider;
    }
    return paymentMethod.provider().toLowerCase();
  }

  public PaymentGateway resolveBySlug(String slug) {
    var gateway = gateways.get(slug);
    if (gateway == null) {
      throw new IllegalArgumentException("No payment gateway registered for provider: " + slug);
    }
    return gateway;
  }

  public Set<String> registeredSlugs() {
    return Set.copyOf(gateways.keySet());
  }
}
