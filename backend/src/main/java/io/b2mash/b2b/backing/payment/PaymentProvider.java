package io.b2mash.b2b.backing.payment;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a payment gateway. {@link PaymentGatewayRegistry} discovers annotated
 * beans at startup and indexes them by slug.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface PaymentProvider {
  /** Unique provider slug (e.g., "stripe", "paypal"), matched against the payment method. */
  String slug();
}
