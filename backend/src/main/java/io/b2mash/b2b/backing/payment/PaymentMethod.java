package io.b2mash.b2b.backing.payment;

import java.util.Map;

/**
 * Tokenized payment instrument supplied with an order. {@code provider} is the gateway slug;
 * {@code data} carries provider specific extras (e.g. a PayPal billing subscription id).
 */
public record PaymentMethod(String provider, String token, Map<String, Object> data) {

  public PaymentMethod {
    data = data != null ? Map.copyOf(data) : Map.of();
  }

  public String dataValue(String key) {
    Object value = data.get(key);
    return value != null ? value.toString() : null;
  }
}
