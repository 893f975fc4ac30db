package io.b2mash.b2b.backing.payment;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "backing.payment")
public record PaymentProperties(String defaultProvider, Stripe stripe, PayPal paypal) {

  public PaymentProperties {
    if (defaultProvider == null || defaultProvider.isBlank()) {
      defaultProvider = "stripe";
    }
    if (stripe == null) {
      stripe = new Stripe(null);
    }
    if (paypal == null) {
      paypal = new PayPal(null, null, null);
    }
  }

  public record Stripe(String apiKey) {}

  public record PayPal(String baseUrl, String clientId, String clientSecret) {

    public PayPal {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api-m.sandbox.paypal.com";
      }
    }
  }
}
