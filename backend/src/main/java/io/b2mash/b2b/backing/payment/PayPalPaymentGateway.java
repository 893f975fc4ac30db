package io.b2mash.b2b.backing.payment;

import io.b2mash.b2b.backing.security.Actor;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * PayPal REST adapter. One-off orders capture a PayPal order the buyer has already approved (the
 * token is the PayPal order id); recurring orders verify that the billing subscription named in the
 * payment data (or the token) is active.
 */
@Component
@PaymentProvider(slug = "paypal")
public class PayPalPaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(PayPalPaymentGateway.class);
  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  private final PaymentProperties.PayPal config;
  private final RestClient restClient;
  private final Executor executor;

  @Autowired
  public PayPalPaymentGateway(
      PaymentProperties paymentProperties, @Qualifier("paymentTaskExecutor") Executor executor) {
    this(RestClient.builder(), paymentProperties, executor);
  }

  PayPalPaymentGateway(
      RestClient.Builder restClientBuilder,
      PaymentProperties paymentProperties,
      Executor executor) {
    this.config = paymentProperties.paypal();
    this.restClient = restClientBuilder.baseUrl(config.baseUrl()).build();
    this.executor = executor;
  }

  @Override
  public String providerId() {
    return "paypal";
  }

  @Override
  public CompletableFuture<ChargeResult> execute(Actor actor, ChargeRequest request) {
    return CompletableFuture.supplyAsync(() -> charge(request), executor);
  }

  ChargeResult charge(ChargeRequest request) {
    var paymentMethod = request.paymentMethod();
    if (paymentMethod == null || paymentMethod.token() == null || paymentMethod.token().isBlank()) {
      return ChargeResult.failure("A PayPal order or subscription id is required");
    }
    try {
      var accessToken = fetchAccessToken();
      if (request.isRecurring()) {
        var subscriptionId = paymentMethod.dataValue("subscriptionId");
        return verifySubscription(
            accessToken, subscriptionId != null ? subscriptionId : paymentMethod.token());
      }
      return captureOrder(accessToken, paymentMethod.token());
    } catch (RestClientResponseException e) {
      log.error(
          "PayPal call for order {} failed with status {}: {}",
          request.orderId(),
          e.getStatusCode().value(),
          e.getResponseBodyAsString());
      return ChargeResult.failure(describeError(e));
    } catch (ResourceAccessException e) {
      log.error("PayPal unreachable for order {}: {}", request.orderId(), e.getMessage());
      return ChargeResult.failure("PayPal is unreachable: " + e.getMessage());
    }
  }

  private String fetchAccessToken() {
    var credentials = config.clientId() + ":" + config.clientSecret();
    var basic = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    Map<String, Object> body =
        restClient
            .post()
            .uri("/v1/oauth2/token")
            .header(HttpHeaders.AUTHORIZATION, "Basic " + basic)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body("grant_type=client_credentials")
            .retrieve()
            .body(JSON_MAP);
    if (body == null || body.get("access_token") == null) {
      throw new IllegalStateException("PayPal token response carried no access_token");
    }
    return body.get("access_token").toString();
  }

  private ChargeResult captureOrder(String accessToken, String paypalOrderId) {
    Map<String, Object> body =
        restClient
            .post()
            .uri("/v2/checkout/orders/{id}/capture", paypalOrderId)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
            .contentType(MediaType.APPLICATION_JSON)
            .body("{}")
            .retrieve()
            .body(JSON_MAP);
    var status = body != null ? String.valueOf(body.get("status")) : null;
    if (!"COMPLETED".equals(status)) {
      return ChargeResult.failure(
          "PayPal order " + paypalOrderId + " was not captured (status " + status + ")");
    }
    var captureId = firstCaptureId(body);
    log.info("Captured PayPal order {} as {}", paypalOrderId, captureId);
    return ChargeResult.success(captureId != null ? captureId : paypalOrderId);
  }

  private ChargeResult verifySubscription(String accessToken, String subscriptionId) {
    Map<String, Object> body =
        restClient
            .get()
            .uri("/v1/billing/subscriptions/{id}", subscriptionId)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
            .retrieve()
            .body(JSON_MAP);
    var status = body != null ? String.valueOf(body.get("status")) : null;
    if (!"ACTIVE".equals(status)) {
      return ChargeResult.failure(
          "PayPal subscription " + subscriptionId + " is not active (status " + status + ")");
    }
    log.info("Verified PayPal subscription {}", subscriptionId);
    return ChargeResult.success(subscriptionId);
  }

  private static String firstCaptureId(Map<String, Object> order) {
    if (!(order.get("purchase_units") instanceof List<?> units) || units.isEmpty()) {
      return null;
    }
    if (!(units.get(0) instanceof Map<?, ?> unit)
        || !(unit.get("payments") instanceof Map<?, ?> payments)
        || !(payments.get("captures") instanceof List<?> captures)
        || captures.isEmpty()
        || !(captures.get(0) instanceof Map<?, ?> capture)) {
      return null;
    }
    var id = capture.get("id");
    return id != null ? id.toString() : null;
  }

  private static String describeError(RestClientResponseException e) {
    var body = e.getResponseBodyAsString();
    return body.isBlank()
        ? "PayPal returned " + e.getStatusCode().value()
        : "PayPal returned " + e.getStatusCode().value() + ": " + body;
  }
}
