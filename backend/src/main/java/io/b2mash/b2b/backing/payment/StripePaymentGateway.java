package io.b2mash.b2b.backing.payment;

import com.stripe.exception.StripeException;
import com.stripe.model.Charge;
import com.stripe.model.Customer;
import com.stripe.model.Product;
import com.stripe.model.Subscription;
import com.stripe.net.RequestOptions;
import com.stripe.param.ChargeCreateParams;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.ProductCreateParams;
import com.stripe.param.SubscriptionCreateParams;
import io.b2mash.b2b.backing.collective.BillingInterval;
import io.b2mash.b2b.backing.security.Actor;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Stripe adapter. The card token becomes a Customer, which is then charged once or subscribed to an
 * inline-priced plan. Uses per-request API keys and never sets the global {@code Stripe.apiKey}.
 */
@Component
@PaymentProvider(slug = "stripe")
public class StripePaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(StripePaymentGateway.class);

  private static final Set<String> SETTLED_SUBSCRIPTION_STATUSES = Set.of("active", "trialing");

  private final PaymentProperties paymentProperties;
  private final Executor executor;

  public StripePaymentGateway(
      PaymentProperties paymentProperties, @Qualifier("paymentTaskExecutor") Executor executor) {
    this.paymentProperties = paymentProperties;
    this.executor = executor;
  }

  @Override
  public String providerId() {
    return "stripe";
  }

  @Override
  public CompletableFuture<ChargeResult> execute(Actor actor, ChargeRequest request) {
    return CompletableFuture.supplyAsync(() -> charge(request), executor);
  }

  ChargeResult charge(ChargeRequest request) {
    var token = request.paymentMethod() != null ? request.paymentMethod().token() : null;
    if (token == null || token.isBlank()) {
      return ChargeResult.failure("A Stripe card token is required");
    }
    try {
      var requestOptions = RequestOptions.builder().setApiKey(resolveApiKey()).build();
      var customer = createCustomer(request, token, requestOptions);
      return request.isRecurring()
          ? subscribe(request, customer, requestOptions)
          : chargeOnce(request, customer, requestOptions);
    } catch (StripeException e) {
      log.error("Stripe charge for order {} failed: {}", request.orderId(), e.getMessage(), e);
      return ChargeResult.failure(e.getMessage());
    }
  }

  private Customer createCustomer(
      ChargeRequest request, String token, RequestOptions requestOptions) throws StripeException {
    var params =
        CustomerCreateParams.builder()
            .setSource(token)
            .setEmail(request.customerEmail())
            .putMetadata("orderId", String.valueOf(request.orderId()))
            .build();
    return Customer.create(params, requestOptions);
  }

  private ChargeResult chargeOnce(
      ChargeRequest request, Customer customer, RequestOptions requestOptions)
      throws StripeException {
    var params =
        ChargeCreateParams.builder()
            .setAmount(request.amount())
            .setCurrency(request.currency().toLowerCase())
            .setCustomer(customer.getId())
            .setDescription(request.description())
            .putAllMetadata(request.metadata())
            .build();
    var charge = Charge.create(params, requestOptions);
    if ("failed".equals(charge.getStatus())) {
      return ChargeResult.failure(charge.getFailureMessage());
    }
    log.info("Stripe charge {} created for order {}", charge.getId(), request.orderId());
    return ChargeResult.success(charge.getId());
  }

  private ChargeResult subscribe(
      ChargeRequest request, Customer customer, RequestOptions requestOptions)
      throws StripeException {
    var product =
        Product.create(
            ProductCreateParams.builder().setName(request.description()).build(), requestOptions);
    var params =
        SubscriptionCreateParams.builder()
            .setCustomer(customer.getId())
            .addItem(
                SubscriptionCreateParams.Item.builder()
                    .setPriceData(
                        SubscriptionCreateParams.Item.PriceData.builder()
                            .setCurrency(request.currency().toLowerCase())
                            .setUnitAmount(request.amount())
                            .setProduct(product.getId())
                            .setRecurring(
                                SubscriptionCreateParams.Item.PriceData.Recurring.builder()
                                    .setInterval(toStripeInterval(request.interval()))
                                    .build())
                            .build())
                    .build())
            .putAllMetadata(request.metadata())
            .build();
    var subscription = Subscription.create(params, requestOptions);
    if (!SETTLED_SUBSCRIPTION_STATUSES.contains(subscription.getStatus())) {
      return ChargeResult.failure(
          "Stripe subscription " + subscription.getId() + " is " + subscription.getStatus());
    }
    log.info(
        "Stripe subscription {} created for order {}", subscription.getId(), request.orderId());
    return ChargeResult.success(subscription.getId());
  }

  static SubscriptionCreateParams.Item.PriceData.Recurring.Interval toStripeInterval(
      BillingInterval interval) {
    return switch (interval) {
      case MONTH -> SubscriptionCreateParams.Item.PriceData.Recurring.Interval.MONTH;
      case YEAR -> SubscriptionCreateParams.Item.PriceData.Recurring.Interval.YEAR;
    };
  }

  private String resolveApiKey() {
    var apiKey = paymentProperties.stripe().apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException("Stripe API key is not configured");
    }
    return apiKey;
  }
}
