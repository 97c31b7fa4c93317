package io.fairway.platform.integration.payment;

import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.CardException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import io.fairway.platform.currency.MinorUnits;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stripe adapter. Charges are confirmed off-session PaymentIntents; the idempotency key is passed
 * through Stripe's request options so Stripe itself deduplicates retries. Never sets the global
 * {@code Stripe.apiKey}.
 */
@Component
@ConditionalOnProperty(prefix = "fairway.payment", name = "provider", havingValue = "stripe")
public class StripePaymentProcessor implements PaymentProcessor {

  private static final Logger log = LoggerFactory.getLogger(StripePaymentProcessor.class);

  private final PaymentProperties properties;

  public StripePaymentProcessor(PaymentProperties properties) {
    this.properties = properties;
  }

  @Override
  public String providerId() {
    return "stripe";
  }

  @Override
  public ChargeResult charge(
      BigDecimal amount, String currency, String token, String idempotencyKey) {
    var params =
        PaymentIntentCreateParams.builder()
            .setAmount(MinorUnits.toSmallestUnit(amount, currency))
            .setCurrency(currency.toLowerCase())
            .setPaymentMethod(token)
            .setConfirm(true)
            .setOffSession(true)
            .setAutomaticPaymentMethods(
                PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                    .setEnabled(true)
                    .setAllowRedirects(
                        PaymentIntentCreateParams.AutomaticPaymentMethods.AllowRedirects.NEVER)
                    .build())
            .putMetadata("idempotencyKey", idempotencyKey)
            .build();
    try {
      var intent = PaymentIntent.create(params, requestOptions(idempotencyKey));
      return switch (intent.getStatus()) {
        case "succeeded" -> ChargeResult.succeeded(intent.getId());
        case "requires_payment_method", "canceled" ->
            ChargeResult.declined(intent.getId(), "Payment intent " + intent.getStatus());
        default -> {
          log.warn(
              "Stripe payment intent {} left in status {} (key={})",
              intent.getId(),
              intent.getStatus(),
              idempotencyKey);
          yield ChargeResult.error("Payment intent " + intent.getStatus());
        }
      };
    } catch (CardException e) {
      log.info("Stripe declined charge (key={}): code={}", idempotencyKey, e.getCode());
      return ChargeResult.declined(e.getRequestId(), e.getCode());
    } catch (ApiConnectionException e) {
      log.warn("Stripe unreachable (key={}): {}", idempotencyKey, e.getMessage());
      return ChargeResult.error(e.getMessage());
    } catch (StripeException e) {
      log.error("Stripe charge failed (key={}): {}", idempotencyKey, e.getMessage(), e);
      return ChargeResult.error(e.getMessage());
    }
  }

  @Override
  public ChargeResult refund(
      String processorReference, BigDecimal amount, String currency, String idempotencyKey) {
    var params =
        RefundCreateParams.builder()
            .setPaymentIntent(processorReference)
            .setAmount(MinorUnits.toSmallestUnit(amount, currency))
            .build();
    try {
      var refund = Refund.create(params, requestOptions(idempotencyKey));
      if ("failed".equals(refund.getStatus()) || "canceled".equals(refund.getStatus())) {
        return ChargeResult.declined(refund.getId(), "Refund " + refund.getStatus());
      }
      return ChargeResult.succeeded(refund.getId());
    } catch (StripeException e) {
      log.error("Stripe refund failed (key={}): {}", idempotencyKey, e.getMessage(), e);
      return ChargeResult.error(e.getMessage());
    }
  }

  private RequestOptions requestOptions(String idempotencyKey) {
    return RequestOptions.builder()
        .setApiKey(properties.stripe().apiKey())
        .setIdempotencyKey(idempotencyKey)
        .build();
  }
}
