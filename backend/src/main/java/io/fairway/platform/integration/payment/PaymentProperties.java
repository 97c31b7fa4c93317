package io.fairway.platform.integration.payment;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param provider {@code simulated} (default) or {@code stripe}
 * @param stripe Stripe credentials, used only when the provider is {@code stripe}
 */
@ConfigurationProperties(prefix = "fairway.payment")
public record PaymentProperties(String provider, Stripe stripe) {

  public PaymentProperties {
    provider = provider != null ? provider : "simulated";
    stripe = stripe != null ? stripe : new Stripe(null);
  }

  public record Stripe(String apiKey) {}
}
