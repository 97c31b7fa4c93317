package io.fairway.platform.billing;

import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/** Exponential backoff for failed renewals: {@code base × 2^(attempt − 1)}. */
@Component
public class RetryPolicy {

  private static final int MAX_SHIFT = 20;

  private final BillingProperties properties;

  public RetryPolicy(BillingProperties properties) {
    this.properties = properties;
  }

  /** Delay after failed attempt number {@code attempt} (1-based). */
  public Duration backoff(int attempt) {
    int shift = Math.min(Math.max(attempt, 1) - 1, MAX_SHIFT);
    return properties.retryBase().multipliedBy(1L << shift);
  }

  public Instant nextRetryAt(int attempt, Instant failedAt) {
    return failedAt.plus(backoff(attempt));
  }

  public boolean isExhausted(int attempts) {
    return attempts >= properties.maxAttempts();
  }
}
