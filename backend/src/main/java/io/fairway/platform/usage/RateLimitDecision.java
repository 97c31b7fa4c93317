package io.fairway.platform.usage;

import java.time.Duration;

/**
 * Outcome of a rate-limit check. When denied, {@code retryAfter} is the time until the oldest call
 * in the window leaves it.
 */
public record RateLimitDecision(boolean allowed, Duration retryAfter) {

  private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, Duration.ZERO);

  public static RateLimitDecision allow() {
    return ALLOWED;
  }

  public static RateLimitDecision deny(Duration retryAfter) {
    return new RateLimitDecision(false, retryAfter);
  }
}
