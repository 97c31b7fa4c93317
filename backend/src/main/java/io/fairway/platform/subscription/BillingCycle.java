package io.fairway.platform.subscription;

import java.time.Instant;
import java.time.ZoneOffset;

public enum BillingCycle {
  MONTHLY(1),
  ANNUAL(12);

  private final int months;

  BillingCycle(int months) {
    this.months = months;
  }

  public int months() {
    return months;
  }

  /** End of the cycle that starts at {@code start}, by calendar months in UTC. */
  public Instant advance(Instant start) {
    return start.atZone(ZoneOffset.UTC).plusMonths(months).toInstant();
  }
}
