package io.fairway.platform.analytics;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Monthly recurring revenue at an instant.
 *
 * @param mrr sum of {@code subscriptions[].monthlyAmount}, rounded to minor units
 * @param subscriptions contributing subscriptions ordered by id
 */
public record RecurringRevenue(
    String tenantId,
    Instant asOf,
    String currency,
    BigDecimal mrr,
    List<SubscriptionContribution> subscriptions) {

  /**
   * @param monthlyAmount the subscription's current price normalized to one month, unrounded
   * @param paidThrough end of the period its latest recurring charge paid for
   */
  public record SubscriptionContribution(
      String subscriptionId,
      String customerId,
      String billingCycle,
      BigDecimal monthlyAmount,
      Instant paidThrough) {}
}
