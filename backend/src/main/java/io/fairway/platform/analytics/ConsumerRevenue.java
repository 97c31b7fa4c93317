package io.fairway.platform.analytics;

import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;

/**
 * Golfer subscriptions and in-app purchases.
 *
 * @param subscriptionRevenue net of subscription and proration events
 * @param addOnRevenue add-on purchases
 * @param refunds refunds as a non-positive amount
 */
public record ConsumerRevenue(
    BigDecimal net,
    BigDecimal subscriptionRevenue,
    BigDecimal addOnRevenue,
    BigDecimal refunds,
    long customers)
    implements StreamRevenue {

  @Override
  public RevenueStream stream() {
    return RevenueStream.CONSUMER;
  }
}
