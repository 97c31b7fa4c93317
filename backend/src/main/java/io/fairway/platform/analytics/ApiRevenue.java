package io.fairway.platform.analytics;

import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;

/**
 * Developer API plans.
 *
 * @param planRevenue net of subscription and proration events
 * @param usageRevenue overage charges
 */
public record ApiRevenue(
    BigDecimal net,
    BigDecimal planRevenue,
    BigDecimal usageRevenue,
    BigDecimal refunds,
    long customers)
    implements StreamRevenue {

  @Override
  public RevenueStream stream() {
    return RevenueStream.API;
  }
}
