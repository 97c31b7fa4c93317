package io.fairway.platform.analytics;

import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;

public record AnalyticsRevenue(
    BigDecimal net, BigDecimal subscriptionRevenue, BigDecimal refunds, long customers)
    implements StreamRevenue {

  @Override
  public RevenueStream stream() {
    return RevenueStream.ANALYTICS;
  }
}
