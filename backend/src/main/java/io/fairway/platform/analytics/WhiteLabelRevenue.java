package io.fairway.platform.analytics;

import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;

/** Branded apps sold to courses and chains. */
public record WhiteLabelRevenue(
    BigDecimal net,
    BigDecimal licenseRevenue,
    BigDecimal setupFees,
    BigDecimal refunds,
    long customers)
    implements StreamRevenue {

  @Override
  public RevenueStream stream() {
    return RevenueStream.WHITE_LABEL;
  }
}
