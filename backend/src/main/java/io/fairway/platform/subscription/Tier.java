package io.fairway.platform.subscription;

import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.usage.UsageAllowance;
import java.math.BigDecimal;

/**
 * A sellable plan. Tiers of the same family are alternatives to each other: a customer holds at
 * most one live subscription per family and may move between its tiers.
 *
 * @param allowance metered usage allowance; null for tiers that are not usage-metered
 * @param rateLimitPerMinute request ceiling for the plan's API traffic; null to use the default
 */
public record Tier(
    String id,
    String name,
    String family,
    RevenueStream stream,
    BigDecimal monthlyPrice,
    BigDecimal annualPrice,
    String currency,
    UsageAllowance allowance,
    Integer rateLimitPerMinute) {

  public BigDecimal price(BillingCycle cycle) {
    return switch (cycle) {
      case MONTHLY -> monthlyPrice;
      case ANNUAL -> annualPrice;
    };
  }

  public boolean isMetered() {
    return allowance != null;
  }
}
