package io.fairway.platform.usage;

import io.fairway.platform.currency.MinorUnits;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Deterministic overage pricing. API calls are billed per call; storage and bandwidth per started
 * GiB above the allowance. Each line and the total are rounded half-even to minor units.
 */
@Component
public class OverageCalculator {

  static final long GIB = 1024L * 1024L * 1024L;

  public OverageSummary calculate(UsageAllowance allowance, Map<QuotaType, Long> actualUsage) {
    var charges = new ArrayList<OverageCharge>();
    BigDecimal total = MinorUnits.zero(allowance.currency());
    for (QuotaType quotaType : QuotaType.values()) {
      long actual = actualUsage.getOrDefault(quotaType, 0L);
      var charge = charge(allowance, quotaType, actual);
      charges.add(charge);
      total = total.add(charge.amount());
    }
    return new OverageSummary(
        charges, MinorUnits.round(total, allowance.currency()), allowance.currency());
  }

  public OverageCharge charge(UsageAllowance allowance, QuotaType quotaType, long actual) {
    long included = allowance.included(quotaType);
    long excess = Math.max(0, actual - included);
    long units =
        switch (quotaType) {
          case API_CALLS -> excess;
          case STORAGE, BANDWIDTH -> startedGib(excess);
        };
    BigDecimal rate =
        switch (quotaType) {
          case API_CALLS -> allowance.apiCallRate();
          case STORAGE -> allowance.storageRatePerGib();
          case BANDWIDTH -> allowance.bandwidthRatePerGib();
        };
    BigDecimal amount =
        MinorUnits.round(rate.multiply(BigDecimal.valueOf(units)), allowance.currency());
    return new OverageCharge(quotaType, included, actual, units, rate, amount);
  }

  private static long startedGib(long bytes) {
    return bytes == 0 ? 0 : (bytes + GIB - 1) / GIB;
  }
}
