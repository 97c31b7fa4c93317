package io.fairway.platform.ledger;

import io.fairway.platform.currency.MinorUnits;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Reduces a slice of events to {@link LedgerMetrics}. Order-independent: any permutation of the
 * same events gives the same result.
 */
public final class LedgerMetricsCalculator {

  private LedgerMetricsCalculator() {}

  public static LedgerMetrics compute(
      String tenantId, DateRange range, String currency, Collection<RevenueEvent> events) {
    BigDecimal gross = MinorUnits.zero(currency);
    BigDecimal refunds = MinorUnits.zero(currency);
    BigDecimal recurring = MinorUnits.zero(currency);
    long count = 0;
    Set<String> customers = new HashSet<>();

    for (RevenueEvent event : events) {
      if (!currency.equals(event.currency()) || !range.contains(event.occurredAt())) {
        continue;
      }
      count++;
      if (event.customerId() != null) {
        customers.add(event.customerId());
      }
      if (event.amount().signum() >= 0) {
        gross = gross.add(event.amount());
      } else {
        refunds = refunds.add(event.amount());
      }
      if (event.type().isRecurring()) {
        recurring = recurring.add(event.amount());
      }
    }

    BigDecimal total = gross.add(refunds);
    int scale = MinorUnits.scale(currency);
    BigDecimal arpu =
        customers.isEmpty()
            ? MinorUnits.zero(currency)
            : total.divide(BigDecimal.valueOf(customers.size()), scale, MinorUnits.ROUNDING);

    return new LedgerMetrics(
        tenantId,
        range,
        currency,
        gross,
        refunds,
        total,
        recurring,
        customers.size(),
        arpu,
        count);
  }
}
