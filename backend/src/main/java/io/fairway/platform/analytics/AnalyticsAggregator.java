package io.fairway.platform.analytics;

import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.ledger.DateRange;
import io.fairway.platform.ledger.LedgerProperties;
import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.ledger.RevenueLedger;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reporting views over one tenant's revenue ledger. Holds no state of its own: every call replays
 * the tenant's partition and reduces it, so results can always be rebuilt from the ledger and two
 * calls over the same events return equal results.
 */
@Service
public class AnalyticsAggregator {

  private static final Logger log = LoggerFactory.getLogger(AnalyticsAggregator.class);

  static final int MAX_FORECAST_MONTHS = 36;

  private final RevenueLedger revenueLedger;
  private final LedgerProperties ledgerProperties;
  private final AnalyticsProperties analyticsProperties;

  public AnalyticsAggregator(
      RevenueLedger revenueLedger,
      LedgerProperties ledgerProperties,
      AnalyticsProperties analyticsProperties) {
    this.revenueLedger = revenueLedger;
    this.ledgerProperties = ledgerProperties;
    this.analyticsProperties = analyticsProperties;
  }

  public RecurringRevenue mrr(String tenantId, Instant asOf) {
    return RevenueReductions.mrr(tenantId, events(tenantId), currency(), asOf);
  }

  public AverageRevenue arpu(String tenantId, DateRange range) {
    return RevenueReductions.arpu(tenantId, events(tenantId), currency(), range);
  }

  public ChurnRisk churnRisk(String tenantId, Instant asOf) {
    return RevenueReductions.churnRisk(
        tenantId, events(tenantId), asOf, analyticsProperties.churnGracePeriod());
  }

  public CustomerLifetimeValue lifetimeValue(String tenantId, String customerId, Instant asOf) {
    return RevenueReductions.lifetimeValue(
        customerId, events(tenantId), currency(), asOf, analyticsProperties.clvHorizonMonths());
  }

  /** Lifetime value of every customer with revenue up to {@code asOf}, ordered by customer id. */
  public List<CustomerLifetimeValue> lifetimeValues(String tenantId, Instant asOf) {
    var events = events(tenantId);
    return RevenueReductions.customers(events, currency(), asOf).stream()
        .map(
            customerId ->
                RevenueReductions.lifetimeValue(
                    customerId, events, currency(), asOf, analyticsProperties.clvHorizonMonths()))
        .toList();
  }

  public RevenueForecast forecast(String tenantId, Instant asOf, int months) {
    if (months < 1 || months > MAX_FORECAST_MONTHS) {
      throw new InvalidRequestException(
          "Invalid forecast horizon",
          "Forecast months must be between 1 and " + MAX_FORECAST_MONTHS);
    }
    return RevenueReductions.forecast(
        tenantId,
        events(tenantId),
        currency(),
        asOf,
        months,
        analyticsProperties.maxMonthlyGrowth());
  }

  public RevenueBreakdown breakdown(String tenantId, DateRange range) {
    return RevenueReductions.breakdown(tenantId, events(tenantId), currency(), range);
  }

  private List<RevenueEvent> events(String tenantId) {
    var events = revenueLedger.replay(tenantId);
    log.debug("Reducing {} revenue events for tenant {}", events.size(), tenantId);
    return events;
  }

  private String currency() {
    return ledgerProperties.reportingCurrency();
  }
}
