package io.fairway.platform.analytics;

import io.fairway.platform.currency.MinorUnits;
import io.fairway.platform.ledger.DateRange;
import io.fairway.platform.ledger.LedgerMetricsCalculator;
import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenuePeriod;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.subscription.BillingCycle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pure reductions from a slice of revenue events to reporting figures. Nothing here reads state
 * other than its arguments, and every result is independent of the order of {@code events}:
 * groups are keyed in sorted maps and ties are broken by event id.
 */
final class RevenueReductions {

  private static final Logger log = LoggerFactory.getLogger(RevenueReductions.class);

  /** Scale of intermediate per-month amounts and growth rates. */
  static final int RATE_SCALE = 6;

  static final int SCORE_SCALE = 4;

  private static final Comparator<RevenueEvent> ORDER =
      Comparator.comparing(RevenueEvent::occurredAt).thenComparing(RevenueEvent::id);

  private RevenueReductions() {}

  static RecurringRevenue mrr(
      String tenantId, Collection<RevenueEvent> events, String currency, Instant asOf) {
    var bySubscription = new TreeMap<String, List<RevenueEvent>>();
    for (RevenueEvent event : events) {
      if (event.type().isRecurring()
          && event.subscriptionId() != null
          && currency.equals(event.currency())
          && !event.occurredAt().isAfter(asOf)) {
        bySubscription.computeIfAbsent(event.subscriptionId(), k -> new ArrayList<>()).add(event);
      }
    }

    var contributions = new ArrayList<RecurringRevenue.SubscriptionContribution>();
    BigDecimal total = BigDecimal.ZERO;
    for (var entry : bySubscription.entrySet()) {
      var history = entry.getValue();
      history.sort(ORDER);
      RevenueEvent lastCharge = null;
      for (RevenueEvent event : history) {
        if (event.type().isPeriodCharge()) {
          lastCharge = event;
        }
      }
      if (lastCharge == null) {
        continue;
      }
      Instant paidThrough = paidThrough(lastCharge);
      if (!paidThrough.isAfter(asOf)) {
        continue;
      }
      // a later proration carries the price the subscription moved to
      RevenueEvent latest = history.get(history.size() - 1);
      BillingCycle cycle = cycle(latest);
      BigDecimal monthly =
          price(latest)
              .divide(BigDecimal.valueOf(cycle.months()), RATE_SCALE, RoundingMode.HALF_EVEN);
      total = total.add(monthly);
      contributions.add(
          new RecurringRevenue.SubscriptionContribution(
              entry.getKey(), latest.customerId(), cycle.name(), monthly, paidThrough));
    }
    return new RecurringRevenue(
        tenantId, asOf, currency, MinorUnits.round(total, currency), List.copyOf(contributions));
  }

  static AverageRevenue arpu(
      String tenantId, Collection<RevenueEvent> events, String currency, DateRange range) {
    BigDecimal net = MinorUnits.zero(currency);
    Set<String> paying = new HashSet<>();
    for (RevenueEvent event : events) {
      if (!currency.equals(event.currency()) || !range.contains(event.occurredAt())) {
        continue;
      }
      net = net.add(event.amount());
      if (event.amount().signum() > 0 && event.customerId() != null) {
        paying.add(event.customerId());
      }
    }
    BigDecimal arpu =
        paying.isEmpty()
            ? MinorUnits.zero(currency)
            : net.divide(
                BigDecimal.valueOf(paying.size()), MinorUnits.scale(currency), MinorUnits.ROUNDING);
    return new AverageRevenue(tenantId, range, currency, net, paying.size(), arpu);
  }

  static ChurnRisk churnRisk(
      String tenantId, Collection<RevenueEvent> events, Instant asOf, Duration gracePeriod) {
    var expectedRenewal = new TreeMap<String, Instant>();
    for (RevenueEvent event : events) {
      if (event.type().isPeriodCharge()
          && event.customerId() != null
          && !event.occurredAt().isAfter(asOf)) {
        expectedRenewal.merge(
            event.customerId(), paidThrough(event), (a, b) -> a.isAfter(b) ? a : b);
      }
    }
    var atRisk = new ArrayList<String>();
    expectedRenewal.forEach(
        (customerId, renewal) -> {
          if (renewal.plus(gracePeriod).isBefore(asOf)) {
            atRisk.add(customerId);
          }
        });
    BigDecimal score =
        expectedRenewal.isEmpty()
            ? BigDecimal.ZERO.setScale(SCORE_SCALE)
            : BigDecimal.valueOf(atRisk.size())
                .divide(
                    BigDecimal.valueOf(expectedRenewal.size()),
                    SCORE_SCALE,
                    RoundingMode.HALF_EVEN);
    return new ChurnRisk(
        tenantId, asOf, expectedRenewal.size(), atRisk.size(), score, List.copyOf(atRisk));
  }

  static CustomerLifetimeValue lifetimeValue(
      String customerId,
      Collection<RevenueEvent> events,
      String currency,
      Instant asOf,
      int horizonMonths) {
    BigDecimal net = MinorUnits.zero(currency);
    Instant first = null;
    for (RevenueEvent event : events) {
      if (!customerId.equals(event.customerId())
          || !currency.equals(event.currency())
          || event.occurredAt().isAfter(asOf)) {
        continue;
      }
      net = net.add(event.amount());
      if (first == null || event.occurredAt().isBefore(first)) {
        first = event.occurredAt();
      }
    }
    BigDecimal zero = MinorUnits.zero(currency);
    if (first == null) {
      return new CustomerLifetimeValue(
          customerId, asOf, currency, zero, 0, zero, horizonMonths, zero, zero);
    }
    long tenure = startedMonths(first, asOf);
    int scale = MinorUnits.scale(currency);
    BigDecimal monthly = net.divide(BigDecimal.valueOf(tenure), scale, MinorUnits.ROUNDING);
    // from the unrounded monthly value, rounded once
    BigDecimal projected =
        net.multiply(BigDecimal.valueOf(horizonMonths))
            .divide(BigDecimal.valueOf(tenure), scale, MinorUnits.ROUNDING);
    return new CustomerLifetimeValue(
        customerId,
        asOf,
        currency,
        net,
        tenure,
        monthly,
        horizonMonths,
        projected,
        net.add(projected));
  }

  /** Customer ids with any event in {@code currency} up to {@code asOf}, sorted. */
  static Set<String> customers(Collection<RevenueEvent> events, String currency, Instant asOf) {
    var ids = new TreeSet<String>();
    for (RevenueEvent event : events) {
      if (event.customerId() != null
          && currency.equals(event.currency())
          && !event.occurredAt().isAfter(asOf)) {
        ids.add(event.customerId());
      }
    }
    return ids;
  }

  static RevenueForecast forecast(
      String tenantId,
      Collection<RevenueEvent> events,
      String currency,
      Instant asOf,
      int months,
      BigDecimal maxMonthlyGrowth) {
    BigDecimal mrr = mrr(tenantId, events, currency, asOf).mrr();

    DateRange lastMonth = RevenuePeriod.MONTHLY.preceding(asOf);
    DateRange monthBefore = RevenuePeriod.MONTHLY.preceding(lastMonth.from());
    BigDecimal last = recurring(tenantId, events, currency, lastMonth);
    BigDecimal previous = recurring(tenantId, events, currency, monthBefore);
    BigDecimal observed =
        previous.signum() <= 0
            ? BigDecimal.ZERO.setScale(RATE_SCALE)
            : last.subtract(previous).divide(previous, RATE_SCALE, RoundingMode.HALF_EVEN);
    BigDecimal bound = maxMonthlyGrowth.setScale(RATE_SCALE, RoundingMode.HALF_EVEN);
    BigDecimal applied = observed.min(bound).max(bound.negate());

    BigDecimal factor = BigDecimal.ONE.add(applied);
    ZonedDateTime nextMonth =
        RevenuePeriod.MONTHLY.containing(asOf).to().atZone(ZoneOffset.UTC);
    var points = new ArrayList<RevenueForecast.Point>();
    for (int i = 1; i <= months; i++) {
      BigDecimal projected = MinorUnits.round(mrr.multiply(factor.pow(i)), currency);
      points.add(
          new RevenueForecast.Point(i, nextMonth.plusMonths(i - 1L).toInstant(), projected));
    }
    return new RevenueForecast(
        tenantId, asOf, currency, mrr, observed, applied, List.copyOf(points));
  }

  static RevenueBreakdown breakdown(
      String tenantId, Collection<RevenueEvent> events, String currency, DateRange range) {
    var totals = new EnumMap<RevenueStream, StreamTotals>(RevenueStream.class);
    for (RevenueStream stream : RevenueStream.values()) {
      totals.put(stream, new StreamTotals(currency));
    }
    for (RevenueEvent event : events) {
      if (currency.equals(event.currency()) && range.contains(event.occurredAt())) {
        totals.get(event.stream()).add(event);
      }
    }

    var consumer = totals.get(RevenueStream.CONSUMER);
    var whiteLabel = totals.get(RevenueStream.WHITE_LABEL);
    var analytics = totals.get(RevenueStream.ANALYTICS);
    var api = totals.get(RevenueStream.API);
    List<StreamRevenue> streams =
        List.of(
            new ConsumerRevenue(
                consumer.net,
                consumer.recurring,
                consumer.byType(RevenueEventType.ADD_ON_PURCHASE),
                consumer.refunds,
                consumer.customers.size()),
            new WhiteLabelRevenue(
                whiteLabel.net,
                whiteLabel.recurring,
                whiteLabel.byType(RevenueEventType.SETUP_FEE),
                whiteLabel.refunds,
                whiteLabel.customers.size()),
            new AnalyticsRevenue(
                analytics.net, analytics.recurring, analytics.refunds, analytics.customers.size()),
            new ApiRevenue(
                api.net,
                api.recurring,
                api.byType(RevenueEventType.USAGE_CHARGE),
                api.refunds,
                api.customers.size()));

    BigDecimal total = MinorUnits.zero(currency);
    for (StreamRevenue stream : streams) {
      total = total.add(stream.net());
    }
    return new RevenueBreakdown(tenantId, range, currency, total, streams);
  }

  /** End of the period a recurring charge paid for. */
  static Instant paidThrough(RevenueEvent charge) {
    String periodEnd = charge.metadata().get(RevenueEvent.PERIOD_END_KEY);
    if (periodEnd != null) {
      try {
        return Instant.parse(periodEnd);
      } catch (DateTimeParseException e) {
        log.debug("Event {} has unreadable periodEnd '{}'", charge.id(), periodEnd);
      }
    }
    return cycle(charge).advance(charge.occurredAt());
  }

  private static BigDecimal recurring(
      String tenantId, Collection<RevenueEvent> events, String currency, DateRange range) {
    return LedgerMetricsCalculator.compute(tenantId, range, currency, events).recurringRevenue();
  }

  private static BillingCycle cycle(RevenueEvent event) {
    String value = event.metadata().get(RevenueEvent.BILLING_CYCLE_KEY);
    if (value == null) {
      return BillingCycle.MONTHLY;
    }
    try {
      return BillingCycle.valueOf(value);
    } catch (IllegalArgumentException e) {
      log.debug("Event {} has unknown billing cycle '{}'", event.id(), value);
      return BillingCycle.MONTHLY;
    }
  }

  private static BigDecimal price(RevenueEvent event) {
    String value = event.metadata().get(RevenueEvent.PRICE_KEY);
    if (value != null) {
      try {
        return new BigDecimal(value);
      } catch (NumberFormatException e) {
        log.debug("Event {} has unreadable price '{}'", event.id(), value);
      }
    }
    return event.type().isPeriodCharge() ? event.amount() : BigDecimal.ZERO;
  }

  private static long startedMonths(Instant first, Instant asOf) {
    ZonedDateTime start = first.atZone(ZoneOffset.UTC);
    ZonedDateTime end = asOf.atZone(ZoneOffset.UTC);
    long months = ChronoUnit.MONTHS.between(start, end);
    if (start.plusMonths(months).isBefore(end)) {
      months++;
    }
    return Math.max(1, months);
  }

  private static final class StreamTotals {

    private BigDecimal net;
    private BigDecimal recurring;
    private BigDecimal refunds;
    private final Map<RevenueEventType, BigDecimal> byType =
        new EnumMap<>(RevenueEventType.class);
    private final Set<String> customers = new HashSet<>();
    private final String currency;

    private StreamTotals(String currency) {
      this.currency = currency;
      this.net = MinorUnits.zero(currency);
      this.recurring = MinorUnits.zero(currency);
      this.refunds = MinorUnits.zero(currency);
    }

    private void add(RevenueEvent event) {
      net = net.add(event.amount());
      if (event.type().isRecurring()) {
        recurring = recurring.add(event.amount());
      }
      if (event.type() == RevenueEventType.REFUND) {
        refunds = refunds.add(event.amount());
      }
      byType.merge(event.type(), event.amount(), BigDecimal::add);
      if (event.customerId() != null) {
        customers.add(event.customerId());
      }
    }

    private BigDecimal byType(RevenueEventType type) {
      return byType.getOrDefault(type, MinorUnits.zero(currency));
    }
  }
}
