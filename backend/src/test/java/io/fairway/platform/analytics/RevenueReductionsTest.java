package io.fairway.platform.analytics;

import static io.fairway.platform.ledger.RevenueEventType.ADD_ON_PURCHASE;
import static io.fairway.platform.ledger.RevenueEventType.PRORATION;
import static io.fairway.platform.ledger.RevenueEventType.REFUND;
import static io.fairway.platform.ledger.RevenueEventType.SETUP_FEE;
import static io.fairway.platform.ledger.RevenueEventType.SUBSCRIPTION_CREATED;
import static io.fairway.platform.ledger.RevenueEventType.SUBSCRIPTION_RENEWED;
import static io.fairway.platform.ledger.RevenueEventType.USAGE_CHARGE;
import static io.fairway.platform.testutil.TestRevenueEvents.monthlyCharge;
import static io.fairway.platform.testutil.TestRevenueEvents.oneOff;
import static io.fairway.platform.testutil.TestRevenueEvents.recurring;
import static org.assertj.core.api.Assertions.assertThat;

import io.fairway.platform.ledger.DateRange;
import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.subscription.BillingCycle;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RevenueReductionsTest {

  private static final String TENANT = "tenant-a";
  private static final String USD = "USD";
  private static final Instant MAR_10 = Instant.parse("2025-03-10T00:00:00Z");
  private static final Instant MAR_15 = Instant.parse("2025-03-15T00:00:00Z");
  private static final Duration GRACE = Duration.ofDays(7);
  private static final BigDecimal MAX_GROWTH = new BigDecimal("0.25");

  /** Three subscriptions: two paid beyond mid-March, one that lapsed on Feb 1. */
  private static List<RevenueEvent> portfolio() {
    return List.of(
        monthlyCharge(
            "s1-created",
            TENANT,
            SUBSCRIPTION_CREATED,
            "100",
            Instant.parse("2025-03-01T00:00:00Z"),
            "c1",
            "s1"),
        recurring(
            "s2-created",
            TENANT,
            SUBSCRIPTION_CREATED,
            "1200",
            Instant.parse("2025-01-10T00:00:00Z"),
            "c2",
            "s2",
            "1200",
            BillingCycle.ANNUAL,
            Instant.parse("2026-01-10T00:00:00Z"),
            RevenueStream.WHITE_LABEL),
        monthlyCharge(
            "s3-created",
            TENANT,
            SUBSCRIPTION_CREATED,
            "50",
            Instant.parse("2025-01-01T00:00:00Z"),
            "c3",
            "s3"));
  }

  @Test
  void mrr_normalizesAnnualPlansAndDropsLapsedSubscriptions() {
    var mrr = RevenueReductions.mrr(TENANT, portfolio(), USD, MAR_15);

    assertThat(mrr.mrr()).isEqualByComparingTo("200.00");
    assertThat(mrr.subscriptions())
        .extracting(RecurringRevenue.SubscriptionContribution::subscriptionId)
        .containsExactly("s1", "s2");
  }

  @Test
  void mrr_followsThePriceOfTheLatestProration() {
    var events = new ArrayList<>(portfolio());
    events.add(
        recurring(
            "s1-proration",
            TENANT,
            PRORATION,
            "30",
            Instant.parse("2025-03-10T00:00:00Z"),
            "c1",
            "s1",
            "160",
            BillingCycle.MONTHLY,
            Instant.parse("2025-04-01T00:00:00Z"),
            RevenueStream.CONSUMER));

    var mrr = RevenueReductions.mrr(TENANT, events, USD, MAR_15);

    assertThat(mrr.mrr()).isEqualByComparingTo("260.00");
  }

  @Test
  void churnRisk_flagsCustomersPastRenewalAndGrace() {
    var risk = RevenueReductions.churnRisk(TENANT, portfolio(), MAR_15, GRACE);

    assertThat(risk.recurringCustomers()).isEqualTo(3);
    assertThat(risk.atRisk()).isEqualTo(1);
    assertThat(risk.atRiskCustomerIds()).containsExactly("c3");
    assertThat(risk.score()).isEqualByComparingTo("0.3333");
  }

  @Test
  void churnRisk_waitsForTheGracePeriod() {
    var risk =
        RevenueReductions.churnRisk(
            TENANT, portfolio(), Instant.parse("2025-02-05T00:00:00Z"), GRACE);

    assertThat(risk.atRisk()).isZero();
  }

  @Test
  void lifetimeValue_projectsAverageMonthlyNetOverTheHorizon() {
    var events =
        List.of(
            monthlyCharge(
                "c9-1",
                TENANT,
                SUBSCRIPTION_CREATED,
                "100",
                Instant.parse("2025-01-01T00:00:00Z"),
                "c9",
                "s9"),
            monthlyCharge(
                "c9-2",
                TENANT,
                SUBSCRIPTION_RENEWED,
                "100",
                Instant.parse("2025-02-01T00:00:00Z"),
                "c9",
                "s9"),
            refund("c9-3", "-20", Instant.parse("2025-02-10T00:00:00Z"), "c9"));

    var clv = RevenueReductions.lifetimeValue("c9", events, USD, MAR_15, 12);

    assertThat(clv.historicalNet()).isEqualByComparingTo("180.00");
    assertThat(clv.tenureMonths()).isEqualTo(3);
    assertThat(clv.monthlyValue()).isEqualByComparingTo("60.00");
    assertThat(clv.projectedValue()).isEqualByComparingTo("720.00");
    assertThat(clv.lifetimeValue()).isEqualByComparingTo("900.00");
  }

  @Test
  void lifetimeValue_ofUnknownCustomerIsZero() {
    var clv = RevenueReductions.lifetimeValue("nobody", portfolio(), USD, MAR_15, 12);

    assertThat(clv.lifetimeValue()).isEqualByComparingTo("0.00");
    assertThat(clv.tenureMonths()).isZero();
  }

  @Test
  void arpu_dividesNetRevenueByPayingCustomers() {
    var january =
        new DateRange(Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-02-01T00:00:00Z"));
    var events = new ArrayList<>(portfolio());
    events.add(refund("refund", "-250", Instant.parse("2025-01-20T00:00:00Z"), "c2"));

    var arpu = RevenueReductions.arpu(TENANT, events, USD, january);

    assertThat(arpu.netRevenue()).isEqualByComparingTo("1000.00");
    assertThat(arpu.payingCustomers()).isEqualTo(2);
    assertThat(arpu.arpu()).isEqualByComparingTo("500.00");
  }

  @Test
  void forecast_compoundsObservedMonthOverMonthGrowth() {
    var forecast =
        RevenueReductions.forecast(
            TENANT, growingSubscription("110"), USD, MAR_10, 3, MAX_GROWTH);

    assertThat(forecast.currentMrr()).isEqualByComparingTo("110.00");
    assertThat(forecast.observedGrowth()).isEqualByComparingTo("0.1");
    assertThat(forecast.appliedGrowth()).isEqualByComparingTo("0.1");
    assertThat(forecast.points())
        .extracting(RevenueForecast.Point::projectedMrr)
        .usingElementComparator(BigDecimal::compareTo)
        .containsExactly(
            new BigDecimal("121.00"), new BigDecimal("133.10"), new BigDecimal("146.41"));
    assertThat(forecast.points().get(0).monthStart())
        .isEqualTo(Instant.parse("2025-04-01T00:00:00Z"));
  }

  @Test
  void forecast_clampsGrowthToTheConfiguredBound() {
    var forecast =
        RevenueReductions.forecast(
            TENANT, growingSubscription("200"), USD, MAR_10, 1, MAX_GROWTH);

    assertThat(forecast.observedGrowth()).isEqualByComparingTo("1");
    assertThat(forecast.appliedGrowth()).isEqualByComparingTo("0.25");
    assertThat(forecast.points().get(0).projectedMrr()).isEqualByComparingTo("250.00");
  }

  @Test
  void forecast_withoutHistoryAssumesNoGrowth() {
    var events =
        List.of(
            monthlyCharge(
                "only",
                TENANT,
                SUBSCRIPTION_CREATED,
                "80",
                Instant.parse("2025-03-01T00:00:00Z"),
                "c1",
                "s1"));

    var forecast = RevenueReductions.forecast(TENANT, events, USD, MAR_15, 2, MAX_GROWTH);

    assertThat(forecast.appliedGrowth()).isEqualByComparingTo("0");
    assertThat(forecast.points())
        .allSatisfy(point -> assertThat(point.projectedMrr()).isEqualByComparingTo("80.00"));
  }

  @Test
  void breakdown_attributesEventsToTheirStream() {
    var at = Instant.parse("2025-02-01T00:00:00Z");
    var consumer = RevenueStream.CONSUMER;
    var whiteLabel = RevenueStream.WHITE_LABEL;
    var api = RevenueStream.API;
    var events =
        List.of(
            oneOff("golfer", TENANT, SUBSCRIPTION_CREATED, "9.99", at, "c1", consumer),
            oneOff("addon", TENANT, ADD_ON_PURCHASE, "5", at, "c1", consumer),
            oneOff("license", TENANT, SUBSCRIPTION_CREATED, "1500", at, "c2", whiteLabel),
            oneOff("setup", TENANT, SETUP_FEE, "1000", at, "c2", whiteLabel),
            oneOff("plan", TENANT, SUBSCRIPTION_CREATED, "29", at, "c3", api),
            oneOff("usage", TENANT, USAGE_CHARGE, "5", at, "c3", api),
            oneOff("refund", TENANT, REFUND, "-5", at, "c3", api));

    var breakdown = RevenueReductions.breakdown(TENANT, events, USD, DateRange.all());

    assertThat(breakdown.total()).isEqualByComparingTo("2543.99");
    assertThat(breakdown.streams())
        .extracting(StreamRevenue::stream)
        .containsExactly(
            RevenueStream.CONSUMER,
            RevenueStream.WHITE_LABEL,
            RevenueStream.ANALYTICS,
            RevenueStream.API);

    var consumerRevenue = (ConsumerRevenue) breakdown.streams().get(0);
    assertThat(consumerRevenue.subscriptionRevenue()).isEqualByComparingTo("9.99");
    assertThat(consumerRevenue.addOnRevenue()).isEqualByComparingTo("5.00");

    var whiteLabelRevenue = (WhiteLabelRevenue) breakdown.streams().get(1);
    assertThat(whiteLabelRevenue.licenseRevenue()).isEqualByComparingTo("1500.00");
    assertThat(whiteLabelRevenue.setupFees()).isEqualByComparingTo("1000.00");
    assertThat(whiteLabelRevenue.customers()).isEqualTo(1);

    var analyticsRevenue = (AnalyticsRevenue) breakdown.streams().get(2);
    assertThat(analyticsRevenue.net()).isEqualByComparingTo("0.00");

    var apiRevenue = (ApiRevenue) breakdown.streams().get(3);
    assertThat(apiRevenue.net()).isEqualByComparingTo("29.00");
    assertThat(apiRevenue.usageRevenue()).isEqualByComparingTo("5.00");
    assertThat(apiRevenue.refunds()).isEqualByComparingTo("-5.00");
  }

  @Test
  void reductionsIgnoreEventOrder() {
    var events = new ArrayList<>(portfolio());
    events.add(refund("refund", "-25", Instant.parse("2025-03-02T00:00:00Z"), "c1"));
    var jan10 = Instant.parse("2025-01-10T00:00:00Z");
    events.add(oneOff("setup", TENANT, SETUP_FEE, "300", jan10, "c2", null));
    var expectedMrr = RevenueReductions.mrr(TENANT, events, USD, MAR_15);
    var expectedRisk = RevenueReductions.churnRisk(TENANT, events, MAR_15, GRACE);
    var expectedClv = RevenueReductions.lifetimeValue("c2", events, USD, MAR_15, 12);
    var expectedBreakdown = RevenueReductions.breakdown(TENANT, events, USD, DateRange.all());

    var random = new Random(7);
    for (int run = 0; run < 10; run++) {
      var shuffled = new ArrayList<>(events);
      Collections.shuffle(shuffled, random);

      assertThat(RevenueReductions.mrr(TENANT, shuffled, USD, MAR_15)).isEqualTo(expectedMrr);
      assertThat(RevenueReductions.churnRisk(TENANT, shuffled, MAR_15, GRACE))
          .isEqualTo(expectedRisk);
      assertThat(RevenueReductions.lifetimeValue("c2", shuffled, USD, MAR_15, 12))
          .isEqualTo(expectedClv);
      assertThat(RevenueReductions.breakdown(TENANT, shuffled, USD, DateRange.all()))
          .isEqualTo(expectedBreakdown);
    }
  }

  private static RevenueEvent refund(String id, String amount, Instant at, String customerId) {
    return oneOff(id, TENANT, REFUND, amount, at, customerId, null);
  }

  /** A monthly subscription charged 100 on Jan 15 and renewed at {@code renewal} on Feb 15. */
  private static List<RevenueEvent> growingSubscription(String renewal) {
    return List.of(
        monthlyCharge(
            "s4-created",
            TENANT,
            SUBSCRIPTION_CREATED,
            "100",
            Instant.parse("2025-01-15T00:00:00Z"),
            "c4",
            "s4"),
        monthlyCharge(
            "s4-renewed",
            TENANT,
            SUBSCRIPTION_RENEWED,
            renewal,
            Instant.parse("2025-02-15T00:00:00Z"),
            "c4",
            "s4"));
  }
}
