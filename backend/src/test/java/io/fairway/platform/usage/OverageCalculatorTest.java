package io.fairway.platform.usage;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OverageCalculatorTest {

  private static final long GIB = OverageCalculator.GIB;

  private final OverageCalculator calculator = new OverageCalculator();

  private final UsageAllowance allowance =
      new UsageAllowance(
          1_000,
          GIB,
          10 * GIB,
          new BigDecimal("0.01"),
          new BigDecimal("2.00"),
          new BigDecimal("1.00"),
          "USD");

  @Test
  void callsAboveAllowance_areBilledPerCall() {
    var summary = calculator.calculate(allowance, Map.of(QuotaType.API_CALLS, 1_500L));

    assertThat(summary.total()).isEqualByComparingTo("5.00");
    assertThat(summary.currency()).isEqualTo("USD");
    var calls =
        summary.charges().stream()
            .filter(c -> c.quotaType() == QuotaType.API_CALLS)
            .findFirst()
            .orElseThrow();
    assertThat(calls.included()).isEqualTo(1_000);
    assertThat(calls.actual()).isEqualTo(1_500);
    assertThat(calls.overageUnits()).isEqualTo(500);
    assertThat(calls.amount()).isEqualByComparingTo("5.00");
  }

  @Test
  void usageWithinAllowance_costsNothing() {
    var summary =
        calculator.calculate(
            allowance,
            Map.of(QuotaType.API_CALLS, 1_000L, QuotaType.STORAGE, GIB, QuotaType.BANDWIDTH, 0L));

    assertThat(summary.total()).isEqualByComparingTo("0.00");
    assertThat(summary.charges()).allMatch(c -> c.overageUnits() == 0);
  }

  @Test
  void storageIsBilledPerStartedGib() {
    var charge = calculator.charge(allowance, QuotaType.STORAGE, GIB + 1);

    assertThat(charge.overageUnits()).isEqualTo(1);
    assertThat(charge.amount()).isEqualByComparingTo("2.00");
  }

  @Test
  void everyQuotaTypeContributesToTheTotal() {
    var summary =
        calculator.calculate(
            allowance,
            Map.of(
                QuotaType.API_CALLS, 1_001L,
                QuotaType.STORAGE, 3 * GIB,
                QuotaType.BANDWIDTH, 12 * GIB + 5));

    // 1 call at 0.01, 2 GiB at 2.00, 3 started GiB at 1.00
    assertThat(summary.total()).isEqualByComparingTo("7.01");
    assertThat(summary.charges()).hasSize(QuotaType.values().length);
  }

  @Test
  void missingUsage_countsAsZero() {
    var summary = calculator.calculate(allowance, Map.of());

    assertThat(summary.total()).isEqualByComparingTo("0.00");
  }
}
