package io.fairway.platform.analytics;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * MRR projected forward at a bounded month-over-month growth rate.
 *
 * @param observedGrowth growth between the last two complete months, before clamping
 * @param appliedGrowth observed growth clamped to the configured bound
 */
public record RevenueForecast(
    String tenantId,
    Instant asOf,
    String currency,
    BigDecimal currentMrr,
    BigDecimal observedGrowth,
    BigDecimal appliedGrowth,
    List<Point> points) {

  /**
   * @param monthsAhead 1 for the month after {@code asOf}
   * @param monthStart first instant of the forecast month
   */
  public record Point(int monthsAhead, Instant monthStart, BigDecimal projectedMrr) {}
}
