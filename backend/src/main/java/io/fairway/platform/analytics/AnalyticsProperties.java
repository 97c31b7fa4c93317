package io.fairway.platform.analytics;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Analytics tuning.
 *
 * @param maxMonthlyGrowth bound on the month-over-month growth rate a forecast may apply, as a
 *     fraction (0.25 = 25%)
 * @param churnGracePeriod how long past its expected renewal a customer may go before counting as
 *     at risk
 * @param clvHorizonMonths months a lifetime value projects forward
 */
@ConfigurationProperties(prefix = "fairway.analytics")
public record AnalyticsProperties(
    BigDecimal maxMonthlyGrowth, Duration churnGracePeriod, int clvHorizonMonths) {

  public AnalyticsProperties {
    maxMonthlyGrowth =
        maxMonthlyGrowth != null ? maxMonthlyGrowth.abs() : new BigDecimal("0.25");
    churnGracePeriod = churnGracePeriod != null ? churnGracePeriod : Duration.ofDays(7);
    clvHorizonMonths = clvHorizonMonths > 0 ? clvHorizonMonths : 12;
  }
}
