package io.fairway.platform.subscription;

import io.fairway.platform.currency.MinorUnits;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Computes the adjustment for switching price mid-period: {@code (newPrice - oldPrice) *
 * remainingDays / totalDays}, where remaining days are the whole days left in the current period.
 * A partly used day counts as used. Rounded once, half-even, to the currency's minor unit.
 * Positive amounts are charged, negative amounts are credited.
 */
@Component
public class ProrationCalculator {

  public record Proration(BigDecimal amount, BigDecimal priceDifference, BigDecimal fraction) {

    public boolean isCharge() {
      return amount.signum() > 0;
    }

    public boolean isCredit() {
      return amount.signum() < 0;
    }
  }

  public Proration prorate(
      BigDecimal oldPrice,
      BigDecimal newPrice,
      Instant periodStart,
      Instant periodEnd,
      Instant at,
      String currency) {
    long total = ChronoUnit.DAYS.between(periodStart, periodEnd);
    if (total <= 0) {
      throw new IllegalArgumentException("Billing period must last at least one day");
    }
    long remaining = ChronoUnit.DAYS.between(at, periodEnd);
    remaining = Math.max(0, Math.min(total, remaining));

    BigDecimal difference = newPrice.subtract(oldPrice);
    BigDecimal amount =
        difference
            .multiply(BigDecimal.valueOf(remaining))
            .divide(BigDecimal.valueOf(total), MinorUnits.scale(currency), MinorUnits.ROUNDING);
    BigDecimal fraction =
        BigDecimal.valueOf(remaining).divide(BigDecimal.valueOf(total), MathContext.DECIMAL64);
    return new Proration(amount, difference, fraction);
  }
}
