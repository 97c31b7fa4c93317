package io.fairway.platform.currency;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;

/**
 * Rounds monetary amounts to the minor-unit precision of their ISO-4217 currency (2 for USD, 0 for
 * JPY, 3 for BHD). All money produced by this system is rounded half-even.
 */
public final class MinorUnits {

  public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

  private MinorUnits() {}

  public static int scale(String currency) {
    int digits = Currency.getInstance(currency.toUpperCase()).getDefaultFractionDigits();
    return digits < 0 ? 0 : digits;
  }

  public static BigDecimal round(BigDecimal amount, String currency) {
    return amount.setScale(scale(currency), ROUNDING);
  }

  public static BigDecimal zero(String currency) {
    return BigDecimal.ZERO.setScale(scale(currency));
  }

  /** Returns the amount in the currency's smallest unit (cents for USD). */
  public static long toSmallestUnit(BigDecimal amount, String currency) {
    return round(amount, currency).movePointRight(scale(currency)).longValueExact();
  }

  /** Normalizes and validates an ISO-4217 code. */
  public static String normalize(String currency) {
    if (currency == null || currency.isBlank()) {
      throw new IllegalArgumentException("Currency code is required");
    }
    return Currency.getInstance(currency.trim().toUpperCase()).getCurrencyCode();
  }
}
