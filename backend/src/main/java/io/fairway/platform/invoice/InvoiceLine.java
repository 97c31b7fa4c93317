package io.fairway.platform.invoice;

import io.fairway.platform.currency.MinorUnits;
import java.math.BigDecimal;
import java.util.Map;

/**
 * One charge on an invoice. {@code amount} is always {@code unitAmount × quantity} rounded to the
 * currency's minor units.
 */
public record InvoiceLine(
    String description,
    BigDecimal unitAmount,
    BigDecimal quantity,
    BigDecimal amount,
    InvoiceLineType type,
    Map<String, String> metadata) {

  public InvoiceLine {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static InvoiceLine of(
      String description,
      BigDecimal unitAmount,
      BigDecimal quantity,
      String currency,
      InvoiceLineType type,
      Map<String, String> metadata) {
    if (quantity.signum() < 0) {
      throw new IllegalArgumentException("Line quantity must not be negative");
    }
    BigDecimal amount = MinorUnits.round(unitAmount.multiply(quantity), currency);
    return new InvoiceLine(description, unitAmount, quantity, amount, type, metadata);
  }

  /** A single-unit line carrying an already-priced amount. */
  public static InvoiceLine flat(
      String description, BigDecimal amount, String currency, InvoiceLineType type) {
    return of(description, amount, BigDecimal.ONE, currency, type, Map.of());
  }
}
