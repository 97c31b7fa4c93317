package io.fairway.platform.integration.payment;

import java.math.BigDecimal;

/**
 * Port to the external payment processor. Implementations must honour the idempotency key: a
 * repeated call with the same key never charges twice.
 *
 * <p>Implementations report outcomes through {@link ChargeResult} rather than exceptions; network
 * failures and timeouts surface as {@link ChargeStatus#ERROR}.
 */
public interface PaymentProcessor {

  /** Unique provider identifier (e.g., "stripe", "simulated"). */
  String providerId();

  /**
   * Charges {@code amount} to the payment method {@code token}.
   *
   * @param amount positive amount in major units
   * @param currency ISO-4217 code
   * @param token payment method reference issued by the processor
   * @param idempotencyKey stable key for this logical charge
   */
  ChargeResult charge(BigDecimal amount, String currency, String token, String idempotencyKey);

  /** Refunds {@code amount} of the payment {@code processorReference}. */
  ChargeResult refund(
      String processorReference, BigDecimal amount, String currency, String idempotencyKey);
}
