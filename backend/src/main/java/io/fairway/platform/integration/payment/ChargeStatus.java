package io.fairway.platform.integration.payment;

public enum ChargeStatus {
  /** Money captured. */
  SUCCEEDED,
  /** Definitive refusal; retrying with the same instrument may or may not help later. */
  DECLINED,
  /** Outcome unknown. Retry with the same idempotency key. */
  ERROR
}
