package io.fairway.platform.ledger;

public enum EventSource {
  PAYMENT_PROCESSOR,
  INTERNAL,
  MANUAL
}
