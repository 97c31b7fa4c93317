package io.fairway.platform.subscription;

public enum CancellationReason {
  USER_REQUESTED,
  PAYMENT_FAILED,
  FRAUDULENT,
  PRICE,
  FEATURE_LACK,
  COMPETITOR,
  BUSINESS_CLOSURE,
  DOWNGRADE,
  DUPLICATE,
  OTHER
}
