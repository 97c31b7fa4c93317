package io.fairway.platform.tenant;

public enum SuspensionReason {
  NON_PAYMENT,
  VIOLATION,
  SECURITY,
  ABUSE,
  MAINTENANCE,
  REQUESTED,
  OTHER
}
