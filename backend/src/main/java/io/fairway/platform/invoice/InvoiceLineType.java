package io.fairway.platform.invoice;

public enum InvoiceLineType {
  SUBSCRIPTION,
  USAGE,
  SETUP_FEE,
  ADD_ON,
  MANUAL
}
