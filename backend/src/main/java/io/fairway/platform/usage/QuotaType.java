package io.fairway.platform.usage;

public enum QuotaType {
  /** Metered API calls per calendar month. */
  API_CALLS,
  /** Bytes transferred per calendar month. */
  BANDWIDTH,
  /** Bytes currently stored; a gauge, not a counter. */
  STORAGE
}
