package io.fairway.platform.ledger;

/** Business line a revenue event is attributed to, carried in the {@code stream} metadata tag. */
public enum RevenueStream {
  CONSUMER,
  WHITE_LABEL,
  ANALYTICS,
  API;

  public static final String METADATA_KEY = "stream";

  /** Events without a recognised tag are attributed to {@link #CONSUMER}. */
  public static RevenueStream of(RevenueEvent event) {
    return fromTag(event.metadata().get(METADATA_KEY));
  }

  /** Parses a tag such as {@code white-label}; unknown or missing tags map to {@link #CONSUMER}. */
  public static RevenueStream fromTag(String tag) {
    if (tag == null) {
      return CONSUMER;
    }
    try {
      return valueOf(tag.trim().toUpperCase().replace('-', '_'));
    } catch (IllegalArgumentException e) {
      return CONSUMER;
    }
  }
}
