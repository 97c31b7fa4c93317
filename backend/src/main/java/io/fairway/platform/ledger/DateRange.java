package io.fairway.platform.ledger;

import java.time.Instant;

/** Half-open time range {@code [from, to)}. Either end may be null for an open bound. */
public record DateRange(Instant from, Instant to) {

  public DateRange {
    if (from != null && to != null && to.isBefore(from)) {
      throw new IllegalArgumentException("Range end " + to + " is before its start " + from);
    }
  }

  public static DateRange all() {
    return new DateRange(null, null);
  }

  public static DateRange until(Instant to) {
    return new DateRange(null, to);
  }

  public boolean contains(Instant instant) {
    return (from == null || !instant.isBefore(from)) && (to == null || instant.isBefore(to));
  }
}
