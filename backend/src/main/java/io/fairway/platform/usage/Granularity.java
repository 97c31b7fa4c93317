package io.fairway.platform.usage;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/** Bucket widths. All buckets are aligned in UTC. */
public enum Granularity {
  MINUTE,
  HOUR,
  DAY,
  MONTH;

  public Instant truncate(Instant instant) {
    return switch (this) {
      case MINUTE -> instant.truncatedTo(ChronoUnit.MINUTES);
      case HOUR -> instant.truncatedTo(ChronoUnit.HOURS);
      case DAY -> instant.truncatedTo(ChronoUnit.DAYS);
      case MONTH ->
          instant
              .atZone(ZoneOffset.UTC)
              .toLocalDate()
              .withDayOfMonth(1)
              .atStartOfDay(ZoneOffset.UTC)
              .toInstant();
    };
  }

  /** Exclusive end of the bucket that starts at {@code bucketStart}. */
  public Instant end(Instant bucketStart) {
    return switch (this) {
      case MINUTE -> bucketStart.plus(1, ChronoUnit.MINUTES);
      case HOUR -> bucketStart.plus(1, ChronoUnit.HOURS);
      case DAY -> bucketStart.plus(1, ChronoUnit.DAYS);
      case MONTH -> bucketStart.atZone(ZoneOffset.UTC).plusMonths(1).toInstant();
    };
  }

  /** Granularity that buckets of this width are compacted into, or null for DAY and MONTH. */
  public Granularity coarser() {
    return switch (this) {
      case MINUTE -> HOUR;
      case HOUR -> DAY;
      case DAY, MONTH -> null;
    };
  }
}
