package io.fairway.platform.ledger;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/** Calendar reporting periods, aligned in UTC. */
public enum RevenuePeriod {
  DAILY,
  WEEKLY,
  MONTHLY,
  QUARTERLY,
  YEARLY;

  /** The period of this kind that contains {@code asOf}. */
  public DateRange containing(Instant asOf) {
    LocalDate date = asOf.atZone(ZoneOffset.UTC).toLocalDate();
    LocalDate start =
        switch (this) {
          case DAILY -> date;
          case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
          case MONTHLY -> date.withDayOfMonth(1);
          case QUARTERLY ->
              date.withDayOfMonth(1).withMonth(date.getMonth().firstMonthOfQuarter().getValue());
          case YEARLY -> date.withDayOfYear(1);
        };
    return new DateRange(toInstant(start), toInstant(advance(start)));
  }

  /** The period immediately before the one containing {@code asOf}. */
  public DateRange preceding(Instant asOf) {
    Instant start = containing(asOf).from();
    return containing(start.minusNanos(1));
  }

  private LocalDate advance(LocalDate start) {
    return switch (this) {
      case DAILY -> start.plusDays(1);
      case WEEKLY -> start.plusWeeks(1);
      case MONTHLY -> start.plusMonths(1);
      case QUARTERLY -> start.plusMonths(3);
      case YEARLY -> start.plusYears(1);
    };
  }

  private static Instant toInstant(LocalDate date) {
    return date.atStartOfDay(ZoneOffset.UTC).toInstant();
  }
}
