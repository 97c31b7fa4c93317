package io.fairway.platform.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of {@link RevenueEvent}s. Events are never updated or deleted; corrections are
 * new offsetting events.
 */
public interface RevenueLedger {

  /**
   * Appends {@code event} unless an event with the same id exists.
   *
   * @return true when appended, false when an identical event was already recorded
   * @throws io.fairway.platform.exception.DuplicateEventException if the id is taken by an event
   *     with a different payload
   */
  boolean record(RevenueEvent event);

  Optional<RevenueEvent> findById(String eventId);

  /** Matching events ordered by occurrence time, then id. */
  List<RevenueEvent> query(RevenueQuery query);

  /** Every event of a tenant in the order a rebuild would apply them. */
  List<RevenueEvent> replay(String tenantId);

  /** Metrics for the calendar period of kind {@code period} containing {@code asOf}. */
  LedgerMetrics metrics(String tenantId, RevenuePeriod period, Instant asOf);

  /** Metrics over an explicit range. A null tenant spans every tenant. */
  LedgerMetrics metrics(String tenantId, DateRange range);
}
