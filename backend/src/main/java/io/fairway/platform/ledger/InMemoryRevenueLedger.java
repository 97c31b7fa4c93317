package io.fairway.platform.ledger;

import io.fairway.platform.exception.DuplicateEventException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * {@link RevenueLedger} holding every event by id plus a time-ordered partition per tenant.
 * Appends serialize only on the event id; tenants never contend with each other.
 */
@Repository
public class InMemoryRevenueLedger implements RevenueLedger {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRevenueLedger.class);

  private record Position(Instant occurredAt, String id) {}

  private static final Comparator<Position> ORDER =
      Comparator.comparing(Position::occurredAt).thenComparing(Position::id);

  private final Map<String, RevenueEvent> byId = new ConcurrentHashMap<>();
  private final Map<String, NavigableMap<Position, RevenueEvent>> partitions =
      new ConcurrentHashMap<>();
  private final LedgerProperties properties;

  public InMemoryRevenueLedger(LedgerProperties properties) {
    this.properties = properties;
  }

  @Override
  public boolean record(RevenueEvent event) {
    RevenueEvent existing = byId.putIfAbsent(event.id(), event);
    if (existing != null) {
      if (existing.equals(event)) {
        log.debug("Revenue event {} replayed, already recorded", event.id());
        return false;
      }
      log.warn(
          "Revenue event id {} reused with a different payload (tenant={}, type={})",
          event.id(),
          event.tenantId(),
          event.type());
      throw new DuplicateEventException(event.id());
    }
    partitions
        .computeIfAbsent(event.tenantId(), k -> new ConcurrentSkipListMap<>(ORDER))
        .put(new Position(event.occurredAt(), event.id()), event);
    log.info(
        "Recorded revenue event {}: tenant={}, type={}, amount={} {}",
        event.id(),
        event.tenantId(),
        event.type(),
        event.amount().toPlainString(),
        event.currency());
    return true;
  }

  @Override
  public Optional<RevenueEvent> findById(String eventId) {
    return Optional.ofNullable(byId.get(eventId));
  }

  @Override
  public List<RevenueEvent> query(RevenueQuery query) {
    var result = new ArrayList<RevenueEvent>();
    if (query.tenantId() != null) {
      var partition = partitions.get(query.tenantId());
      if (partition != null) {
        slice(partition, query.range()).values().stream()
            .filter(query::matches)
            .forEach(result::add);
      }
      return result;
    }
    partitions
        .values()
        .forEach(
            partition ->
                slice(partition, query.range()).values().stream()
                    .filter(query::matches)
                    .forEach(result::add));
    result.sort(Comparator.comparing(RevenueEvent::occurredAt).thenComparing(RevenueEvent::id));
    return result;
  }

  @Override
  public List<RevenueEvent> replay(String tenantId) {
    var partition = partitions.get(tenantId);
    return partition == null ? List.of() : List.copyOf(partition.values());
  }

  @Override
  public LedgerMetrics metrics(String tenantId, RevenuePeriod period, Instant asOf) {
    return metrics(tenantId, period.containing(asOf));
  }

  @Override
  public LedgerMetrics metrics(String tenantId, DateRange range) {
    var events = query(new RevenueQuery(tenantId, null, range, null, null));
    return LedgerMetricsCalculator.compute(
        tenantId, range, properties.reportingCurrency(), events);
  }

  private static NavigableMap<Position, RevenueEvent> slice(
      NavigableMap<Position, RevenueEvent> partition, DateRange range) {
    if (range.from() == null && range.to() == null) {
      return partition;
    }
    if (range.from() == null) {
      return partition.headMap(new Position(range.to(), ""), false);
    }
    var lower = new Position(range.from(), "");
    if (range.to() == null) {
      return partition.tailMap(lower, true);
    }
    return partition.subMap(lower, true, new Position(range.to(), ""), false);
  }
}
