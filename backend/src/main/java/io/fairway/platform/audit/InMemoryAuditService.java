package io.fairway.platform.audit;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory implementation of {@link AuditService}. Events are partitioned by tenant so appends for
 * one tenant never contend with another's. Platform-level events (no tenant) live under a
 * dedicated partition.
 */
@Service
public class InMemoryAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuditService.class);

  static final String PLATFORM_PARTITION = "_platform";

  private final Map<String, ConcurrentLinkedQueue<AuditEvent>> partitions =
      new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryAuditService(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void log(AuditEventRecord record) {
    var event = AuditEvent.from(record, clock.instant());
    String partition = record.tenantId() != null ? record.tenantId() : PLATFORM_PARTITION;
    partitions.computeIfAbsent(partition, k -> new ConcurrentLinkedQueue<>()).add(event);
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, tenant={}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.tenantId(),
        record.actorId());
  }

  @Override
  public List<AuditEvent> findEvents(String tenantId, AuditEventFilter filter) {
    var partition = partitions.get(tenantId);
    if (partition == null) {
      return List.of();
    }
    return partition.stream()
        .filter(filter::matches)
        .sorted(Comparator.comparing(AuditEvent::occurredAt).reversed())
        .toList();
  }
}
