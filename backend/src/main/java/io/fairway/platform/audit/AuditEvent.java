package io.fairway.platform.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A stored audit entry. */
public record AuditEvent(
    UUID id,
    String eventType,
    String entityType,
    String entityId,
    String tenantId,
    String actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details,
    Instant occurredAt) {

  static AuditEvent from(AuditEventRecord record, Instant occurredAt) {
    return new AuditEvent(
        UUID.randomUUID(),
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.tenantId(),
        record.actorId(),
        record.actorType(),
        record.source(),
        record.ipAddress(),
        record.userAgent(),
        record.details() != null ? Map.copyOf(record.details()) : Map.of(),
        occurredAt);
  }
}
