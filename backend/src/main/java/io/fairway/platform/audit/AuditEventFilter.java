package io.fairway.platform.audit;

import java.time.Instant;

/**
 * Query filter record for {@link AuditService#findEvents}. All fields are nullable -- null means
 * "no filter on this field".
 *
 * @param entityType filter by entity kind (e.g., "subscription", "tenant")
 * @param entityId filter by specific entity
 * @param actorId filter by acting user
 * @param eventType filter by event type (prefix match -- "security." matches
 *     security.cross_tenant_violation)
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record AuditEventFilter(
    String entityType,
    String entityId,
    String actorId,
    String eventType,
    Instant from,
    Instant to) {

  public static AuditEventFilter all() {
    return new AuditEventFilter(null, null, null, null, null, null);
  }

  public static AuditEventFilter byEventType(String eventTypePrefix) {
    return new AuditEventFilter(null, null, null, eventTypePrefix, null, null);
  }

  boolean matches(AuditEvent event) {
    return (entityType == null || entityType.equals(event.entityType()))
        && (entityId == null || entityId.equals(event.entityId()))
        && (actorId == null || actorId.equals(event.actorId()))
        && (eventType == null || event.eventType().startsWith(eventType))
        && (from == null || !event.occurredAt().isBefore(from))
        && (to == null || event.occurredAt().isBefore(to));
  }
}
