package io.fairway.platform.audit;

import java.util.Map;

/**
 * Value passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder} which auto-populates tenant, actor, source, and request metadata.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "subscription", "revenue_event")
 * @param entityId id of the affected entity
 * @param tenantId tenant the event is attributed to; null for platform-level events
 * @param actorId user id of the acting user; "system" for scheduled work
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, INTERNAL, SCHEDULED
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details key field changes; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    String entityId,
    String tenantId,
    String actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
