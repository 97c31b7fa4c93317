package io.fairway.platform.audit;

import java.util.List;

/**
 * Service interface for recording and querying audit events. Queries are tenant-scoped: they only
 * return events attributed to the given tenant.
 */
public interface AuditService {

  /**
   * Records a single audit event.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /**
   * Queries audit events for a tenant matching the given filter, newest first.
   *
   * @param tenantId tenant whose events are returned; events of other tenants are never included
   * @param filter query filter with optional entity type, entity id, actor id, event type prefix,
   *     and time range
   */
  List<AuditEvent> findEvents(String tenantId, AuditEventFilter filter);
}
