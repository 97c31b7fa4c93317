package io.fairway.platform.ledger;

import java.util.Set;

/**
 * Ledger query. Null fields do not filter; a null {@code tenantId} spans every tenant and is only
 * reachable from platform-level callers.
 */
public record RevenueQuery(
    String tenantId,
    Set<RevenueEventType> types,
    DateRange range,
    String customerId,
    String subscriptionId) {

  public RevenueQuery {
    types = types == null || types.isEmpty() ? null : Set.copyOf(types);
    range = range == null ? DateRange.all() : range;
  }

  public static RevenueQuery forTenant(String tenantId) {
    return new RevenueQuery(tenantId, null, null, null, null);
  }

  public static RevenueQuery forTenant(String tenantId, DateRange range) {
    return new RevenueQuery(tenantId, null, range, null, null);
  }

  public RevenueQuery withTypes(Set<RevenueEventType> types) {
    return new RevenueQuery(tenantId, types, range, customerId, subscriptionId);
  }

  public RevenueQuery withCustomer(String customerId) {
    return new RevenueQuery(tenantId, types, range, customerId, subscriptionId);
  }

  public RevenueQuery withSubscription(String subscriptionId) {
    return new RevenueQuery(tenantId, types, range, customerId, subscriptionId);
  }

  boolean matches(RevenueEvent event) {
    return (tenantId == null || tenantId.equals(event.tenantId()))
        && (types == null || types.contains(event.type()))
        && range.contains(event.occurredAt())
        && (customerId == null || customerId.equals(event.customerId()))
        && (subscriptionId == null || subscriptionId.equals(event.subscriptionId()));
  }
}
