package io.fairway.platform.export;

import io.fairway.platform.invoice.InvoiceLine;
import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.usage.UsageRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Full snapshot of one tenant's data. Every collection is filtered to the tenant named in {@code
 * tenant}; payment-method tokens are never exported.
 */
public record TenantExport(
    Instant generatedAt,
    ExportTenant tenant,
    List<ExportCustomer> customers,
    List<ExportSubscription> subscriptions,
    List<ExportInvoice> invoices,
    List<UsageRecord> usage,
    List<RevenueEvent> revenueEvents) {

  public record ExportTenant(
      UUID id,
      String slug,
      String displayName,
      String type,
      UUID parentId,
      String status,
      Set<String> featureFlags,
      Instant createdAt) {}

  public record ExportCustomer(
      UUID id, String email, String displayName, Map<String, String> metadata, Instant createdAt) {}

  public record ExportSubscription(
      UUID id,
      UUID customerId,
      String tierId,
      String billingCycle,
      BigDecimal price,
      String currency,
      String status,
      Instant currentPeriodStart,
      Instant currentPeriodEnd,
      Instant canceledAt,
      String cancellationReason,
      Instant createdAt) {}

  public record ExportInvoice(
      UUID id,
      String invoiceNumber,
      UUID customerId,
      UUID subscriptionId,
      String status,
      String currency,
      BigDecimal total,
      LocalDate dueDate,
      List<InvoiceLine> lines) {}
}
