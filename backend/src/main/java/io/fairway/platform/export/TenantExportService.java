package io.fairway.platform.export;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.customer.Customer;
import io.fairway.platform.customer.CustomerRepository;
import io.fairway.platform.invoice.Invoice;
import io.fairway.platform.invoice.InvoiceRepository;
import io.fairway.platform.ledger.RevenueLedger;
import io.fairway.platform.security.Action;
import io.fairway.platform.security.IsolationGuard;
import io.fairway.platform.security.ResourceType;
import io.fairway.platform.security.TargetResource;
import io.fairway.platform.subscription.Subscription;
import io.fairway.platform.subscription.SubscriptionRepository;
import io.fairway.platform.tenant.Tenant;
import io.fairway.platform.tenant.TenantRegistry;
import io.fairway.platform.usage.Granularity;
import io.fairway.platform.usage.UsageMeter;
import io.fairway.platform.usage.UsageRecord;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Builds {@link TenantExport} snapshots. */
@Service
public class TenantExportService {

  private static final Logger log = LoggerFactory.getLogger(TenantExportService.class);

  private final TenantRegistry tenantRegistry;
  private final CustomerRepository customerRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final InvoiceRepository invoiceRepository;
  private final UsageMeter usageMeter;
  private final RevenueLedger revenueLedger;
  private final IsolationGuard isolationGuard;
  private final AuditService auditService;
  private final Clock clock;

  public TenantExportService(
      TenantRegistry tenantRegistry,
      CustomerRepository customerRepository,
      SubscriptionRepository subscriptionRepository,
      InvoiceRepository invoiceRepository,
      UsageMeter usageMeter,
      RevenueLedger revenueLedger,
      IsolationGuard isolationGuard,
      AuditService auditService,
      Clock clock) {
    this.tenantRegistry = tenantRegistry;
    this.customerRepository = customerRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.invoiceRepository = invoiceRepository;
    this.usageMeter = usageMeter;
    this.revenueLedger = revenueLedger;
    this.isolationGuard = isolationGuard;
    this.auditService = auditService;
    this.clock = clock;
  }

  public TenantExport export(UUID tenantId) {
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.EXPORT, tenantId, tenantId), Action.READ);
    var tenant = tenantRegistry.resolveTenant(tenantId);
    String id = tenantId.toString();

    var customers =
        customerRepository.findByTenantId(id).stream()
            .sorted(Comparator.comparing(Customer::getCreatedAt).thenComparing(Customer::getId))
            .map(TenantExportService::toExport)
            .toList();
    var subscriptions =
        subscriptionRepository.findByTenantId(id).stream()
            .sorted(
                Comparator.comparing(Subscription::getCreatedAt)
                    .thenComparing(Subscription::getId))
            .map(TenantExportService::toExport)
            .toList();
    var invoices =
        invoiceRepository.findByTenantId(id).stream()
            .sorted(Comparator.comparing(Invoice::getCreatedAt).thenComparing(Invoice::getId))
            .map(TenantExportService::toExport)
            .toList();
    var events = revenueLedger.replay(id);

    var export =
        new TenantExport(
            clock.instant(),
            toExport(tenant),
            customers,
            subscriptions,
            invoices,
            usage(id),
            events);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("tenant.export.generated")
            .entityType("tenant")
            .entityId(tenantId)
            .tenantId(id)
            .details(
                Map.of(
                    "customers", customers.size(),
                    "subscriptions", subscriptions.size(),
                    "invoices", invoices.size(),
                    "revenue_events", events.size()))
            .build());
    log.info(
        "Generated export for tenant {}: {} customers, {} subscriptions, {} revenue events",
        tenantId,
        customers.size(),
        subscriptions.size(),
        events.size());
    return export;
  }

  /** Every retained bucket, coarsest first. */
  private List<UsageRecord> usage(String tenantId) {
    var records = new ArrayList<UsageRecord>();
    for (Granularity granularity :
        List.of(Granularity.MONTH, Granularity.DAY, Granularity.HOUR, Granularity.MINUTE)) {
      records.addAll(usageMeter.records(tenantId, granularity, null, null));
    }
    return records;
  }

  private static TenantExport.ExportTenant toExport(Tenant tenant) {
    return new TenantExport.ExportTenant(
        tenant.getId(),
        tenant.getSlug(),
        tenant.getDisplayName(),
        tenant.getType().name(),
        tenant.getParentId(),
        tenant.getStatus().name(),
        tenant.getFeatureFlags(),
        tenant.getCreatedAt());
  }

  private static TenantExport.ExportCustomer toExport(Customer customer) {
    return new TenantExport.ExportCustomer(
        customer.getId(),
        customer.getEmail(),
        customer.getDisplayName(),
        customer.getMetadata(),
        customer.getCreatedAt());
  }

  private static TenantExport.ExportSubscription toExport(Subscription subscription) {
    return new TenantExport.ExportSubscription(
        subscription.getId(),
        subscription.getCustomerId(),
        subscription.getTierId(),
        subscription.getBillingCycle().name(),
        subscription.getPrice(),
        subscription.getCurrency(),
        subscription.getStatus().name(),
        subscription.getCurrentPeriodStart(),
        subscription.getCurrentPeriodEnd(),
        subscription.getCanceledAt(),
        subscription.getCancellationReason() != null
            ? subscription.getCancellationReason().name()
            : null,
        subscription.getCreatedAt());
  }

  private static TenantExport.ExportInvoice toExport(Invoice invoice) {
    return new TenantExport.ExportInvoice(
        invoice.getId(),
        invoice.getInvoiceNumber(),
        invoice.getCustomerId(),
        invoice.getSubscriptionId(),
        invoice.getStatus().name(),
        invoice.getCurrency(),
        invoice.getTotal(),
        invoice.getDueDate(),
        invoice.getLines());
  }
}
