package io.fairway.platform.billing;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.integration.payment.ChargeResult;
import io.fairway.platform.integration.payment.PaymentProcessor;
import io.fairway.platform.invoice.Invoice;
import io.fairway.platform.invoice.InvoiceLine;
import io.fairway.platform.invoice.InvoiceLineType;
import io.fairway.platform.invoice.InvoiceRepository;
import io.fairway.platform.invoice.InvoiceStatus;
import io.fairway.platform.ledger.EventSource;
import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenueLedger;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.subscription.Subscription;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Charges invoices and turns paid invoices into revenue events. Manual invoice payment and
 * automated renewals both settle through here, so they produce the same ledger entries.
 *
 * <p>One event is recorded per line type: subscription lines under the invoice's event key, other
 * types under {@code <eventKey>:<type>}. Settling an invoice twice records nothing new.
 */
@Component
public class InvoiceSettlement {

  private static final Logger log = LoggerFactory.getLogger(InvoiceSettlement.class);

  private final PaymentProcessor paymentProcessor;
  private final RevenueLedger revenueLedger;
  private final InvoiceRepository invoiceRepository;
  private final AuditService auditService;

  public InvoiceSettlement(
      PaymentProcessor paymentProcessor,
      RevenueLedger revenueLedger,
      InvoiceRepository invoiceRepository,
      AuditService auditService) {
    this.paymentProcessor = paymentProcessor;
    this.revenueLedger = revenueLedger;
    this.invoiceRepository = invoiceRepository;
    this.auditService = auditService;
  }

  /** Charges the invoice total. A zero total succeeds without reaching the processor. */
  public ChargeResult charge(Invoice invoice, String paymentMethod) {
    BigDecimal total = invoice.getTotal();
    if (total.signum() == 0) {
      return ChargeResult.succeeded(null);
    }
    if (paymentMethod == null || paymentMethod.isBlank()) {
      return ChargeResult.declined(null, "No payment method on file");
    }
    return paymentProcessor.charge(
        total, invoice.getCurrency(), paymentMethod, invoice.chargeKey());
  }

  /**
   * Records the revenue events of a successfully charged invoice and marks it PAID.
   *
   * @param subscription the subscription the invoice bills, or null for one-off invoices
   */
  public Invoice settle(
      Invoice invoice, Subscription subscription, ChargeResult result, Instant now) {
    int recorded = 0;
    for (RevenueEvent event : eventsFor(invoice, subscription, result.processorReference(), now)) {
      if (revenueLedger.findById(event.id()).isEmpty() && revenueLedger.record(event)) {
        recorded++;
      }
    }
    if (invoice.getStatus() != InvoiceStatus.PAID) {
      invoice.markPaid(result.processorReference(), now);
      invoiceRepository.save(invoice);

      auditService.log(
          AuditEventBuilder.builder()
              .eventType("invoice.paid")
              .entityType("invoice")
              .entityId(invoice.getId())
              .tenantId(invoice.getTenantId())
              .details(
                  Map.of(
                      "invoice_number",
                      invoice.getInvoiceNumber(),
                      "total",
                      invoice.getTotal().toPlainString(),
                      "currency",
                      invoice.getCurrency()))
              .build());
    }
    log.info(
        "Settled invoice {} for tenant {}: {} {} ({} events recorded)",
        invoice.getInvoiceNumber(),
        invoice.getTenantId(),
        invoice.getTotal().toPlainString(),
        invoice.getCurrency(),
        recorded);
    return invoice;
  }

  List<RevenueEvent> eventsFor(
      Invoice invoice, Subscription subscription, String processorReference, Instant now) {
    var linesByType = new EnumMap<InvoiceLineType, List<InvoiceLine>>(InvoiceLineType.class);
    for (InvoiceLine line : invoice.getLines()) {
      linesByType.computeIfAbsent(line.type(), t -> new ArrayList<>()).add(line);
    }

    var events = new ArrayList<RevenueEvent>();
    linesByType.forEach(
        (lineType, lines) -> {
          BigDecimal amount =
              lines.stream().map(InvoiceLine::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
          String id =
              lineType == InvoiceLineType.SUBSCRIPTION
                  ? invoice.eventKey()
                  : invoice.eventKey() + ":" + lineType.name().toLowerCase();
          var builder =
              RevenueEvent.builder(id, invoice.getTenantId(), eventType(lineType))
                  .amount(amount, invoice.getCurrency())
                  .occurredAt(now)
                  .customerId(invoice.getCustomerId())
                  .subscriptionId(invoice.getSubscriptionId())
                  .invoiceId(invoice.getId())
                  .stream(streamOf(subscription, lines))
                  .metadata(RevenueEvent.PROCESSOR_REFERENCE_KEY, processorReference)
                  .source(
                      processorReference != null
                          ? EventSource.PAYMENT_PROCESSOR
                          : EventSource.INTERNAL);
          if (lineType == InvoiceLineType.SUBSCRIPTION && subscription != null) {
            builder.metadata(recurringMetadata(subscription, invoice));
          }
          events.add(builder.build());
        });
    return events;
  }

  private static RevenueEventType eventType(InvoiceLineType lineType) {
    return switch (lineType) {
      case SUBSCRIPTION -> RevenueEventType.SUBSCRIPTION_RENEWED;
      case USAGE -> RevenueEventType.USAGE_CHARGE;
      case SETUP_FEE -> RevenueEventType.SETUP_FEE;
      case ADD_ON, MANUAL -> RevenueEventType.ADD_ON_PURCHASE;
    };
  }

  private static RevenueStream streamOf(Subscription subscription, List<InvoiceLine> lines) {
    if (subscription != null) {
      return subscription.getStream();
    }
    for (InvoiceLine line : lines) {
      String tag = line.metadata().get(RevenueStream.METADATA_KEY);
      if (tag != null) {
        return RevenueStream.fromTag(tag);
      }
    }
    return RevenueStream.CONSUMER;
  }

  private static Map<String, String> recurringMetadata(Subscription subscription, Invoice invoice) {
    var metadata = new LinkedHashMap<String, String>();
    metadata.put(RevenueEvent.PRICE_KEY, subscription.getPrice().toPlainString());
    metadata.put(RevenueEvent.BILLING_CYCLE_KEY, subscription.getBillingCycle().name());
    metadata.put(RevenueEvent.TIER_KEY, subscription.getTierId());
    if (invoice.getPeriodEnd() != null) {
      metadata.put(RevenueEvent.PERIOD_END_KEY, invoice.getPeriodEnd().toString());
    }
    return metadata;
  }
}
