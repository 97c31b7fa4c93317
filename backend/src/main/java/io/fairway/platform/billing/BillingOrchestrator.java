package io.fairway.platform.billing;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.customer.Customer;
import io.fairway.platform.customer.CustomerRepository;
import io.fairway.platform.exception.DuplicateEventException;
import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.exception.InvalidStateTransitionException;
import io.fairway.platform.exception.PaymentDeclinedException;
import io.fairway.platform.exception.PaymentProcessorException;
import io.fairway.platform.exception.ResourceConflictException;
import io.fairway.platform.exception.ResourceNotFoundException;
import io.fairway.platform.integration.payment.ChargeResult;
import io.fairway.platform.integration.payment.ChargeStatus;
import io.fairway.platform.integration.payment.PaymentProcessor;
import io.fairway.platform.invoice.Invoice;
import io.fairway.platform.invoice.InvoiceLine;
import io.fairway.platform.invoice.InvoiceRepository;
import io.fairway.platform.invoice.InvoiceStatus;
import io.fairway.platform.ledger.EventSource;
import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenueLedger;
import io.fairway.platform.ledger.RevenueQuery;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.multitenancy.TenantContext;
import io.fairway.platform.security.Action;
import io.fairway.platform.security.IsolationGuard;
import io.fairway.platform.security.ResourceType;
import io.fairway.platform.security.TargetResource;
import io.fairway.platform.subscription.SubscriptionLocks;
import io.fairway.platform.subscription.SubscriptionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Money movement for a tenant: customers, one-off charges, invoices, refunds, manual ledger
 * corrections and the automated billing cycle.
 *
 * <p>Every successful charge ends as exactly one revenue event. The event id doubles as the
 * processor idempotency key, so a retried request never charges twice. Declines surface as {@link
 * PaymentDeclinedException}; processor errors and timeouts are ambiguous and surface as {@link
 * PaymentProcessorException}, to be retried with the same id.
 */
@Service
public class BillingOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(BillingOrchestrator.class);

  private static final Set<RevenueEventType> ONE_OFF_CHARGES =
      EnumSet.of(
          RevenueEventType.SETUP_FEE,
          RevenueEventType.ADD_ON_PURCHASE,
          RevenueEventType.USAGE_CHARGE);

  private final CustomerRepository customerRepository;
  private final InvoiceRepository invoiceRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionLocks subscriptionLocks;
  private final RefundLocks refundLocks;
  private final RevenueLedger revenueLedger;
  private final PaymentProcessor paymentProcessor;
  private final InvoiceSettlement invoiceSettlement;
  private final AutomatedBillingCycle automatedBillingCycle;
  private final IsolationGuard isolationGuard;
  private final AuditService auditService;
  private final BillingProperties properties;
  private final Clock clock;

  public BillingOrchestrator(
      CustomerRepository customerRepository,
      InvoiceRepository invoiceRepository,
      SubscriptionRepository subscriptionRepository,
      SubscriptionLocks subscriptionLocks,
      RefundLocks refundLocks,
      RevenueLedger revenueLedger,
      PaymentProcessor paymentProcessor,
      InvoiceSettlement invoiceSettlement,
      AutomatedBillingCycle automatedBillingCycle,
      IsolationGuard isolationGuard,
      AuditService auditService,
      BillingProperties properties,
      Clock clock) {
    this.customerRepository = customerRepository;
    this.invoiceRepository = invoiceRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.subscriptionLocks = subscriptionLocks;
    this.refundLocks = refundLocks;
    this.revenueLedger = revenueLedger;
    this.paymentProcessor = paymentProcessor;
    this.invoiceSettlement = invoiceSettlement;
    this.automatedBillingCycle = automatedBillingCycle;
    this.isolationGuard = isolationGuard;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  // --- Customers ---

  public Customer createCustomer(
      String email, String displayName, Map<String, String> metadata, String paymentMethod) {
    return createCustomer(email, displayName, metadata, paymentMethod, null);
  }

  /**
   * Creates a customer of the current tenant.
   *
   * @param userId platform user the customer represents, or null
   */
  public Customer createCustomer(
      String email,
      String displayName,
      Map<String, String> metadata,
      String paymentMethod,
      String userId) {
    String tenantId = TenantContext.requireTenantId();
    var customer =
        new Customer(
            tenantId, email, displayName, metadata, paymentMethod, userId, clock.instant());
    if (!customerRepository.insert(customer)) {
      throw new ResourceConflictException(
          "Customer already exists", "A customer with email " + email + " already exists");
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("customer.created")
            .entityType("customer")
            .entityId(customer.getId())
            .details(Map.of("email", customer.getEmail()))
            .build());
    log.info("Created customer {} in tenant {}", customer.getId(), tenantId);
    return customer;
  }

  public Customer getCustomer(UUID customerId) {
    return requireCustomer(customerId, Action.READ);
  }

  public List<Customer> listCustomers() {
    return customerRepository.findByTenantId(TenantContext.requireTenantId());
  }

  public Customer updatePaymentMethod(UUID customerId, String paymentMethod) {
    var customer = requireCustomer(customerId, Action.WRITE);
    customer.updatePaymentMethod(paymentMethod, clock.instant());
    return customerRepository.save(customer);
  }

  // --- Payments ---

  /**
   * Charges one logical payment and records it. Submitting a request whose event is already in
   * the ledger returns that event without reaching the processor.
   *
   * @throws PaymentDeclinedException if the processor declines
   * @throws PaymentProcessorException if the outcome is unknown
   */
  public RevenueEvent processPayment(ChargeRequest request) {
    if (request.amount() == null || request.amount().signum() < 0) {
      throw new InvalidRequestException("Invalid amount", "Charge amount must not be negative");
    }
    var existing = revenueLedger.findById(request.eventId());
    if (existing.isPresent()) {
      if (!existing.get().tenantId().equals(request.tenantId())) {
        throw new ResourceConflictException(
            "Event id in use", "Event id " + request.eventId() + " is already in use");
      }
      log.info("Payment {} already recorded, skipping charge", request.eventId());
      return existing.get();
    }

    ChargeResult result;
    if (request.amount().signum() == 0) {
      result = ChargeResult.succeeded(null);
    } else if (request.paymentMethod() == null || request.paymentMethod().isBlank()) {
      result = ChargeResult.declined(null, "No payment method on file");
    } else {
      result =
          paymentProcessor.charge(
              request.amount(), request.currency(), request.paymentMethod(), request.eventId());
    }
    requireSucceeded(result, request.tenantId(), request.eventId(), request.eventId());

    var event =
        RevenueEvent.builder(request.eventId(), request.tenantId(), request.type())
            .amount(request.amount(), request.currency())
            .occurredAt(clock.instant())
            .customerId(request.customerId())
            .subscriptionId(request.subscriptionId())
            .stream(request.stream() != null ? request.stream() : RevenueStream.CONSUMER)
            .metadata(request.metadata())
            .metadata(RevenueEvent.PROCESSOR_REFERENCE_KEY, result.processorReference())
            .source(
                result.processorReference() != null
                    ? EventSource.PAYMENT_PROCESSOR
                    : EventSource.INTERNAL)
            .build();
    try {
      revenueLedger.record(event);
    } catch (DuplicateEventException e) {
      // a concurrent submission of the same charge recorded first
      log.info("Payment {} recorded concurrently, returning stored event", event.id());
      return revenueLedger.findById(event.id()).orElseThrow(() -> e);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.succeeded")
            .entityType("revenue_event")
            .entityId(event.id())
            .tenantId(request.tenantId())
            .details(
                Map.of(
                    "type", event.type().name(),
                    "amount", event.amount().toPlainString(),
                    "currency", event.currency()))
            .build());
    log.info(
        "Recorded {} {} {} for tenant {}",
        event.type(),
        event.amount().toPlainString(),
        event.currency(),
        event.tenantId());
    return event;
  }

  /** Charges a customer of the current tenant for a one-off item. */
  public RevenueEvent chargeCustomer(
      UUID customerId,
      String eventId,
      RevenueEventType type,
      BigDecimal amount,
      String currency,
      RevenueStream stream,
      String paymentMethod) {
    if (!ONE_OFF_CHARGES.contains(type)) {
      throw new InvalidRequestException(
          "Invalid charge type", type + " cannot be charged directly");
    }
    var customer = requireCustomer(customerId, Action.WRITE);
    return processPayment(
        new ChargeRequest(
            eventId != null ? eventId : type.name().toLowerCase() + ":" + UUID.randomUUID(),
            customer.getTenantId(),
            type,
            amount,
            currency,
            paymentMethod != null ? paymentMethod : customer.getDefaultPaymentMethod(),
            customer.getId().toString(),
            null,
            stream,
            Map.of()));
  }

  public RevenueEvent recordSetupFee(
      UUID customerId, String eventId, BigDecimal amount, String currency, RevenueStream stream) {
    return chargeCustomer(
        customerId, eventId, RevenueEventType.SETUP_FEE, amount, currency, stream, null);
  }

  // --- Invoices ---

  public Invoice createInvoice(
      UUID customerId,
      UUID subscriptionId,
      String currency,
      LocalDate dueDate,
      List<InvoiceLine> lines) {
    var customer = requireCustomer(customerId, Action.WRITE);
    if (subscriptionId != null) {
      var subscription =
          subscriptionRepository
              .findById(subscriptionId)
              .orElseThrow(() -> new ResourceNotFoundException("Subscription", subscriptionId));
      if (!subscription.getCustomerId().equals(customerId)) {
        throw new InvalidRequestException(
            "Invalid subscription", "Subscription does not belong to customer " + customerId);
      }
    }
    Instant now = clock.instant();
    var invoice =
        new Invoice(
            customer.getTenantId(),
            customerId,
            subscriptionId,
            invoiceRepository.nextInvoiceNumber(customer.getTenantId()),
            currency,
            dueDate != null
                ? dueDate
                : LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(properties.invoiceDueDays()),
            now);
    for (InvoiceLine line : lines) {
      invoice.addLine(line, now);
    }
    invoiceRepository.save(invoice);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.created")
            .entityType("invoice")
            .entityId(invoice.getId())
            .details(Map.of("invoice_number", invoice.getInvoiceNumber()))
            .build());
    log.info("Created invoice {} for customer {}", invoice.getInvoiceNumber(), customerId);
    return invoice;
  }

  public Invoice getInvoice(UUID invoiceId) {
    return requireInvoice(invoiceId, Action.READ);
  }

  public List<Invoice> listInvoices() {
    return invoiceRepository.findByTenantId(TenantContext.requireTenantId());
  }

  public Invoice sendInvoice(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId, Action.WRITE);
    if (invoice.getLines().isEmpty()) {
      throw new InvalidRequestException("Empty invoice", "Cannot send an invoice without lines");
    }
    invoice.markSent(clock.instant());
    invoiceRepository.save(invoice);
    log.info("Sent invoice {}", invoice.getInvoiceNumber());
    return invoice;
  }

  /**
   * Charges an issued invoice. Paying a renewal invoice that dunning gave up on also moves its
   * subscription into the paid period and clears the dunning flags.
   */
  public Invoice payInvoice(UUID invoiceId, String paymentMethod) {
    var invoice = requireInvoice(invoiceId, Action.WRITE);
    if (invoice.getStatus() != InvoiceStatus.SENT
        && invoice.getStatus() != InvoiceStatus.OVERDUE) {
      throw new InvalidStateTransitionException("invoice", invoice.getStatus(), "pay");
    }
    String token =
        paymentMethod != null
            ? paymentMethod
            : customerRepository
                .findById(invoice.getCustomerId())
                .map(Customer::getDefaultPaymentMethod)
                .orElse(null);

    Instant now = clock.instant();
    invoice.recordAttempt(now);
    invoiceRepository.save(invoice);

    var result = invoiceSettlement.charge(invoice, token);
    if (result.status() == ChargeStatus.DECLINED) {
      invoice.recordDecline(now);
      invoiceRepository.save(invoice);
    }
    requireSucceeded(result, invoice.getTenantId(), invoice.eventKey(), invoice.chargeKey());

    if (invoice.getSubscriptionId() == null) {
      return invoiceSettlement.settle(invoice, null, result, now);
    }
    return subscriptionLocks.withLock(
        invoice.getSubscriptionId(),
        () -> {
          var subscription =
              subscriptionRepository.findById(invoice.getSubscriptionId()).orElse(null);
          var paid = invoiceSettlement.settle(invoice, subscription, result, now);
          if (subscription != null
              && subscription.getStatus().isLive()
              && paid.getPeriodStart() != null
              && subscription.getCurrentPeriodEnd().equals(paid.getPeriodStart())) {
            subscription.advancePeriod(now);
            subscriptionRepository.save(subscription);
          }
          return paid;
        });
  }

  public Invoice voidInvoice(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId, Action.WRITE);
    invoice.voidInvoice(clock.instant());
    invoiceRepository.save(invoice);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.voided")
            .entityType("invoice")
            .entityId(invoice.getId())
            .details(Map.of("invoice_number", invoice.getInvoiceNumber()))
            .build());
    return invoice;
  }

  /** Moves SENT invoices past their due date to OVERDUE. Returns how many moved. */
  public int markOverdueInvoices() {
    Instant now = clock.instant();
    LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
    int marked = 0;
    for (Invoice invoice : invoiceRepository.findByStatus(InvoiceStatus.SENT)) {
      if (!invoice.isPastDue(today)) {
        continue;
      }
      invoice.markOverdue(now);
      invoiceRepository.save(invoice);
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("invoice.overdue")
              .entityType("invoice")
              .entityId(invoice.getId())
              .tenantId(invoice.getTenantId())
              .details(Map.of("due_date", invoice.getDueDate().toString()))
              .build());
      marked++;
    }
    if (marked > 0) {
      log.info("Marked {} invoices overdue", marked);
    }
    return marked;
  }

  // --- Ledger corrections ---

  /**
   * Refunds part or all of a recorded charge by appending an offsetting REFUND event. Charges that
   * went through the processor are refunded there first.
   *
   * <p>Refunds of one charge are serialized. Without a {@code refundId} the key is derived from
   * the number of refunds already recorded against the charge, so retrying after a processor error
   * reuses the key of the failed attempt.
   *
   * @param refundId idempotency key of this refund; derived when null
   */
  public RevenueEvent refund(String eventId, String refundId, BigDecimal amount, String reason) {
    var original =
        revenueLedger
            .findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Revenue event", eventId));
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.REVENUE, eventId, original.tenantId()), Action.WRITE);
    if (original.type() == RevenueEventType.REFUND || original.amount().signum() <= 0) {
      throw new InvalidRequestException("Not refundable", "Only positive charges can be refunded");
    }
    if (reason == null || reason.isBlank()) {
      throw new InvalidRequestException("Reason required", "A refund needs a reason");
    }
    if (amount == null || amount.signum() <= 0) {
      throw new InvalidRequestException("Invalid amount", "Refund amount must be positive");
    }

    return refundLocks.withLock(
        eventId, () -> refundUnderLock(original, refundId, amount, reason));
  }

  private RevenueEvent refundUnderLock(
      RevenueEvent original, String refundId, BigDecimal amount, String reason) {
    String eventId = original.id();
    List<RevenueEvent> priorRefunds =
        revenueLedger
            .query(
                RevenueQuery.forTenant(original.tenantId())
                    .withTypes(EnumSet.of(RevenueEventType.REFUND)))
            .stream()
            .filter(e -> eventId.equals(e.metadata().get(RevenueEvent.REFUND_OF_KEY)))
            .toList();
    String id = refundId != null ? refundId : "refund:" + eventId + ":" + (priorRefunds.size() + 1);
    var existing = revenueLedger.findById(id);
    if (existing.isPresent()) {
      return existing.get();
    }

    BigDecimal refunded =
        priorRefunds.stream()
            .map(RevenueEvent::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .negate();
    if (refunded.add(amount).compareTo(original.amount()) > 0) {
      throw new InvalidRequestException(
          "Refund exceeds charge",
          "Refundable amount is " + original.amount().subtract(refunded).toPlainString());
    }

    String processorReference = original.metadata().get(RevenueEvent.PROCESSOR_REFERENCE_KEY);
    String refundReference = null;
    if (processorReference != null) {
      var result = paymentProcessor.refund(processorReference, amount, original.currency(), id);
      requireSucceeded(result, original.tenantId(), id, id);
      refundReference = result.processorReference();
    }

    var event =
        RevenueEvent.builder(id, original.tenantId(), RevenueEventType.REFUND)
            .amount(amount.negate(), original.currency())
            .occurredAt(clock.instant())
            .customerId(original.customerId())
            .subscriptionId(original.subscriptionId())
            .invoiceId(original.invoiceId())
            .stream(original.stream())
            .metadata(RevenueEvent.REFUND_OF_KEY, eventId)
            .metadata(RevenueEvent.REASON_KEY, reason)
            .metadata(RevenueEvent.PROCESSOR_REFERENCE_KEY, refundReference)
            .source(refundReference != null ? EventSource.PAYMENT_PROCESSOR : EventSource.MANUAL)
            .build();
    revenueLedger.record(event);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("revenue.refunded")
            .entityType("revenue_event")
            .entityId(id)
            .tenantId(original.tenantId())
            .details(
                Map.of(
                    "refund_of", eventId,
                    "amount", amount.toPlainString(),
                    "reason", reason))
            .build());
    log.info("Refunded {} of event {} for tenant {}", amount, eventId, original.tenantId());
    return event;
  }

  /**
   * Appends an administrative correction to the current tenant's ledger.
   *
   * @return the stored event; re-submitting an identical event is a no-op
   */
  public RevenueEvent recordManualEvent(ManualRevenueEvent manual) {
    String tenantId = TenantContext.requireTenantId();
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.REVENUE, manual.id(), tenantId), Action.WRITE);
    if (manual.reason() == null || manual.reason().isBlank()) {
      throw new InvalidRequestException("Reason required", "Manual events need a reason");
    }
    var metadata = new LinkedHashMap<String, String>();
    if (manual.metadata() != null) {
      metadata.putAll(manual.metadata());
    }
    metadata.put(RevenueEvent.REASON_KEY, manual.reason());

    String id = manual.id() != null ? manual.id() : "manual:" + UUID.randomUUID();
    Instant occurredAt = manual.occurredAt();
    if (occurredAt == null) {
      // a replay without a timestamp keeps the one stored first
      occurredAt =
          revenueLedger
              .findById(id)
              .filter(stored -> stored.tenantId().equals(tenantId))
              .map(RevenueEvent::occurredAt)
              .orElseGet(clock::instant);
    }

    RevenueEvent event;
    try {
      event =
          RevenueEvent.builder(id, tenantId, manual.type())
              .amount(manual.amount(), manual.currency())
              .occurredAt(occurredAt)
              .customerId(manual.customerId())
              .subscriptionId(manual.subscriptionId())
              .metadata(metadata)
              .stream(manual.stream() != null ? manual.stream() : RevenueStream.CONSUMER)
              .source(EventSource.MANUAL)
              .build();
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid revenue event", e.getMessage());
    }

    if (revenueLedger.record(event)) {
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("revenue.manual_event")
              .entityType("revenue_event")
              .entityId(event.id())
              .details(
                  Map.of(
                      "type", event.type().name(),
                      "amount", event.amount().toPlainString(),
                      "reason", manual.reason()))
              .build());
      log.info("Recorded manual {} event {} for tenant {}", event.type(), event.id(), tenantId);
    }
    return event;
  }

  // --- Automated billing ---

  public BillingCycleResult runAutomatedBillingCycle() {
    return automatedBillingCycle.run();
  }

  public boolean cancelRunningCycle() {
    return automatedBillingCycle.cancel();
  }

  // --- Private helpers ---

  private void requireSucceeded(
      ChargeResult result, String tenantId, String entityId, String idempotencyKey) {
    switch (result.status()) {
      case SUCCEEDED -> {
        return;
      }
      case DECLINED -> {
        auditPaymentFailure("payment.declined", tenantId, entityId, result);
        throw new PaymentDeclinedException(
            result.message() != null ? result.message() : "Payment declined",
            result.processorReference());
      }
      case ERROR -> {
        auditPaymentFailure("payment.error", tenantId, entityId, result);
        log.warn("Payment processor error for {}: {}", idempotencyKey, result.message());
        throw new PaymentProcessorException(
            "Payment outcome unknown; retry with the same id", idempotencyKey);
      }
    }
  }

  private void auditPaymentFailure(
      String eventType, String tenantId, String entityId, ChargeResult result) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("payment")
            .entityId(entityId)
            .tenantId(tenantId)
            .details(
                Map.of(
                    "processor", paymentProcessor.providerId(),
                    "message", String.valueOf(result.message())))
            .build());
  }

  private Customer requireCustomer(UUID customerId, Action action) {
    var customer =
        customerRepository
            .findById(customerId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.CUSTOMER, customerId, customer.getTenantId()), action);
    return customer;
  }

  private Invoice requireInvoice(UUID invoiceId, Action action) {
    var invoice =
        invoiceRepository
            .findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    String ownerUserId =
        Optional.ofNullable(invoice.getCustomerId())
            .flatMap(customerRepository::findById)
            .map(Customer::getUserId)
            .orElse(null);
    isolationGuard.validateBoundary(
        TargetResource.ownedBy(ResourceType.INVOICE, invoiceId, invoice.getTenantId(), ownerUserId),
        action);
    return invoice;
  }
}
