package io.fairway.platform.invoice;

import io.fairway.platform.currency.MinorUnits;
import io.fairway.platform.exception.InvalidStateTransitionException;
import io.fairway.platform.persistence.Versioned;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A bill sent to one customer of a tenant.
 *
 * <p>Lifecycle: DRAFT (lines editable) → SENT → PAID, or SENT → OVERDUE → PAID when dunning
 * later succeeds. The total is never stored; it is always the sum of the lines.
 *
 * <p>Renewal invoices carry the billing period they cover and the idempotency key their charge is
 * made with, so an ambiguous charge is retried against the same invoice and key. Revenue events
 * recorded on payment are keyed by {@link #eventKey()}, which never changes.
 */
public class Invoice implements Versioned<Invoice> {

  private UUID id;
  private String tenantId;
  private UUID customerId;
  private UUID subscriptionId;
  private String invoiceNumber;
  private String currency;
  private List<InvoiceLine> lines;
  private LocalDate dueDate;
  private InvoiceStatus status;
  private Instant periodStart;
  private Instant periodEnd;
  private String idempotencyKey;
  private int paymentAttempts;
  private int declinedAttempts;
  private Instant lastAttemptAt;
  private String paymentReference;
  private Instant sentAt;
  private Instant paidAt;
  private Instant createdAt;
  private Instant updatedAt;
  private long version;

  private Invoice() {}

  public Invoice(
      String tenantId,
      UUID customerId,
      UUID subscriptionId,
      String invoiceNumber,
      String currency,
      LocalDate dueDate,
      Instant now) {
    this.id = UUID.randomUUID();
    this.tenantId = tenantId;
    this.customerId = customerId;
    this.subscriptionId = subscriptionId;
    this.invoiceNumber = invoiceNumber;
    this.currency = MinorUnits.normalize(currency);
    this.lines = new ArrayList<>();
    this.dueDate = dueDate;
    this.status = InvoiceStatus.DRAFT;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Binds a renewal invoice to the period it bills and the key its charge uses. */
  public void coverPeriod(Instant periodStart, Instant periodEnd, String idempotencyKey) {
    requireDraft("set period of");
    this.periodStart = periodStart;
    this.periodEnd = periodEnd;
    this.idempotencyKey = idempotencyKey;
  }

  public void addLine(InvoiceLine line, Instant now) {
    requireDraft("add line to");
    this.lines.add(line);
    this.updatedAt = now;
  }

  public void markSent(Instant now) {
    transitionTo(InvoiceStatus.SENT, "send");
    this.sentAt = now;
    this.updatedAt = now;
  }

  public void markPaid(String paymentReference, Instant now) {
    transitionTo(InvoiceStatus.PAID, "pay");
    this.paymentReference = paymentReference;
    this.paidAt = now;
    this.updatedAt = now;
  }

  public void markOverdue(Instant now) {
    transitionTo(InvoiceStatus.OVERDUE, "mark overdue");
    this.updatedAt = now;
  }

  public void voidInvoice(Instant now) {
    transitionTo(InvoiceStatus.VOID, "void");
    this.updatedAt = now;
  }

  /** Records one charge attempt against this invoice. */
  public void recordAttempt(Instant now) {
    this.paymentAttempts++;
    this.lastAttemptAt = now;
    this.updatedAt = now;
  }

  /** A definitive decline; the next attempt is a new charge and gets a new key. */
  public void recordDecline(Instant now) {
    this.declinedAttempts++;
    this.updatedAt = now;
  }

  /** Key of the revenue events recorded when this invoice is paid. */
  public String eventKey() {
    return idempotencyKey != null ? idempotencyKey : "invoice:" + id;
  }

  /**
   * Processor idempotency key for the next charge. Unchanged after an ambiguous failure, so the
   * retry cannot double charge; changed after a decline, which settled nothing.
   */
  public String chargeKey() {
    return declinedAttempts == 0 ? eventKey() : eventKey() + ":retry-" + declinedAttempts;
  }

  public BigDecimal getTotal() {
    BigDecimal total = MinorUnits.zero(currency);
    for (InvoiceLine line : lines) {
      total = total.add(line.amount());
    }
    return total;
  }

  public boolean isPastDue(LocalDate today) {
    return status == InvoiceStatus.SENT && dueDate != null && dueDate.isBefore(today);
  }

  private void requireDraft(String action) {
    if (status != InvoiceStatus.DRAFT) {
      throw new InvalidStateTransitionException("invoice", status, action);
    }
  }

  private void transitionTo(InvoiceStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateTransitionException("invoice", status, action);
    }
    this.status = target;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public UUID getSubscriptionId() {
    return subscriptionId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public String getCurrency() {
    return currency;
  }

  public List<InvoiceLine> getLines() {
    return List.copyOf(lines);
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public Instant getPeriodStart() {
    return periodStart;
  }

  public Instant getPeriodEnd() {
    return periodEnd;
  }

  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  public int getPaymentAttempts() {
    return paymentAttempts;
  }

  public int getDeclinedAttempts() {
    return declinedAttempts;
  }

  public Instant getLastAttemptAt() {
    return lastAttemptAt;
  }

  public String getPaymentReference() {
    return paymentReference;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getPaidAt() {
    return paidAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public long getVersion() {
    return version;
  }

  @Override
  public void assignVersion(long version) {
    this.version = version;
  }

  @Override
  public Invoice copy() {
    var copy = new Invoice();
    copy.id = id;
    copy.tenantId = tenantId;
    copy.customerId = customerId;
    copy.subscriptionId = subscriptionId;
    copy.invoiceNumber = invoiceNumber;
    copy.currency = currency;
    copy.lines = new ArrayList<>(lines);
    copy.dueDate = dueDate;
    copy.status = status;
    copy.periodStart = periodStart;
    copy.periodEnd = periodEnd;
    copy.idempotencyKey = idempotencyKey;
    copy.paymentAttempts = paymentAttempts;
    copy.declinedAttempts = declinedAttempts;
    copy.lastAttemptAt = lastAttemptAt;
    copy.paymentReference = paymentReference;
    copy.sentAt = sentAt;
    copy.paidAt = paidAt;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    copy.version = version;
    return copy;
  }
}
