package io.fairway.platform.billing;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.customer.Customer;
import io.fairway.platform.customer.CustomerRepository;
import io.fairway.platform.exception.ResourceConflictException;
import io.fairway.platform.integration.payment.ChargeResult;
import io.fairway.platform.invoice.Invoice;
import io.fairway.platform.invoice.InvoiceLine;
import io.fairway.platform.invoice.InvoiceLineType;
import io.fairway.platform.invoice.InvoiceRepository;
import io.fairway.platform.invoice.InvoiceStatus;
import io.fairway.platform.subscription.Subscription;
import io.fairway.platform.subscription.SubscriptionLocks;
import io.fairway.platform.subscription.SubscriptionRepository;
import io.fairway.platform.subscription.Tier;
import io.fairway.platform.subscription.TierCatalog;
import io.fairway.platform.subscription.TierQuotaLimitResolver;
import io.fairway.platform.usage.OverageCalculator;
import io.fairway.platform.usage.OverageCharge;
import io.fairway.platform.usage.QuotaType;
import io.fairway.platform.usage.UsageMeter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Renews every subscription whose period has ended.
 *
 * <p>Due subscriptions are taken in batches of {@code fairway.billing.concurrency}. For each one a
 * renewal invoice is issued (or the open one from an earlier attempt is reused), its charge is
 * submitted to the billing executor, and the outcome is applied once the charge returns or its
 * timeout expires. Invoice preparation and outcome handling run under the subscription's lock;
 * the processor call does not.
 *
 * <p>Cancellation takes effect between subscriptions: a charge that has been submitted is always
 * seen through, anything not yet started is reported as skipped.
 */
@Component
public class AutomatedBillingCycle {

  private static final Logger log = LoggerFactory.getLogger(AutomatedBillingCycle.class);

  private enum Outcome {
    PROCESSED,
    FAILED,
    DEFERRED
  }

  private record PendingCharge(
      UUID subscriptionId, UUID invoiceId, CompletableFuture<ChargeResult> result, long deadline) {}

  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionLocks subscriptionLocks;
  private final CustomerRepository customerRepository;
  private final InvoiceRepository invoiceRepository;
  private final InvoiceSettlement invoiceSettlement;
  private final TierCatalog tierCatalog;
  private final TierQuotaLimitResolver quotaLimitResolver;
  private final UsageMeter usageMeter;
  private final OverageCalculator overageCalculator;
  private final RetryPolicy retryPolicy;
  private final BillingProperties properties;
  private final ExecutorService billingExecutor;
  private final AuditService auditService;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile boolean cancelRequested;

  public AutomatedBillingCycle(
      SubscriptionRepository subscriptionRepository,
      SubscriptionLocks subscriptionLocks,
      CustomerRepository customerRepository,
      InvoiceRepository invoiceRepository,
      InvoiceSettlement invoiceSettlement,
      TierCatalog tierCatalog,
      TierQuotaLimitResolver quotaLimitResolver,
      UsageMeter usageMeter,
      OverageCalculator overageCalculator,
      RetryPolicy retryPolicy,
      BillingProperties properties,
      @Qualifier("billingExecutor") ExecutorService billingExecutor,
      AuditService auditService,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.subscriptionLocks = subscriptionLocks;
    this.customerRepository = customerRepository;
    this.invoiceRepository = invoiceRepository;
    this.invoiceSettlement = invoiceSettlement;
    this.tierCatalog = tierCatalog;
    this.quotaLimitResolver = quotaLimitResolver;
    this.usageMeter = usageMeter;
    this.overageCalculator = overageCalculator;
    this.retryPolicy = retryPolicy;
    this.properties = properties;
    this.billingExecutor = billingExecutor;
    this.auditService = auditService;
    this.clock = clock;
  }

  public static String renewalKey(UUID subscriptionId, Instant periodStart) {
    return "renewal:" + subscriptionId + ":" + periodStart;
  }

  /**
   * Runs one cycle to completion.
   *
   * @throws ResourceConflictException if a cycle is already running
   */
  public BillingCycleResult run() {
    if (!running.compareAndSet(false, true)) {
      throw new ResourceConflictException(
          "Billing cycle already running", "Wait for the running cycle to finish");
    }
    cancelRequested = false;
    Instant startedAt = clock.instant();
    var processed = new ArrayList<UUID>();
    var failed = new ArrayList<UUID>();
    var deferred = new ArrayList<UUID>();
    var skipped = new ArrayList<UUID>();
    try {
      List<Subscription> due = subscriptionRepository.findDueForRenewal(startedAt);
      log.info("Billing cycle started: {} subscriptions due", due.size());

      int batchSize = properties.concurrency();
      for (int from = 0; from < due.size(); from += batchSize) {
        var batch = due.subList(from, Math.min(due.size(), from + batchSize));
        var pending = new ArrayList<PendingCharge>();
        for (Subscription subscription : batch) {
          UUID id = subscription.getId();
          if (cancelRequested) {
            skipped.add(id);
            continue;
          }
          try {
            prepare(id, startedAt).ifPresentOrElse(pending::add, () -> skipped.add(id));
          } catch (RuntimeException e) {
            log.error("Failed to prepare renewal of subscription {}", id, e);
            deferred.add(id);
          }
        }
        for (PendingCharge charge : pending) {
          Outcome outcome;
          try {
            outcome = complete(charge, await(charge));
          } catch (RuntimeException e) {
            log.error("Failed to apply renewal outcome of {}", charge.subscriptionId(), e);
            outcome = Outcome.DEFERRED;
          }
          switch (outcome) {
            case PROCESSED -> processed.add(charge.subscriptionId());
            case FAILED -> failed.add(charge.subscriptionId());
            case DEFERRED -> deferred.add(charge.subscriptionId());
          }
        }
      }
    } finally {
      running.set(false);
    }

    var result =
        new BillingCycleResult(
            startedAt,
            clock.instant(),
            List.copyOf(processed),
            List.copyOf(failed),
            List.copyOf(deferred),
            List.copyOf(skipped),
            cancelRequested);
    log.info(
        "Billing cycle completed: processed={}, failed={}, deferred={}, skipped={}, canceled={}",
        processed.size(),
        failed.size(),
        deferred.size(),
        skipped.size(),
        result.canceled());
    return result;
  }

  /** Requests cancellation of the running cycle. Returns false when no cycle is running. */
  public boolean cancel() {
    if (!running.get()) {
      return false;
    }
    cancelRequested = true;
    log.info("Cancellation of the running billing cycle requested");
    return true;
  }

  public boolean isRunning() {
    return running.get();
  }

  private Optional<PendingCharge> prepare(UUID subscriptionId, Instant now) {
    return subscriptionLocks.withLock(
        subscriptionId,
        () -> {
          var subscription = subscriptionRepository.findById(subscriptionId).orElse(null);
          if (subscription == null || !subscription.isDueForRenewal(now)) {
            return Optional.empty();
          }
          Invoice invoice =
              invoiceRepository
                  .findRenewal(subscriptionId, subscription.getCurrentPeriodEnd())
                  .orElseGet(() -> issueRenewalInvoice(subscription, now));

          CompletableFuture<ChargeResult> result;
          if (invoice.getStatus() == InvoiceStatus.PAID) {
            result =
                CompletableFuture.completedFuture(
                    ChargeResult.succeeded(invoice.getPaymentReference()));
          } else {
            invoice.recordAttempt(now);
            invoiceRepository.save(invoice);
            String paymentMethod = paymentMethodOf(subscription);
            result =
                CompletableFuture.supplyAsync(
                    () -> invoiceSettlement.charge(invoice, paymentMethod), billingExecutor);
          }
          long deadline = System.nanoTime() + properties.paymentTimeout().toNanos();
          return Optional.of(new PendingCharge(subscriptionId, invoice.getId(), result, deadline));
        });
  }

  private ChargeResult await(PendingCharge charge) {
    long remaining = Math.max(0L, charge.deadline() - System.nanoTime());
    try {
      return charge.result().get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      charge.result().cancel(true);
      log.warn(
          "Charge for subscription {} timed out after {}",
          charge.subscriptionId(),
          properties.paymentTimeout());
      return ChargeResult.error("Payment timed out");
    } catch (ExecutionException e) {
      log.warn("Charge for subscription {} failed", charge.subscriptionId(), e.getCause());
      return ChargeResult.error(String.valueOf(e.getCause().getMessage()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ChargeResult.error("Interrupted while awaiting payment");
    }
  }

  private Outcome complete(PendingCharge charge, ChargeResult result) {
    return subscriptionLocks.withLock(
        charge.subscriptionId(),
        () -> {
          Instant now = clock.instant();
          var subscription =
              subscriptionRepository.findById(charge.subscriptionId()).orElseThrow();
          var invoice = invoiceRepository.findById(charge.invoiceId()).orElseThrow();
          return switch (result.status()) {
            case SUCCEEDED -> renewed(subscription, invoice, result, now);
            case DECLINED -> {
              invoice.recordDecline(now);
              recordFailure(subscription, invoice, result, now);
              yield Outcome.FAILED;
            }
            case ERROR -> {
              recordFailure(subscription, invoice, result, now);
              yield Outcome.DEFERRED;
            }
          };
        });
  }

  private Outcome renewed(
      Subscription subscription, Invoice invoice, ChargeResult result, Instant now) {
    invoiceSettlement.settle(invoice, subscription, result, now);
    if (subscription.getStatus().isLive()
        && subscription.getCurrentPeriodEnd().equals(invoice.getPeriodStart())) {
      subscription.advancePeriod(now);
      subscriptionRepository.save(subscription);
    }
    usageMeter.advanceBilledThrough(subscription.getTenantId(), invoice.getPeriodStart());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("subscription.renewed")
            .entityType("subscription")
            .entityId(subscription.getId())
            .tenantId(subscription.getTenantId())
            .details(
                Map.of(
                    "invoice_number",
                    invoice.getInvoiceNumber(),
                    "amount",
                    invoice.getTotal().toPlainString(),
                    "period_end",
                    subscription.getCurrentPeriodEnd().toString()))
            .build());
    return Outcome.PROCESSED;
  }

  private void recordFailure(
      Subscription subscription, Invoice invoice, ChargeResult result, Instant now) {
    int attempt = subscription.getFailedAttempts() + 1;
    subscription.recordFailedAttempt(retryPolicy.nextRetryAt(attempt, now), now);
    boolean exhausted = retryPolicy.isExhausted(subscription.getFailedAttempts());
    if (exhausted) {
      subscription.escalate(now);
      if (invoice.getStatus() == InvoiceStatus.SENT) {
        invoice.markOverdue(now);
      }
    }
    invoiceRepository.save(invoice);
    subscriptionRepository.save(subscription);

    if (exhausted) {
      log.warn(
          "Renewal of subscription {} (tenant {}) failed {} times; manual intervention required",
          subscription.getId(),
          subscription.getTenantId(),
          attempt);
    } else {
      log.info(
          "Renewal attempt {} of subscription {} failed ({}: {}); next retry at {}",
          attempt,
          subscription.getId(),
          result.status(),
          result.message(),
          subscription.getNextRetryAt());
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType(exhausted ? "subscription.dunning_escalated" : "subscription.renewal_failed")
            .entityType("subscription")
            .entityId(subscription.getId())
            .tenantId(subscription.getTenantId())
            .details(
                Map.of(
                    "attempt",
                    attempt,
                    "status",
                    result.status().name(),
                    "invoice_number",
                    invoice.getInvoiceNumber()))
            .build());
  }

  private Invoice issueRenewalInvoice(Subscription subscription, Instant now) {
    Instant periodStart = subscription.getCurrentPeriodEnd();
    Instant periodEnd = subscription.getBillingCycle().advance(periodStart);
    String currency = subscription.getCurrency();
    var tier = tierCatalog.find(subscription.getTierId());

    var invoice =
        new Invoice(
            subscription.getTenantId(),
            subscription.getCustomerId(),
            subscription.getId(),
            invoiceRepository.nextInvoiceNumber(subscription.getTenantId()),
            currency,
            LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(properties.invoiceDueDays()),
            now);
    invoice.coverPeriod(periodStart, periodEnd, renewalKey(subscription.getId(), periodStart));
    invoice.addLine(
        InvoiceLine.of(
            tier.map(Tier::name).orElse(subscription.getTierId())
                + " ("
                + subscription.getBillingCycle().name().toLowerCase()
                + ")",
            subscription.getPrice(),
            BigDecimal.ONE,
            currency,
            InvoiceLineType.SUBSCRIPTION,
            Map.of("periodStart", periodStart.toString(), "periodEnd", periodEnd.toString())),
        now);
    tier.filter(Tier::isMetered)
        .filter(t -> carriesTenantOverage(subscription))
        .ifPresent(t -> addOverageLines(invoice, subscription, t, now));
    invoice.markSent(now);
    invoiceRepository.save(invoice);

    log.info(
        "Issued renewal invoice {} for subscription {}: {} {}",
        invoice.getInvoiceNumber(),
        subscription.getId(),
        invoice.getTotal().toPlainString(),
        currency);
    return invoice;
  }

  /** Tenant usage is billed once per period, on the subscription that sets the tenant's quotas. */
  private boolean carriesTenantOverage(Subscription subscription) {
    return quotaLimitResolver
        .meteredSubscription(subscription.getTenantId())
        .map(metered -> metered.getId().equals(subscription.getId()))
        .orElse(false);
  }

  private void addOverageLines(Invoice invoice, Subscription subscription, Tier tier, Instant now) {
    String tenantId = subscription.getTenantId();
    var usage =
        usageMeter.usageBetween(
            tenantId, subscription.getCurrentPeriodStart(), subscription.getCurrentPeriodEnd());
    var overage =
        overageCalculator.calculate(
            tier.allowance(),
            Map.of(
                QuotaType.API_CALLS, usage.calls(),
                QuotaType.BANDWIDTH, usage.bytes(),
                QuotaType.STORAGE, usageMeter.storedBytes(tenantId)));
    for (OverageCharge charge : overage.charges()) {
      if (charge.overageUnits() == 0) {
        continue;
      }
      invoice.addLine(
          InvoiceLine.of(
              charge.quotaType().name().toLowerCase() + " overage",
              charge.rate(),
              BigDecimal.valueOf(charge.overageUnits()),
              invoice.getCurrency(),
              InvoiceLineType.USAGE,
              Map.of(
                  "quotaType", charge.quotaType().name(),
                  "included", Long.toString(charge.included()),
                  "actual", Long.toString(charge.actual()))),
          now);
    }
  }

  private String paymentMethodOf(Subscription subscription) {
    if (subscription.getPaymentMethod() != null) {
      return subscription.getPaymentMethod();
    }
    return customerRepository
        .findById(subscription.getCustomerId())
        .map(Customer::getDefaultPaymentMethod)
        .orElse(null);
  }
}
