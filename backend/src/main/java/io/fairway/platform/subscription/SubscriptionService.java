package io.fairway.platform.subscription;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.billing.BillingOrchestrator;
import io.fairway.platform.billing.ChargeRequest;
import io.fairway.platform.customer.Customer;
import io.fairway.platform.customer.CustomerRepository;
import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.exception.InvalidStateTransitionException;
import io.fairway.platform.exception.PaymentDeclinedException;
import io.fairway.platform.exception.PaymentProcessorException;
import io.fairway.platform.exception.ResourceConflictException;
import io.fairway.platform.exception.ResourceNotFoundException;
import io.fairway.platform.ledger.EventSource;
import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenueLedger;
import io.fairway.platform.multitenancy.TenantContext;
import io.fairway.platform.security.Action;
import io.fairway.platform.security.IsolationGuard;
import io.fairway.platform.security.ResourceType;
import io.fairway.platform.security.TargetResource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Subscription lifecycle: create, change tier, pause, resume and cancel.
 *
 * <p>Every mutation runs under the subscription's lock and is persisted with an optimistic version
 * check. Charges go through the {@link BillingOrchestrator}; a price change is only ever applied
 * together with its PRORATION ledger event.
 */
@Service
public class SubscriptionService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionLocks subscriptionLocks;
  private final TierCatalog tierCatalog;
  private final ProrationCalculator prorationCalculator;
  private final CustomerRepository customerRepository;
  private final BillingOrchestrator billingOrchestrator;
  private final RevenueLedger revenueLedger;
  private final TierQuotaLimitResolver quotaLimitResolver;
  private final IsolationGuard isolationGuard;
  private final AuditService auditService;
  private final Clock clock;

  public SubscriptionService(
      SubscriptionRepository subscriptionRepository,
      SubscriptionLocks subscriptionLocks,
      TierCatalog tierCatalog,
      ProrationCalculator prorationCalculator,
      CustomerRepository customerRepository,
      BillingOrchestrator billingOrchestrator,
      RevenueLedger revenueLedger,
      TierQuotaLimitResolver quotaLimitResolver,
      IsolationGuard isolationGuard,
      AuditService auditService,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.subscriptionLocks = subscriptionLocks;
    this.tierCatalog = tierCatalog;
    this.prorationCalculator = prorationCalculator;
    this.customerRepository = customerRepository;
    this.billingOrchestrator = billingOrchestrator;
    this.revenueLedger = revenueLedger;
    this.quotaLimitResolver = quotaLimitResolver;
    this.isolationGuard = isolationGuard;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Subscribes a customer to a tier. Without a trial the first period is charged immediately; a
   * declined or failed first charge leaves the subscription CANCELED with reason PAYMENT_FAILED.
   *
   * @param price negotiated price, or null for the catalog price of the cycle
   * @param trialDays free days before the first charge; 0 for none
   * @throws ResourceConflictException if the customer already has a live subscription in the
   *     tier's family
   */
  public Subscription create(
      UUID customerId,
      String tierId,
      BillingCycle billingCycle,
      BigDecimal price,
      int trialDays,
      String paymentMethod) {
    var tier = tierCatalog.require(tierId);
    var customer =
        customerRepository
            .findById(customerId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.CUSTOMER, customerId, customer.getTenantId()),
        Action.WRITE);
    BillingCycle cycle = billingCycle != null ? billingCycle : BillingCycle.MONTHLY;
    BigDecimal effectivePrice = price != null ? price : tier.price(cycle);
    if (effectivePrice.signum() < 0) {
      throw new InvalidRequestException("Invalid price", "Price must not be negative");
    }
    if (trialDays < 0) {
      throw new InvalidRequestException("Invalid trial", "Trial days must not be negative");
    }

    Instant now = clock.instant();
    var subscription =
        new Subscription(
            customer.getTenantId(),
            customerId,
            tier,
            cycle,
            effectivePrice,
            paymentMethod != null ? paymentMethod : customer.getDefaultPaymentMethod(),
            Duration.ofDays(trialDays),
            now);
    if (!subscriptionRepository.insertLive(subscription)) {
      throw new ResourceConflictException(
          "Subscription already exists",
          "Customer " + customerId + " already has a live " + tier.family() + " subscription");
    }

    if (!subscription.isInTrial(now)) {
      chargeFirstPeriod(subscription);
    }

    recordChange(
        "subscription.created",
        subscription,
        Map.of(
            "tier", tier.id(),
            "price", subscription.getPrice().toPlainString(),
            "billing_cycle", cycle.name()));
    log.info(
        "Created {} subscription {} for customer {} in tenant {}",
        tier.id(),
        subscription.getId(),
        customerId,
        subscription.getTenantId());
    return subscription;
  }

  public Subscription get(UUID subscriptionId) {
    return require(subscriptionId, Action.READ);
  }

  public List<Subscription> listForCurrentTenant() {
    return subscriptionRepository.findByTenantId(TenantContext.requireTenantId());
  }

  public List<Subscription> listForCustomer(UUID customerId) {
    var customer =
        customerRepository
            .findById(customerId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.CUSTOMER, customerId, customer.getTenantId()), Action.READ);
    return subscriptionRepository.findByCustomerId(customerId);
  }

  /**
   * Moves an ACTIVE subscription to another tier of the same family. The price difference for the
   * rest of the period is charged (upgrade) or credited (downgrade) as a PRORATION event.
   *
   * @throws PaymentDeclinedException if the upgrade charge is declined; nothing changes
   */
  public Subscription changeTier(UUID subscriptionId, String newTierId, BillingCycle newCycle) {
    require(subscriptionId, Action.WRITE);
    var newTier = tierCatalog.require(newTierId);
    return subscriptionLocks.withLock(
        subscriptionId,
        () -> {
          var subscription = load(subscriptionId);
          if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
            throw new InvalidStateTransitionException(
                "subscription", subscription.getStatus(), "change tier of");
          }
          if (!newTier.family().equals(subscription.getTierFamily())) {
            throw new InvalidRequestException(
                "Invalid tier change",
                "Cannot move from family "
                    + subscription.getTierFamily()
                    + " to "
                    + newTier.family());
          }
          if (newTier.id().equals(subscription.getTierId())) {
            throw new InvalidRequestException(
                "Invalid tier change", "Subscription is already on tier " + newTier.id());
          }
          if (newCycle != null && newCycle != subscription.getBillingCycle()) {
            throw new InvalidRequestException(
                "Invalid tier change", "Billing cycle can only change at renewal");
          }

          Instant now = clock.instant();
          String oldTierId = subscription.getTierId();
          BigDecimal oldPrice = subscription.getPrice();
          BigDecimal newPrice = newTier.price(subscription.getBillingCycle());
          var proration =
              subscription.isInTrial(now)
                  ? null
                  : prorationCalculator.prorate(
                      oldPrice,
                      newPrice,
                      subscription.getCurrentPeriodStart(),
                      subscription.getCurrentPeriodEnd(),
                      now,
                      subscription.getCurrency());
          BigDecimal adjustment = proration != null ? proration.amount() : BigDecimal.ZERO;
          recordProration(subscription, newTier, newPrice, adjustment);

          subscription.changeTier(newTier, newPrice, now);
          subscriptionRepository.save(subscription);

          recordChange(
              "subscription.tier_changed",
              subscription,
              Map.of(
                  "from_tier", oldTierId,
                  "to_tier", newTier.id(),
                  "proration", adjustment.toPlainString()));
          log.info(
              "Subscription {} moved from {} to {} (proration {})",
              subscriptionId,
              oldTierId,
              newTier.id(),
              adjustment.toPlainString());
          return subscription;
        });
  }

  public Subscription pause(UUID subscriptionId, Duration duration) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new InvalidRequestException("Invalid pause", "Pause duration must be positive");
    }
    require(subscriptionId, Action.WRITE);
    return subscriptionLocks.withLock(
        subscriptionId,
        () -> {
          var subscription = load(subscriptionId);
          Instant now = clock.instant();
          subscription.pause(now.plus(duration), now);
          subscriptionRepository.save(subscription);
          recordChange(
              "subscription.paused",
              subscription,
              Map.of("paused_until", subscription.getPausedUntil().toString()));
          return subscription;
        });
  }

  public Subscription resume(UUID subscriptionId) {
    require(subscriptionId, Action.WRITE);
    return resumeLocked(subscriptionId);
  }

  public Subscription cancel(UUID subscriptionId, CancellationReason reason) {
    if (reason == null) {
      throw new InvalidRequestException("Reason required", "A cancellation reason is required");
    }
    require(subscriptionId, Action.WRITE);
    return subscriptionLocks.withLock(
        subscriptionId,
        () -> {
          var subscription = load(subscriptionId);
          subscription.cancel(reason, clock.instant());
          subscriptionRepository.save(subscription);
          recordChange("subscription.canceled", subscription, Map.of("reason", reason.name()));
          log.info("Canceled subscription {} ({})", subscriptionId, reason);
          return subscription;
        });
  }

  /** Replaces the payment method and lets dunning start over at the next billing cycle. */
  public Subscription updatePaymentMethod(UUID subscriptionId, String paymentMethod) {
    if (paymentMethod == null || paymentMethod.isBlank()) {
      throw new InvalidRequestException("Invalid payment method", "Payment method is required");
    }
    require(subscriptionId, Action.WRITE);
    return subscriptionLocks.withLock(
        subscriptionId,
        () -> {
          var subscription = load(subscriptionId);
          subscription.updatePaymentMethod(paymentMethod, clock.instant());
          subscriptionRepository.save(subscription);
          recordChange("subscription.payment_method_updated", subscription, Map.of());
          return subscription;
        });
  }

  /** Resumes every subscription whose pause has run out. Returns how many resumed. */
  public int resumeExpiredPauses() {
    int resumed = 0;
    for (Subscription expired : subscriptionRepository.findExpiredPauses(clock.instant())) {
      try {
        resumeLocked(expired.getId());
        resumed++;
      } catch (RuntimeException e) {
        log.error("Failed to auto-resume subscription {}", expired.getId(), e);
      }
    }
    return resumed;
  }

  private Subscription resumeLocked(UUID subscriptionId) {
    return subscriptionLocks.withLock(
        subscriptionId,
        () -> {
          var subscription = load(subscriptionId);
          subscription.resume(clock.instant());
          subscriptionRepository.save(subscription);
          recordChange(
              "subscription.resumed",
              subscription,
              Map.of("period_end", subscription.getCurrentPeriodEnd().toString()));
          return subscription;
        });
  }

  private void chargeFirstPeriod(Subscription subscription) {
    try {
      billingOrchestrator.processPayment(
          new ChargeRequest(
              "subscription-created:" + subscription.getId(),
              subscription.getTenantId(),
              RevenueEventType.SUBSCRIPTION_CREATED,
              subscription.getPrice(),
              subscription.getCurrency(),
              subscription.getPaymentMethod(),
              subscription.getCustomerId().toString(),
              subscription.getId().toString(),
              subscription.getStream(),
              recurringMetadata(subscription, subscription.getTierId(), subscription.getPrice())));
    } catch (PaymentDeclinedException | PaymentProcessorException e) {
      subscriptionLocks.withLock(
          subscription.getId(),
          () -> {
            subscription.cancel(CancellationReason.PAYMENT_FAILED, clock.instant());
            return subscriptionRepository.save(subscription);
          });
      log.info(
          "First charge of subscription {} failed; subscription canceled", subscription.getId());
      throw e;
    }
  }

  private void recordProration(
      Subscription subscription, Tier newTier, BigDecimal newPrice, BigDecimal amount) {
    String eventId = "proration:" + subscription.getId() + ":v" + subscription.getVersion();
    var metadata = recurringMetadata(subscription, newTier.id(), newPrice);
    if (amount.signum() > 0) {
      billingOrchestrator.processPayment(
          new ChargeRequest(
              eventId,
              subscription.getTenantId(),
              RevenueEventType.PRORATION,
              amount,
              subscription.getCurrency(),
              subscription.getPaymentMethod(),
              subscription.getCustomerId().toString(),
              subscription.getId().toString(),
              newTier.stream(),
              metadata));
      return;
    }
    // credits and zero adjustments never reach the processor
    revenueLedger.record(
        RevenueEvent.builder(eventId, subscription.getTenantId(), RevenueEventType.PRORATION)
            .amount(amount, subscription.getCurrency())
            .occurredAt(clock.instant())
            .customerId(subscription.getCustomerId())
            .subscriptionId(subscription.getId())
            .stream(newTier.stream())
            .metadata(metadata)
            .source(EventSource.INTERNAL)
            .build());
  }

  private static Map<String, String> recurringMetadata(
      Subscription subscription, String tierId, BigDecimal price) {
    var metadata = new LinkedHashMap<String, String>();
    metadata.put(RevenueEvent.PRICE_KEY, price.toPlainString());
    metadata.put(RevenueEvent.BILLING_CYCLE_KEY, subscription.getBillingCycle().name());
    metadata.put(RevenueEvent.TIER_KEY, tierId);
    metadata.put(RevenueEvent.PERIOD_END_KEY, subscription.getCurrentPeriodEnd().toString());
    return metadata;
  }

  private Subscription require(UUID subscriptionId, Action action) {
    var subscription = load(subscriptionId);
    String ownerUserId =
        customerRepository
            .findById(subscription.getCustomerId())
            .map(Customer::getUserId)
            .orElse(null);
    isolationGuard.validateBoundary(
        TargetResource.ownedBy(
            ResourceType.SUBSCRIPTION, subscriptionId, subscription.getTenantId(), ownerUserId),
        action);
    return subscription;
  }

  private Subscription load(UUID subscriptionId) {
    return subscriptionRepository
        .findById(subscriptionId)
        .orElseThrow(() -> new ResourceNotFoundException("Subscription", subscriptionId));
  }

  /** Audits a lifecycle change and drops the tenant's cached quota plan. */
  private void recordChange(
      String eventType, Subscription subscription, Map<String, Object> details) {
    quotaLimitResolver.evict(subscription.getTenantId());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("subscription")
            .entityId(subscription.getId())
            .tenantId(subscription.getTenantId())
            .details(details)
            .build());
  }
}
