package io.fairway.platform.subscription;

import io.fairway.platform.currency.MinorUnits;
import io.fairway.platform.exception.InvalidStateTransitionException;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.persistence.Versioned;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A customer's recurring plan within one tenant.
 *
 * <p>The price is a snapshot taken at creation. It only changes through a tier change, which is
 * always accompanied by a PRORATION ledger event. The current period is half-open: {@code
 * currentPeriodStart} inclusive, {@code currentPeriodEnd} exclusive; renewal falls due at the
 * period end.
 *
 * <p>Dunning state lives here too: failed renewal attempts, the next retry time and the manual
 * intervention flag set once retries are exhausted.
 */
public class Subscription implements Versioned<Subscription> {

  private UUID id;
  private String tenantId;
  private UUID customerId;
  private String tierId;
  private String tierFamily;
  private RevenueStream stream;
  private BillingCycle billingCycle;
  private BigDecimal price;
  private String currency;
  private String paymentMethod;
  private SubscriptionStatus status;
  private Instant trialEndsAt;
  private Instant currentPeriodStart;
  private Instant currentPeriodEnd;
  private Instant pausedAt;
  private Instant pausedUntil;
  private Instant canceledAt;
  private CancellationReason cancellationReason;
  private int failedAttempts;
  private Instant nextRetryAt;
  private boolean requiresManualIntervention;
  private Instant createdAt;
  private Instant updatedAt;
  private long version;

  private Subscription() {}

  public Subscription(
      String tenantId,
      UUID customerId,
      Tier tier,
      BillingCycle billingCycle,
      BigDecimal price,
      String paymentMethod,
      Duration trial,
      Instant now) {
    this.id = UUID.randomUUID();
    this.tenantId = tenantId;
    this.customerId = customerId;
    this.tierId = tier.id();
    this.tierFamily = tier.family();
    this.stream = tier.stream();
    this.billingCycle = billingCycle;
    this.currency = MinorUnits.normalize(tier.currency());
    this.price = MinorUnits.round(price, currency);
    this.paymentMethod = paymentMethod;
    this.status = SubscriptionStatus.ACTIVE;
    this.currentPeriodStart = now;
    if (trial != null && !trial.isZero()) {
      this.trialEndsAt = now.plus(trial);
      this.currentPeriodEnd = trialEndsAt;
    } else {
      this.currentPeriodEnd = billingCycle.advance(now);
    }
    this.createdAt = now;
    this.updatedAt = now;
  }

  public boolean isInTrial(Instant at) {
    return trialEndsAt != null && at.isBefore(trialEndsAt);
  }

  /**
   * Renewal is due once the period has ended, unless a retry is scheduled for later or retries
   * have been exhausted.
   */
  public boolean isDueForRenewal(Instant at) {
    return status == SubscriptionStatus.ACTIVE
        && !currentPeriodEnd.isAfter(at)
        && !requiresManualIntervention
        && (nextRetryAt == null || !nextRetryAt.isAfter(at));
  }

  public void pause(Instant until, Instant now) {
    transitionTo(SubscriptionStatus.PAUSED, "pause");
    this.pausedAt = now;
    this.pausedUntil = until;
    this.updatedAt = now;
  }

  /** Resumes and pushes the period end out by the time spent paused. */
  public void resume(Instant now) {
    transitionTo(SubscriptionStatus.ACTIVE, "resume");
    if (pausedAt != null && now.isAfter(pausedAt)) {
      this.currentPeriodEnd = currentPeriodEnd.plus(Duration.between(pausedAt, now));
    }
    this.pausedAt = null;
    this.pausedUntil = null;
    this.updatedAt = now;
  }

  public void cancel(CancellationReason reason, Instant now) {
    transitionTo(SubscriptionStatus.CANCELED, "cancel");
    this.cancellationReason = reason;
    this.canceledAt = now;
    this.nextRetryAt = null;
    this.updatedAt = now;
  }

  public void changeTier(Tier tier, BigDecimal newPrice, Instant now) {
    if (status != SubscriptionStatus.ACTIVE) {
      throw new InvalidStateTransitionException("subscription", status, "change tier of");
    }
    this.tierId = tier.id();
    this.stream = tier.stream();
    this.price = MinorUnits.round(newPrice, currency);
    this.updatedAt = now;
  }

  /** Moves to the next period after a successful renewal and clears dunning state. */
  public void advancePeriod(Instant now) {
    this.currentPeriodStart = currentPeriodEnd;
    this.currentPeriodEnd = billingCycle.advance(currentPeriodEnd);
    this.failedAttempts = 0;
    this.nextRetryAt = null;
    this.requiresManualIntervention = false;
    this.updatedAt = now;
  }

  public void recordFailedAttempt(Instant nextRetryAt, Instant now) {
    this.failedAttempts++;
    this.nextRetryAt = nextRetryAt;
    this.updatedAt = now;
  }

  /** Retries exhausted: stop automatic billing until someone intervenes. */
  public void escalate(Instant now) {
    this.requiresManualIntervention = true;
    this.nextRetryAt = null;
    this.updatedAt = now;
  }

  /** New payment method on file; dunning starts over on the next cycle. */
  public void updatePaymentMethod(String paymentMethod, Instant now) {
    this.paymentMethod = paymentMethod;
    this.failedAttempts = 0;
    this.nextRetryAt = null;
    this.requiresManualIntervention = false;
    this.updatedAt = now;
  }

  public boolean isInDunning() {
    return failedAttempts > 0 || requiresManualIntervention;
  }

  private void transitionTo(SubscriptionStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateTransitionException("subscription", status, action);
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

  public String getTierId() {
    return tierId;
  }

  public String getTierFamily() {
    return tierFamily;
  }

  public RevenueStream getStream() {
    return stream;
  }

  public BillingCycle getBillingCycle() {
    return billingCycle;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public String getCurrency() {
    return currency;
  }

  public String getPaymentMethod() {
    return paymentMethod;
  }

  public SubscriptionStatus getStatus() {
    return status;
  }

  public Instant getTrialEndsAt() {
    return trialEndsAt;
  }

  public Instant getCurrentPeriodStart() {
    return currentPeriodStart;
  }

  public Instant getCurrentPeriodEnd() {
    return currentPeriodEnd;
  }

  public Instant getPausedAt() {
    return pausedAt;
  }

  public Instant getPausedUntil() {
    return pausedUntil;
  }

  public Instant getCanceledAt() {
    return canceledAt;
  }

  public CancellationReason getCancellationReason() {
    return cancellationReason;
  }

  public int getFailedAttempts() {
    return failedAttempts;
  }

  public Instant getNextRetryAt() {
    return nextRetryAt;
  }

  public boolean isRequiresManualIntervention() {
    return requiresManualIntervention;
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
  public Subscription copy() {
    var copy = new Subscription();
    copy.id = id;
    copy.tenantId = tenantId;
    copy.customerId = customerId;
    copy.tierId = tierId;
    copy.tierFamily = tierFamily;
    copy.stream = stream;
    copy.billingCycle = billingCycle;
    copy.price = price;
    copy.currency = currency;
    copy.paymentMethod = paymentMethod;
    copy.status = status;
    copy.trialEndsAt = trialEndsAt;
    copy.currentPeriodStart = currentPeriodStart;
    copy.currentPeriodEnd = currentPeriodEnd;
    copy.pausedAt = pausedAt;
    copy.pausedUntil = pausedUntil;
    copy.canceledAt = canceledAt;
    copy.cancellationReason = cancellationReason;
    copy.failedAttempts = failedAttempts;
    copy.nextRetryAt = nextRetryAt;
    copy.requiresManualIntervention = requiresManualIntervention;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    copy.version = version;
    return copy;
  }
}
