package io.fairway.platform.billing;

import static org.assertj.core.api.Assertions.assertThat;

import io.fairway.platform.audit.AuditEventFilter;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.customer.Customer;
import io.fairway.platform.integration.payment.SimulatedPaymentProcessor;
import io.fairway.platform.invoice.Invoice;
import io.fairway.platform.invoice.InvoiceLineType;
import io.fairway.platform.invoice.InvoiceRepository;
import io.fairway.platform.invoice.InvoiceStatus;
import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenueLedger;
import io.fairway.platform.multitenancy.TenantContext;
import io.fairway.platform.security.ResolvedIdentity;
import io.fairway.platform.security.Roles;
import io.fairway.platform.subscription.BillingCycle;
import io.fairway.platform.subscription.CancellationReason;
import io.fairway.platform.subscription.Subscription;
import io.fairway.platform.subscription.SubscriptionRepository;
import io.fairway.platform.subscription.SubscriptionService;
import io.fairway.platform.testutil.MutableClock;
import io.fairway.platform.testutil.TestClockConfiguration;
import io.fairway.platform.usage.UsageMeter;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AutomatedBillingCycleIntegrationTest {

  private static final Instant JAN_1 = TestClockConfiguration.START;
  private static final Instant FEB_1 = Instant.parse("2025-02-01T00:00:00Z");
  private static final Instant MAR_1 = Instant.parse("2025-03-01T00:00:00Z");

  @Autowired private AutomatedBillingCycle billingCycle;
  @Autowired private BillingOrchestrator billingOrchestrator;
  @Autowired private SubscriptionService subscriptionService;
  @Autowired private SubscriptionRepository subscriptionRepository;
  @Autowired private InvoiceRepository invoiceRepository;
  @Autowired private RevenueLedger revenueLedger;
  @Autowired private UsageMeter usageMeter;
  @Autowired private SimulatedPaymentProcessor paymentProcessor;
  @Autowired private AuditService auditService;
  @Autowired private MutableClock clock;

  private final String tenantId = UUID.randomUUID().toString();
  private final ResolvedIdentity owner =
      new ResolvedIdentity("user_billing", tenantId, Set.of(Roles.BILLING));

  @BeforeEach
  void resetClock() {
    clock.set(JAN_1);
  }

  private <T> T asOwner(Supplier<T> work) {
    return TenantContext.callAs(owner, work);
  }

  private Subscription subscribe(String tierId, String paymentMethod, int trialDays) {
    return subscribe(owner, tierId, paymentMethod, trialDays);
  }

  private Subscription subscribe(
      ResolvedIdentity identity, String tierId, String paymentMethod, int trialDays) {
    return TenantContext.callAs(
        identity,
        () -> {
          Customer customer =
              billingOrchestrator.createCustomer(
                  "club-" + UUID.randomUUID() + "@example.com", "Club", Map.of(), paymentMethod);
          return subscriptionService.create(
              customer.getId(), tierId, BillingCycle.MONTHLY, null, trialDays, null);
        });
  }

  private Subscription reload(Subscription subscription) {
    return subscriptionRepository.findById(subscription.getId()).orElseThrow();
  }

  private Invoice renewalInvoice(Subscription subscription) {
    var invoices = invoiceRepository.findBySubscriptionId(subscription.getId());
    assertThat(invoices).hasSize(1);
    return invoices.get(0);
  }

  @Test
  void dueSubscription_isRenewedOnceAndMovesToTheNextPeriod() {
    var subscription = subscribe("white-label-course", "tok_visa", 0);
    clock.set(FEB_1);

    var result = billingCycle.run();

    assertThat(result.processed()).contains(subscription.getId());
    String key = AutomatedBillingCycle.renewalKey(subscription.getId(), FEB_1);
    var renewal = revenueLedger.findById(key).orElseThrow();
    assertThat(renewal.type()).isEqualTo(RevenueEventType.SUBSCRIPTION_RENEWED);
    assertThat(renewal.amount()).isEqualByComparingTo("500.00");
    assertThat(renewal.metadata()).containsEntry("periodEnd", MAR_1.toString());
    assertThat(reload(subscription).getCurrentPeriodEnd()).isEqualTo(MAR_1);
    assertThat(renewalInvoice(subscription).getStatus()).isEqualTo(InvoiceStatus.PAID);

    var again = billingCycle.run();

    assertThat(again.processed()).doesNotContain(subscription.getId());
    assertThat(paymentProcessor.callCount(key)).isEqualTo(1);
  }

  @Test
  void subscriptionNotYetDue_isLeftAlone() {
    var subscription = subscribe("white-label-course", "tok_visa", 0);
    clock.set(FEB_1.minusSeconds(1));

    var result = billingCycle.run();

    assertThat(result.processed()).doesNotContain(subscription.getId());
    assertThat(invoiceRepository.findBySubscriptionId(subscription.getId())).isEmpty();
  }

  @Test
  void meteredTier_billsOverageForTheEndedPeriod() {
    var subscription = subscribe("starter", "tok_visa", 0);
    clock.set(JAN_1.plus(Duration.ofDays(3)));
    for (int i = 0; i < 10_500; i++) {
      usageMeter.recordCall(tenantId, "/api/v1/tee-times", 200, 12, 0);
    }
    clock.set(FEB_1);

    assertThat(billingCycle.run().processed()).contains(subscription.getId());

    var invoice = renewalInvoice(subscription);
    assertThat(invoice.getTotal()).isEqualByComparingTo("29.50");
    assertThat(invoice.getLines())
        .filteredOn(line -> line.type() == InvoiceLineType.USAGE)
        .singleElement()
        .satisfies(line -> assertThat(line.quantity()).isEqualByComparingTo("500"));
    String key = AutomatedBillingCycle.renewalKey(subscription.getId(), FEB_1);
    assertThat(revenueLedger.findById(key).orElseThrow().amount()).isEqualByComparingTo("29.00");
    var usageCharge = revenueLedger.findById(key + ":usage").orElseThrow();
    assertThat(usageCharge.type()).isEqualTo(RevenueEventType.USAGE_CHARGE);
    assertThat(usageCharge.amount()).isEqualByComparingTo("0.50");
  }

  @Test
  void twoMeteredSubscriptions_billTenantUsageOnce() {
    String clubTenant = UUID.randomUUID().toString();
    var clubOwner = new ResolvedIdentity("user_club", clubTenant, Set.of(Roles.BILLING));
    var first = subscribe(clubOwner, "starter", "tok_visa", 0);
    var second = subscribe(clubOwner, "starter", "tok_visa", 0);
    clock.set(JAN_1.plus(Duration.ofDays(3)));
    for (int i = 0; i < 10_500; i++) {
      usageMeter.recordCall(clubTenant, "/api/v1/tee-times", 200, 12, 0);
    }
    clock.set(FEB_1);

    assertThat(billingCycle.run().processed()).contains(first.getId(), second.getId());

    var usageCharges =
        Stream.of(first, second)
            .map(s -> AutomatedBillingCycle.renewalKey(s.getId(), FEB_1) + ":usage")
            .map(revenueLedger::findById)
            .flatMap(Optional::stream)
            .toList();
    assertThat(usageCharges)
        .singleElement()
        .satisfies(event -> assertThat(event.amount()).isEqualByComparingTo("0.50"));
    long invoicesWithUsage =
        Stream.of(first, second)
            .map(this::renewalInvoice)
            .filter(
                invoice ->
                    invoice.getLines().stream().anyMatch(l -> l.type() == InvoiceLineType.USAGE))
            .count();
    assertThat(invoicesWithUsage).isEqualTo(1);
  }

  @Test
  void declinedRenewals_backOffThenEscalate() {
    var subscription = subscribe("white-label-course", "tok_decline", 14);
    Instant trialEnd = JAN_1.plus(Duration.ofDays(14));
    clock.set(trialEnd);

    assertThat(billingCycle.run().failed()).contains(subscription.getId());
    var afterFirst = reload(subscription);
    assertThat(afterFirst.getFailedAttempts()).isEqualTo(1);
    assertThat(afterFirst.getNextRetryAt()).isEqualTo(trialEnd.plus(Duration.ofDays(1)));

    var early = billingCycle.run();
    assertThat(early.failed()).doesNotContain(subscription.getId());
    assertThat(early.processed()).doesNotContain(subscription.getId());

    clock.advance(Duration.ofDays(1));
    assertThat(billingCycle.run().failed()).contains(subscription.getId());
    assertThat(reload(subscription).getNextRetryAt())
        .isEqualTo(trialEnd.plus(Duration.ofDays(3)));

    clock.advance(Duration.ofDays(2));
    assertThat(billingCycle.run().failed()).contains(subscription.getId());

    var escalated = reload(subscription);
    assertThat(escalated.getFailedAttempts()).isEqualTo(3);
    assertThat(escalated.isRequiresManualIntervention()).isTrue();
    assertThat(renewalInvoice(subscription).getStatus()).isEqualTo(InvoiceStatus.OVERDUE);
    var escalations =
        new AuditEventFilter(
            "subscription",
            subscription.getId().toString(),
            null,
            "subscription.dunning_escalated",
            null,
            null);
    assertThat(auditService.findEvents(tenantId, escalations)).hasSize(1);

    clock.advance(Duration.ofDays(10));
    assertThat(billingCycle.run().failed()).doesNotContain(subscription.getId());
  }

  @Test
  void newPaymentMethod_recoversAnEscalatedRenewal() {
    var subscription = subscribe("white-label-course", "tok_decline", 14);
    Instant trialEnd = JAN_1.plus(Duration.ofDays(14));
    clock.set(trialEnd);
    billingCycle.run();
    clock.advance(Duration.ofDays(1));
    billingCycle.run();
    clock.advance(Duration.ofDays(2));
    billingCycle.run();
    assertThat(reload(subscription).isRequiresManualIntervention()).isTrue();

    asOwner(() -> subscriptionService.updatePaymentMethod(subscription.getId(), "tok_visa"));
    var result = billingCycle.run();

    assertThat(result.processed()).contains(subscription.getId());
    var invoice = renewalInvoice(subscription);
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
    assertThat(invoice.getDeclinedAttempts()).isEqualTo(3);
    assertThat(paymentProcessor.callCount(invoice.eventKey() + ":retry-3")).isEqualTo(1);
    var recovered = reload(subscription);
    assertThat(recovered.isInDunning()).isFalse();
    assertThat(recovered.getCurrentPeriodStart()).isEqualTo(trialEnd);
    assertThat(revenueLedger.findById(invoice.eventKey())).isPresent();
  }

  @Test
  void pausedAndCanceledSubscriptions_areNotBilled() {
    var paused = subscribe("white-label-course", "tok_visa", 0);
    var canceled = subscribe("white-label-course", "tok_visa", 0);
    asOwner(() -> subscriptionService.pause(paused.getId(), Duration.ofDays(90)));
    asOwner(() -> subscriptionService.cancel(canceled.getId(), CancellationReason.USER_REQUESTED));
    clock.set(FEB_1);

    var result = billingCycle.run();

    assertThat(result.processed()).doesNotContain(paused.getId(), canceled.getId());
    assertThat(result.failed()).doesNotContain(paused.getId(), canceled.getId());
  }

  @Test
  void cancel_withoutARunningCycleReportsFalse() {
    assertThat(billingOrchestrator.cancelRunningCycle()).isFalse();
  }
}
