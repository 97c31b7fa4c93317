package io.fairway.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fairway.platform.analytics.AnalyticsAggregator;
import io.fairway.platform.audit.AuditEventFilter;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.billing.AutomatedBillingCycle;
import io.fairway.platform.billing.BillingOrchestrator;
import io.fairway.platform.customer.Customer;
import io.fairway.platform.exception.CrossTenantViolationException;
import io.fairway.platform.ledger.DateRange;
import io.fairway.platform.ledger.RevenueLedger;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.multitenancy.TenantContext;
import io.fairway.platform.security.ResolvedIdentity;
import io.fairway.platform.security.Roles;
import io.fairway.platform.subscription.BillingCycle;
import io.fairway.platform.subscription.Subscription;
import io.fairway.platform.subscription.SubscriptionService;
import io.fairway.platform.tenant.CreateTenantRequest;
import io.fairway.platform.tenant.TenantRegistry;
import io.fairway.platform.tenant.TenantType;
import io.fairway.platform.testutil.MutableClock;
import io.fairway.platform.testutil.TestClockConfiguration;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * A golf course on the white-label plan: a negotiated monthly price plus a one-time setup fee,
 * renewed once by the billing cycle, with a neighbouring course trying to read its data.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WhiteLabelRevenueIntegrationTest {

  private static final Instant FEB_1 = Instant.parse("2025-02-01T00:00:00Z");
  private static final Instant MAR_1 = Instant.parse("2025-03-01T00:00:00Z");

  @Autowired private TenantRegistry tenantRegistry;
  @Autowired private BillingOrchestrator billingOrchestrator;
  @Autowired private SubscriptionService subscriptionService;
  @Autowired private RevenueLedger revenueLedger;
  @Autowired private AnalyticsAggregator analyticsAggregator;
  @Autowired private AuditService auditService;
  @Autowired private MutableClock clock;

  private String clubId;
  private String neighbourId;
  private ResolvedIdentity clubOwner;
  private ResolvedIdentity neighbourOwner;
  private Customer clubAccount;
  private Subscription whiteLabel;

  @BeforeAll
  void onboardClub() {
    clock.set(TestClockConfiguration.START);
    clubId = provision("golf-club-42");
    neighbourId = provision("golf-club-43");
    clubOwner = new ResolvedIdentity("user_42", clubId, Set.of(Roles.OWNER));
    neighbourOwner = new ResolvedIdentity("user_43", neighbourId, Set.of(Roles.OWNER));

    TenantContext.runAs(
        clubOwner,
        () -> {
          clubAccount =
              billingOrchestrator.createCustomer(
                  "billing@golf-club-42.example", "Golf Club 42", Map.of(), "tok_visa");
          whiteLabel =
              subscriptionService.create(
                  clubAccount.getId(),
                  "white-label-course",
                  BillingCycle.MONTHLY,
                  new BigDecimal("1500"),
                  0,
                  null);
          billingOrchestrator.recordSetupFee(
              clubAccount.getId(),
              "setup:golf-club-42",
              new BigDecimal("1000"),
              "USD",
              RevenueStream.WHITE_LABEL);
        });

    clock.set(FEB_1);
    var cycle = billingOrchestrator.runAutomatedBillingCycle();
    assertThat(cycle.processed()).contains(whiteLabel.getId());
  }

  private String provision(String slug) {
    var tenant =
        tenantRegistry.createTenant(
            new CreateTenantRequest(slug, slug, TenantType.GOLF_COURSE, null, null, null, null));
    tenantRegistry.activate(tenant.getId());
    return tenant.getId().toString();
  }

  @Test
  void ledger_holdsTheSetupFeeAndTwoMonthsOfSubscription() {
    var metrics =
        revenueLedger.metrics(clubId, new DateRange(TestClockConfiguration.START, MAR_1));

    assertThat(metrics.recurringRevenue()).isGreaterThanOrEqualTo(new BigDecimal("1500"));
    assertThat(metrics.totalRevenue()).isGreaterThanOrEqualTo(new BigDecimal("2500"));
    assertThat(metrics.totalRevenue()).isEqualByComparingTo("4000.00");
    assertThat(metrics.customerCount()).isEqualTo(1);
    assertThat(revenueLedger.findById(AutomatedBillingCycle.renewalKey(whiteLabel.getId(), FEB_1)))
        .isPresent();
  }

  @Test
  void analytics_reportTheNegotiatedPrice() {
    var mrr = analyticsAggregator.mrr(clubId, FEB_1);
    assertThat(mrr.mrr()).isEqualByComparingTo("1500.00");

    var breakdown = analyticsAggregator.breakdown(clubId, DateRange.until(MAR_1));
    assertThat(breakdown.total()).isEqualByComparingTo("4000.00");
  }

  @Test
  void neighbour_cannotReadTheClubsRecords() {
    var customerId = clubAccount.getId();
    var subscriptionId = whiteLabel.getId();

    assertThatThrownBy(
            () ->
                TenantContext.callAs(
                    neighbourOwner, () -> billingOrchestrator.getCustomer(customerId)))
        .isInstanceOf(CrossTenantViolationException.class);
    assertThatThrownBy(
            () ->
                TenantContext.callAs(
                    neighbourOwner, () -> subscriptionService.get(subscriptionId)))
        .isInstanceOf(CrossTenantViolationException.class);
    assertThat(
            auditService.findEvents(
                neighbourId, AuditEventFilter.byEventType("security.cross_tenant_violation")))
        .hasSizeGreaterThanOrEqualTo(2);
  }

  @Test
  void neighbour_seesNothingOfTheClubInItsOwnReports() {
    var metrics = revenueLedger.metrics(neighbourId, DateRange.all());

    assertThat(metrics.eventCount()).isZero();
    assertThat(analyticsAggregator.mrr(neighbourId, FEB_1).subscriptions()).isEmpty();
  }
}
