package io.fairway.platform.export;

import static io.fairway.platform.testutil.TestJwts.tenantJwt;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.fairway.platform.billing.BillingOrchestrator;
import io.fairway.platform.multitenancy.TenantContext;
import io.fairway.platform.security.ResolvedIdentity;
import io.fairway.platform.security.Roles;
import io.fairway.platform.subscription.BillingCycle;
import io.fairway.platform.subscription.SubscriptionService;
import io.fairway.platform.tenant.CreateTenantRequest;
import io.fairway.platform.tenant.TenantRegistry;
import io.fairway.platform.tenant.TenantType;
import io.fairway.platform.testutil.MutableClock;
import io.fairway.platform.testutil.TestClockConfiguration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TenantExportIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private TenantRegistry tenantRegistry;
  @Autowired private BillingOrchestrator billingOrchestrator;
  @Autowired private SubscriptionService subscriptionService;
  @Autowired private MutableClock clock;

  private String slug;
  private String tenantId;
  private String otherTenantId;

  @BeforeAll
  void seedTenant() {
    clock.set(TestClockConfiguration.START);
    slug = "export-" + UUID.randomUUID().toString().substring(0, 8);
    tenantId = provision(slug);
    otherTenantId = provision("export-other-" + UUID.randomUUID().toString().substring(0, 8));

    var owner = new ResolvedIdentity("user_owner", tenantId, Set.of(Roles.OWNER));
    TenantContext.runAs(
        owner,
        () -> {
          var customer =
              billingOrchestrator.createCustomer(
                  "golfer@" + slug + ".example", "Golfer", Map.of(), "tok_visa_secret");
          subscriptionService.create(
              customer.getId(), "golfer-premium", BillingCycle.MONTHLY, null, 0, null);
        });
  }

  private String provision(String tenantSlug) {
    var tenant =
        tenantRegistry.createTenant(
            new CreateTenantRequest(
                tenantSlug, tenantSlug, TenantType.GOLF_COURSE, null, null, null, null));
    tenantRegistry.activate(tenant.getId());
    return tenant.getId().toString();
  }

  @Test
  void export_containsEveryCollectionOfTheTenant() throws Exception {
    mockMvc
        .perform(
            get("/api/admin/tenants/" + tenantId + "/export")
                .with(tenantJwt("user_owner", tenantId, "owner")))
        .andExpect(status().isOk())
        .andExpect(
            header()
                .string(
                    "Content-Disposition",
                    "attachment; filename=\"tenant-" + slug + "-export.json\""))
        .andExpect(jsonPath("$.tenant.slug").value(slug))
        .andExpect(jsonPath("$.customers", hasSize(1)))
        .andExpect(jsonPath("$.customers[0].email").value("golfer@" + slug + ".example"))
        .andExpect(jsonPath("$.subscriptions", hasSize(1)))
        .andExpect(jsonPath("$.subscriptions[0].tierId").value("golfer-premium"))
        .andExpect(jsonPath("$.revenueEvents", hasSize(1)))
        .andExpect(jsonPath("$.revenueEvents[0].type").value("SUBSCRIPTION_CREATED"));
  }

  @Test
  void export_neverContainsPaymentTokens() throws Exception {
    mockMvc
        .perform(
            get("/api/admin/tenants/" + tenantId + "/export")
                .with(tenantJwt("user_admin", tenantId, "admin")))
        .andExpect(status().isOk())
        .andExpect(content().string(not(containsString("tok_visa_secret"))));
  }

  @Test
  void export_ofAnotherTenant_isForbidden() throws Exception {
    mockMvc
        .perform(
            get("/api/admin/tenants/" + tenantId + "/export")
                .with(tenantJwt("user_owner", otherTenantId, "owner")))
        .andExpect(status().isForbidden());
  }

  @Test
  void export_byBillingRole_isForbidden() throws Exception {
    mockMvc
        .perform(
            get("/api/admin/tenants/" + tenantId + "/export")
                .with(tenantJwt("user_billing", tenantId, "billing")))
        .andExpect(status().isForbidden());
  }
}
