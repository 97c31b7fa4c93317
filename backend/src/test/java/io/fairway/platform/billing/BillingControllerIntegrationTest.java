package io.fairway.platform.billing;

import static io.fairway.platform.testutil.TestJwts.platformAdminJwt;
import static io.fairway.platform.testutil.TestJwts.tenantJwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.fairway.platform.tenant.CreateTenantRequest;
import io.fairway.platform.tenant.TenantRegistry;
import io.fairway.platform.tenant.TenantType;
import io.fairway.platform.testutil.MutableClock;
import io.fairway.platform.testutil.TestClockConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class BillingControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private TenantRegistry tenantRegistry;
  @Autowired private MutableClock clock;

  private String tenantId;
  private String otherTenantId;

  @BeforeAll
  void provisionTenants() {
    tenantId = provision("billing-course");
    otherTenantId = provision("billing-other");
  }

  @BeforeEach
  void resetClock() {
    clock.set(TestClockConfiguration.START);
  }

  private String provision(String prefix) {
    String slug = prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    var tenant =
        tenantRegistry.createTenant(
            new CreateTenantRequest(slug, slug, TenantType.GOLF_COURSE, null, null, null, null));
    tenantRegistry.activate(tenant.getId());
    return tenant.getId().toString();
  }

  private JwtRequestPostProcessor ownerJwt() {
    return tenantJwt("user_owner", tenantId, "owner");
  }

  // --- Customers ---

  @Test
  void createCustomer_hidesThePaymentToken() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/customers")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "%s", "displayName": "Ana", "paymentMethod": "tok_visa"}
                    """
                        .formatted(uniqueEmail())))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.tenantId").value(tenantId))
        .andExpect(jsonPath("$.hasPaymentMethod").value(true))
        .andExpect(jsonPath("$.paymentMethod").doesNotExist());
  }

  @Test
  void createCustomer_withDuplicateEmail_returns409() throws Exception {
    String email = uniqueEmail();
    createCustomer(email, "tok_visa");

    mockMvc
        .perform(
            post("/api/admin/customers")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "%s", "displayName": "Again"}
                    """
                        .formatted(email)))
        .andExpect(status().isConflict());
  }

  @Test
  void getCustomer_fromAnotherTenant_isForbidden() throws Exception {
    String customerId = createCustomer(uniqueEmail(), "tok_visa");

    mockMvc
        .perform(
            get("/api/admin/customers/" + customerId)
                .with(tenantJwt("user_other", otherTenantId, "owner")))
        .andExpect(status().isForbidden());
  }

  // --- Subscriptions ---

  @Test
  void subscription_createdThroughTheApi_isChargedAndPausable() throws Exception {
    String customerId = createCustomer(uniqueEmail(), "tok_visa");

    var created =
        mockMvc
            .perform(
                post("/api/admin/subscriptions")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"customerId": "%s", "tierId": "golfer-premium"}
                        """
                            .formatted(customerId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.price").value(9.99))
            .andExpect(jsonPath("$.currentPeriodEnd").value("2025-02-01T00:00:00Z"))
            .andReturn();
    String subscriptionId = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            post("/api/admin/subscriptions/" + subscriptionId + "/pause")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"days": 7}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PAUSED"))
        .andExpect(jsonPath("$.pausedUntil").value("2025-01-08T00:00:00Z"));

    mockMvc
        .perform(post("/api/admin/subscriptions/" + subscriptionId + "/resume").with(ownerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ACTIVE"));
  }

  @Test
  void subscription_withDecliningCard_returns402() throws Exception {
    String customerId = createCustomer(uniqueEmail(), "tok_decline_insufficient_funds");

    mockMvc
        .perform(
            post("/api/admin/subscriptions")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"customerId": "%s", "tierId": "golfer-premium"}
                    """
                        .formatted(customerId)))
        .andExpect(status().isPaymentRequired());
  }

  @Test
  void subscription_withUnknownTier_returns400() throws Exception {
    String customerId = createCustomer(uniqueEmail(), "tok_visa");

    mockMvc
        .perform(
            post("/api/admin/subscriptions")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"customerId": "%s", "tierId": "platinum-forever"}
                    """
                        .formatted(customerId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void cancel_withoutReason_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/subscriptions/" + UUID.randomUUID() + "/cancel")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void tiers_areListedForAnyAuthenticatedCaller() throws Exception {
    mockMvc
        .perform(
            get("/api/admin/subscriptions/tiers")
                .with(tenantJwt("user_member", tenantId, "member")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").exists());
  }

  // --- Charges and refunds ---

  @Test
  void addOnCharge_thenPartialRefunds_upToTheChargedAmount() throws Exception {
    String customerId = createCustomer(uniqueEmail(), "tok_visa");
    String eventId = "addon:" + UUID.randomUUID();

    mockMvc
        .perform(
            post("/api/admin/billing/charges")
                .with(tenantJwt("user_billing", tenantId, "billing"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"customerId": "%s", "eventId": "%s", "type": "ADD_ON_PURCHASE",
                     "amount": 40.00, "currency": "USD", "stream": "CONSUMER"}
                    """
                        .formatted(customerId, eventId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(eventId))
        .andExpect(jsonPath("$.amount").value(40.0));

    mockMvc
        .perform(refund(eventId, "25.00"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.type").value("REFUND"))
        .andExpect(jsonPath("$.amount").value(-25.0));

    mockMvc.perform(refund(eventId, "20.00")).andExpect(status().isBadRequest());
    mockMvc.perform(refund(eventId, "15.00")).andExpect(status().isCreated());
  }

  @Test
  void charge_ofRecurringType_returns400() throws Exception {
    String customerId = createCustomer(uniqueEmail(), "tok_visa");

    mockMvc
        .perform(
            post("/api/admin/billing/charges")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"customerId": "%s", "type": "SUBSCRIPTION_RENEWED",
                     "amount": 10.00, "currency": "USD"}
                    """
                        .formatted(customerId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void manualEvent_withWrongSign_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/billing/events")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "SETUP_FEE", "amount": -10.00, "currency": "USD",
                     "reason": "migration fix"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void manualMigrationEvent_isRecordedForTheCallersTenant() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/billing/events")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "MIGRATION", "amount": -12.50, "currency": "USD",
                     "reason": "imported from legacy billing"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.tenantId").value(tenantId))
        .andExpect(jsonPath("$.source").value("MANUAL"));
  }

  // --- Invoices ---

  @Test
  void invoice_sentAndPaid() throws Exception {
    String customerId = createCustomer(uniqueEmail(), "tok_visa");

    var created =
        mockMvc
            .perform(
                post("/api/admin/invoices")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"customerId": "%s", "currency": "USD", "dueDate": "2025-01-31",
                         "lines": [
                           {"description": "Range balls", "unitAmount": 5.00, "quantity": 3},
                           {"description": "Locker", "unitAmount": 20.00}
                         ]}
                        """
                            .formatted(customerId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("DRAFT"))
            .andExpect(jsonPath("$.total").value(35.0))
            .andReturn();
    String invoiceId = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            post("/api/admin/invoices/" + invoiceId + "/pay")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isConflict());

    mockMvc
        .perform(post("/api/admin/invoices/" + invoiceId + "/send").with(ownerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SENT"));

    mockMvc
        .perform(
            post("/api/admin/invoices/" + invoiceId + "/pay")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PAID"))
        .andExpect(jsonPath("$.paymentReference").exists());
  }

  // --- Platform operations ---

  @Test
  void billingCycle_isAPlatformOperation() throws Exception {
    mockMvc
        .perform(post("/api/admin/billing/cycle").with(ownerJwt()))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(post("/api/admin/billing/cycle").with(platformAdminJwt("user_operator")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.processed").isArray());

    mockMvc
        .perform(post("/api/admin/billing/cycle/cancel").with(platformAdminJwt("user_operator")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelRequested").value(false));
  }

  // --- Member access ---

  @Test
  void assignedBillingRole_opensTheCustomerList() throws Exception {
    String memberId = "user_member_" + UUID.randomUUID().toString().substring(0, 8);
    var memberJwt = tenantJwt(memberId, tenantId, "member");

    mockMvc.perform(get("/api/admin/customers").with(memberJwt)).andExpect(status().isForbidden());

    mockMvc
        .perform(
            post("/api/admin/tenants/" + tenantId + "/role-assignments")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"userId": "%s", "role": "billing"}
                    """
                        .formatted(memberId)))
        .andExpect(status().isCreated());

    mockMvc.perform(get("/api/admin/customers").with(memberJwt)).andExpect(status().isOk());
  }

  @Test
  void member_readsOnlyTheSubscriptionOfTheirOwnCustomer() throws Exception {
    String memberId = "user_member_" + UUID.randomUUID().toString().substring(0, 8);
    String ownSubscription = subscribe(createCustomerFor(memberId));
    String otherSubscription = subscribe(createCustomer(uniqueEmail(), "tok_visa"));
    var memberJwt = tenantJwt(memberId, tenantId, "member");

    mockMvc
        .perform(get("/api/admin/subscriptions/" + ownSubscription).with(memberJwt))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(ownSubscription));
    mockMvc
        .perform(get("/api/admin/subscriptions/" + otherSubscription).with(memberJwt))
        .andExpect(status().isForbidden());
  }

  // --- Helpers ---

  private String createCustomer(String email, String paymentMethod) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/admin/customers")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"email": "%s", "displayName": "Golfer", "paymentMethod": "%s"}
                        """
                            .formatted(email, paymentMethod)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private String createCustomerFor(String userId) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/admin/customers")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"email": "%s", "displayName": "Member", "paymentMethod": "tok_visa",
                         "userId": "%s"}
                        """
                            .formatted(uniqueEmail(), userId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.userId").value(userId))
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private String subscribe(String customerId) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/admin/subscriptions")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"customerId": "%s", "tierId": "golfer-premium"}
                        """
                            .formatted(customerId)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private MockHttpServletRequestBuilder refund(String eventId, String amount) {
    return post("/api/admin/billing/refunds")
        .with(ownerJwt())
        .contentType(MediaType.APPLICATION_JSON)
        .content(
            """
            {"eventId": "%s", "amount": %s, "reason": "rain-out"}
            """
                .formatted(eventId, amount));
  }

  private static String uniqueEmail() {
    return "golfer-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
  }
}
